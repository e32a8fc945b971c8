package hydrocascade.compute.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Ventana semiabierta {@code [start, end)} alineada a la hora en UTC.
 */
public record PreprocessingWindow(Instant start, Instant end) {

    static final Duration DEFAULT_SPAN = Duration.ofDays(365);
    static final Duration MINIMUM_SPAN = Duration.ofDays(1);

    /**
     * Sin inicio se toma un año antes de la hora actual; sin fin, un año después del inicio.
     * Un fin no posterior al inicio se sustituye por inicio + 1 día.
     */
    public static PreprocessingWindow normalize(Instant requestedStart, Instant requestedEnd, Clock clock) {
        Instant start = requestedStart != null
                ? truncate(requestedStart)
                : truncate(clock.instant()).minus(DEFAULT_SPAN);
        Instant end = requestedEnd != null
                ? truncate(requestedEnd)
                : start.plus(DEFAULT_SPAN);
        if (!end.isAfter(start)) {
            end = start.plus(MINIMUM_SPAN);
        }
        return new PreprocessingWindow(start, end);
    }

    private static Instant truncate(Instant instant) {
        return instant.truncatedTo(ChronoUnit.HOURS);
    }
}
