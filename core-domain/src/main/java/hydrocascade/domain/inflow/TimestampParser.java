package hydrocascade.domain.inflow;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Optional;

/**
 * Normaliza marcas de tiempo textuales a {@link Instant} UTC.
 * <p>
 * Acepta fecha-hora ISO con o sin desplazamiento ({@code +HH:MM}, {@code +HHMM} o {@code +HH}),
 * separador 'T' o espacio, y fechas sin hora. Una marca sin zona se interpreta como UTC.
 */
public final class TimestampParser {

    private static final DateTimeFormatter FLEXIBLE_DATE_TIME = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart().appendLiteral('T').optionalEnd()
            .optionalStart().appendLiteral(' ').optionalEnd()
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            // +HH:MM[:ss], +HHMM (ISO básico) y +HH (salida textual de Postgres)
            .optionalStart().appendOffset("+HH:MM:ss", "Z").optionalEnd()
            .optionalStart().appendOffset("+HHMM", "Z").optionalEnd()
            .optionalStart().appendOffset("+HH", "Z").optionalEnd()
            .toFormatter();

    private static final int ISO_DATE_LENGTH = "yyyy-MM-dd".length();

    private TimestampParser() {}

    /**
     * @return El instante, o vacío si el texto no es una marca de tiempo reconocible.
     */
    public static Optional<Instant> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String trimmed = text.trim();
        try {
            if (trimmed.length() == ISO_DATE_LENGTH) {
                return Optional.of(LocalDate.parse(trimmed).atStartOfDay().toInstant(ZoneOffset.UTC));
            }
            TemporalAccessor parsed = FLEXIBLE_DATE_TIME.parseBest(trimmed, OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime offsetDateTime) {
                return Optional.of(offsetDateTime.toInstant());
            }
            return Optional.of(((LocalDateTime) parsed).toInstant(ZoneOffset.UTC));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
