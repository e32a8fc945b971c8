package hydrocascade.physics.model;

import hydrocascade.domain.inflow.InflowObservation;
import hydrocascade.domain.reservoir.Reservoir;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Genera hidrogramas sintéticos de aportación cuando no hay datos observados.
 * <p>
 * La aportación base es proporcional a la capacidad del embalse (vaciarlo en un mes)
 * y se modula con un ciclo anual (±15 %) y otro diario (±10 %).
 */
@Slf4j
public class SyntheticInflowGenerator {

    /** Aportación base [cfs] cuando el embalse no declara capacidad. */
    public static final double FALLBACK_BASE_INFLOW_CFS = 500.0;

    private static final double HOURS_PER_MONTH = 24.0 * 30.0;
    private static final double SEASONAL_AMPLITUDE = 0.15;
    private static final double DAILY_AMPLITUDE = 0.1;
    private static final double DAYS_PER_YEAR = 365.0;
    private static final double NANOS_PER_SECOND = 1e9;

    /** Máximo de instantes por serie generada. */
    static final long MAX_TIMESTEPS = Integer.MAX_VALUE - 100;

    /**
     * Genera una observación por embalse y paso en {@code [start, end)}. Si la ventana no
     * contiene ningún paso se genera uno en {@code start}.
     *
     * @param reservoirs    Embalses a alimentar.
     * @param start         Inicio de la ventana (incluido).
     * @param end           Fin de la ventana (excluido).
     * @param timeStepHours Paso de tiempo en horas.
     * @return Observaciones ordenadas por instante y, dentro de cada instante, por orden de embalse.
     * @throws IllegalArgumentException si el paso de tiempo no es positivo, se redondea a cero o
     *                                  genera más instantes de los indexables.
     */
    public List<InflowObservation> generate(Collection<Reservoir> reservoirs, Instant start, Instant end, double timeStepHours) {
        if (!(timeStepHours > 0.0)) {
            throw new IllegalArgumentException("El paso de tiempo debe ser un valor positivo.");
        }
        Duration step = Duration.ofNanos(Math.round(HydroUnits.hoursToSeconds(timeStepHours) * NANOS_PER_SECOND));
        if (step.isZero() || step.isNegative()) {
            throw new IllegalArgumentException("El paso de tiempo es demasiado pequeño: " + timeStepHours + " h");
        }
        if (end.isAfter(start) && Duration.between(start, end).dividedBy(step) > MAX_TIMESTEPS) {
            throw new IllegalArgumentException("La ventana es demasiado larga para el paso de tiempo indicado ("
                    + timeStepHours + " h).");
        }

        List<Instant> timestamps = new ArrayList<>();
        for (Instant t = start; t.isBefore(end); t = t.plus(step)) {
            timestamps.add(t);
        }
        if (timestamps.isEmpty()) {
            timestamps.add(start);
        }

        List<InflowObservation> observations = new ArrayList<>(timestamps.size() * reservoirs.size());
        for (Instant t : timestamps) {
            for (Reservoir reservoir : reservoirs) {
                observations.add(new InflowObservation(reservoir.reservoirId(), t, inflowAt(reservoir, t)));
            }
        }
        log.debug("Hidrograma sintético generado: {} pasos x {} embalses", timestamps.size(), reservoirs.size());
        return observations;
    }

    /**
     * Aportación sintética de un embalse en un instante [cfs], nunca negativa.
     */
    public double inflowAt(Reservoir reservoir, Instant timestamp) {
        ZonedDateTime utc = timestamp.atZone(ZoneOffset.UTC);
        double dayFactor = Math.sin(2.0 * Math.PI * (utc.getDayOfYear() / DAYS_PER_YEAR));
        double hourFactor = DAILY_AMPLITUDE * Math.sin(2.0 * Math.PI * (utc.getHour() / 24.0));

        double capacityAf = reservoir.capacityAf();
        double baseCfs = capacityAf > 0.0 ? capacityAf / HOURS_PER_MONTH : FALLBACK_BASE_INFLOW_CFS;

        return Math.max(0.0, baseCfs * (1.0 + SEASONAL_AMPLITUDE * dayFactor + hourFactor));
    }
}
