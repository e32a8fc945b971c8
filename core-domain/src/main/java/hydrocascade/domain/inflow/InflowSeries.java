package hydrocascade.domain.inflow;

import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Serie de aportaciones directas agrupada por instante, en orden cronológico ascendente.
 * <p>
 * Inmutable. Para cada par (instante, embalse) se conserva la primera observación recibida.
 */
@Slf4j
public final class InflowSeries {

    private static final InflowSeries EMPTY = new InflowSeries(new TreeMap<>());

    private final NavigableMap<Instant, Map<String, Double>> inflowsByTime;

    private InflowSeries(NavigableMap<Instant, Map<String, Double>> inflowsByTime) {
        this.inflowsByTime = inflowsByTime;
    }

    public static InflowSeries empty() {
        return EMPTY;
    }

    public static InflowSeries of(Collection<InflowObservation> observations) {
        NavigableMap<Instant, Map<String, Double>> grouped = new TreeMap<>();
        for (InflowObservation observation : observations) {
            grouped.computeIfAbsent(observation.timestamp(), t -> new LinkedHashMap<>())
                    .putIfAbsent(observation.reservoirId(), sanitize(observation.inflowCfs()));
        }
        return freeze(grouped);
    }

    /**
     * Ingiere filas crudas. Las filas con instante no interpretable o sin embalse se
     * descartan en silencio; los caudales nulos o no finitos cuentan como 0.
     */
    public static InflowSeries fromRawRows(List<RawInflowRow> rows) {
        NavigableMap<Instant, Map<String, Double>> grouped = new TreeMap<>();
        int dropped = 0;
        for (RawInflowRow row : rows) {
            Optional<Instant> timestamp = TimestampParser.parse(row.timestamp());
            if (timestamp.isEmpty() || row.reservoirId() == null || row.reservoirId().isBlank()) {
                dropped++;
                continue;
            }
            double inflow = row.inflowCfs() == null ? 0.0 : sanitize(row.inflowCfs());
            grouped.computeIfAbsent(timestamp.get(), t -> new LinkedHashMap<>())
                    .putIfAbsent(row.reservoirId().trim(), inflow);
        }
        if (dropped > 0) {
            log.debug("Descartadas {} filas de aportaciones no interpretables de {}", dropped, rows.size());
        }
        return freeze(grouped);
    }

    private static InflowSeries freeze(NavigableMap<Instant, Map<String, Double>> grouped) {
        if (grouped.isEmpty()) return EMPTY;
        NavigableMap<Instant, Map<String, Double>> frozen = new TreeMap<>();
        grouped.forEach((t, byReservoir) -> frozen.put(t, Collections.unmodifiableMap(byReservoir)));
        return new InflowSeries(Collections.unmodifiableNavigableMap(frozen));
    }

    private static double sanitize(double inflowCfs) {
        return Double.isFinite(inflowCfs) ? inflowCfs : 0.0;
    }

    public boolean isEmpty() {
        return inflowsByTime.isEmpty();
    }

    /**
     * Instantes de la serie en orden ascendente.
     */
    public Collection<Instant> timestamps() {
        return inflowsByTime.navigableKeySet();
    }

    public int timestepCount() {
        return inflowsByTime.size();
    }

    public int observationCount() {
        return inflowsByTime.values().stream().mapToInt(Map::size).sum();
    }

    /**
     * Aportación directa de un embalse en un instante; 0 si no hay observación.
     */
    public double inflowAt(Instant timestamp, String reservoirId) {
        Map<String, Double> byReservoir = inflowsByTime.get(timestamp);
        if (byReservoir == null) return 0.0;
        return byReservoir.getOrDefault(reservoirId, 0.0);
    }

    /**
     * Sub-serie con los instantes en {@code [start, end)}.
     */
    public InflowSeries between(Instant start, Instant end) {
        if (!end.isAfter(start)) return EMPTY;
        NavigableMap<Instant, Map<String, Double>> window = inflowsByTime.subMap(start, true, end, false);
        return window.isEmpty() ? EMPTY : new InflowSeries(Collections.unmodifiableNavigableMap(new TreeMap<>(window)));
    }
}
