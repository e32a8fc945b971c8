package hydrocascade.domain.inflow;

import java.time.Instant;
import java.util.Objects;

/**
 * Aportación directa (sin contar embalses aguas arriba) observada en un embalse.
 *
 * @param reservoirId Embalse receptor.
 * @param timestamp   Instante UTC de la observación.
 * @param inflowCfs   Caudal [cfs].
 */
public record InflowObservation(String reservoirId, Instant timestamp, double inflowCfs) {

    public InflowObservation {
        Objects.requireNonNull(reservoirId, "El embalse de la observación no puede ser nulo.");
        Objects.requireNonNull(timestamp, "El instante de la observación no puede ser nulo.");
    }
}
