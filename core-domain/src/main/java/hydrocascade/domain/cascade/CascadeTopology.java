package hydrocascade.domain.cascade;

import hydrocascade.domain.exception.InvalidTopologyException;
import hydrocascade.domain.reservoir.Reservoir;
import lombok.Builder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Descripción estática e inmutable de una cascada de embalses.
 * <p>
 * Se construye una única vez por el cargador de topologías y no se modifica durante
 * las simulaciones.
 *
 * @param cascadeId          Identificador de la cascada.
 * @param cascadeName        Nombre descriptivo (opcional).
 * @param riverSystem        Sistema fluvial (opcional).
 * @param baId               Área de balance a la que pertenece (opcional).
 * @param region             Región (opcional).
 * @param reservoirs         Embalses por identificador, en orden de declaración.
 * @param links              Enlaces aguas arriba / aguas abajo por identificador.
 * @param resolutionOrder    Orden topológico: cada embalse aparece después de todos sus embalses aguas arriba.
 */
@Builder
public record CascadeTopology(
        String cascadeId,
        String cascadeName,
        String riverSystem,
        String baId,
        String region,
        Map<String, Reservoir> reservoirs,
        Map<String, ReservoirLinks> links,
        List<String> resolutionOrder
) {

    public CascadeTopology {
        Objects.requireNonNull(cascadeId, "El identificador de la cascada no puede ser nulo.");
        reservoirs = Collections.unmodifiableMap(new LinkedHashMap<>(reservoirs == null ? Map.of() : reservoirs));
        links = Collections.unmodifiableMap(new LinkedHashMap<>(links == null ? Map.of() : links));
        resolutionOrder = resolutionOrder == null ? List.copyOf(reservoirs.keySet()) : List.copyOf(resolutionOrder);
    }

    /**
     * @throws InvalidTopologyException si el embalse no pertenece a la cascada.
     */
    public Reservoir reservoir(String reservoirId) {
        Reservoir reservoir = reservoirs.get(reservoirId);
        if (reservoir == null) {
            throw new InvalidTopologyException(
                    "Reservoir " + reservoirId + " is not part of cascade " + cascadeId);
        }
        return reservoir;
    }

    public List<String> upstreamOf(String reservoirId) {
        return links.getOrDefault(reservoirId, ReservoirLinks.NONE).upstream();
    }

    public List<String> downstreamOf(String reservoirId) {
        return links.getOrDefault(reservoirId, ReservoirLinks.NONE).downstream();
    }

    public int size() {
        return reservoirs.size();
    }
}
