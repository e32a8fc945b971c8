package hydrocascade.physics.simulator;

import hydrocascade.domain.cascade.CascadeTopology;
import hydrocascade.domain.exception.CascadeNotLoadedException;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registro de topologías cargadas, indexado por identificador de cascada.
 * <p>
 * Pertenece a una instancia de {@link MassBalanceCalculator}. Registrar una cascada ya
 * existente sustituye la entrada anterior. Thread-Safe.
 */
@Slf4j
public class TopologyRegistry {

    private final Map<String, CascadeTopology> topologies = new ConcurrentHashMap<>();

    public void register(CascadeTopology topology) {
        CascadeTopology previous = topologies.put(topology.cascadeId(), topology);
        if (previous != null) {
            log.info("Topología de la cascada {} reemplazada ({} → {} embalses)",
                    topology.cascadeId(), previous.size(), topology.size());
        }
    }

    public Optional<CascadeTopology> find(String cascadeId) {
        return Optional.ofNullable(cascadeId).map(topologies::get);
    }

    /**
     * @throws CascadeNotLoadedException si la cascada no se ha cargado.
     */
    public CascadeTopology require(String cascadeId) {
        return find(cascadeId).orElseThrow(() -> new CascadeNotLoadedException(cascadeId));
    }

    public boolean contains(String cascadeId) {
        return find(cascadeId).isPresent();
    }

    public Set<String> cascadeIds() {
        return Set.copyOf(topologies.keySet());
    }

    public int size() {
        return topologies.size();
    }
}
