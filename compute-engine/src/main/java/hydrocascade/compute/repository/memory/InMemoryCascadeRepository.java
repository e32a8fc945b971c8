package hydrocascade.compute.repository.memory;

import hydrocascade.compute.repository.CascadeRepository;
import hydrocascade.domain.dto.cascade.CascadeDescription;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Catálogo de cascadas en memoria. Devuelve las cascadas ordenadas por identificador.
 */
@Repository
public class InMemoryCascadeRepository implements CascadeRepository {

    private final Map<String, CascadeDescription> cascades = new ConcurrentHashMap<>();

    public void save(CascadeDescription description) {
        cascades.put(description.cascadeId(), description);
    }

    @Override
    public List<CascadeDescription> findCascades(Collection<String> cascadeIds) {
        return cascades.values().stream()
                .filter(c -> cascadeIds == null || cascadeIds.isEmpty() || cascadeIds.contains(c.cascadeId()))
                .sorted(Comparator.comparing(CascadeDescription::cascadeId))
                .toList();
    }
}
