package hydrocascade.compute.repository.memory;

import hydrocascade.compute.repository.InflowRepository;
import hydrocascade.domain.inflow.RawInflowRow;
import hydrocascade.domain.inflow.TimestampParser;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Almacén de aportaciones en memoria, agrupado por cascada.
 * <p>
 * Las filas cuyo instante no se puede interpretar se devuelven igualmente: descartarlas es
 * responsabilidad de la ingesta.
 */
@Repository
public class InMemoryInflowRepository implements InflowRepository {

    private final Map<String, List<RawInflowRow>> rowsByCascade = new ConcurrentHashMap<>();

    public void addAll(String cascadeId, Collection<RawInflowRow> rows) {
        rowsByCascade.computeIfAbsent(cascadeId, id -> new CopyOnWriteArrayList<>()).addAll(rows);
    }

    @Override
    public List<RawInflowRow> findInflows(String cascadeId, Instant start, Instant end) {
        List<RawInflowRow> result = new ArrayList<>();
        for (RawInflowRow row : rowsByCascade.getOrDefault(cascadeId, List.of())) {
            boolean inWindow = TimestampParser.parse(row.timestamp())
                    .map(t -> !t.isBefore(start) && t.isBefore(end))
                    .orElse(true);
            if (inWindow) {
                result.add(row);
            }
        }
        return result;
    }
}
