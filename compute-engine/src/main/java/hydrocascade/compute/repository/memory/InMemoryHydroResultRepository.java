package hydrocascade.compute.repository.memory;

import hydrocascade.compute.repository.HydroResultRepository;
import hydrocascade.compute.repository.ReservoirStateRepository;
import hydrocascade.domain.dto.preprocessing.HydroCascadeRecord;
import hydrocascade.domain.reservoir.ReservoirState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Tabla de resultados en memoria. También sirve los estados iniciales de la siguiente
 * ejecución: el último registro de cada embalse anterior al inicio de la ventana.
 */
@Slf4j
@Repository
public class InMemoryHydroResultRepository implements HydroResultRepository, ReservoirStateRepository {

    private final List<HydroCascadeRecord> records = new CopyOnWriteArrayList<>();

    @Override
    public int deleteCase(String caseId) {
        List<HydroCascadeRecord> toDelete = records.stream()
                .filter(r -> caseId.equals(r.caseId()))
                .toList();
        records.removeAll(toDelete);
        log.debug("Borrados {} registros del caso {}", toDelete.size(), caseId);
        return toDelete.size();
    }

    @Override
    public void insertBatch(List<HydroCascadeRecord> batch) {
        records.addAll(batch);
    }

    @Override
    public List<HydroCascadeRecord> findByCase(String caseId) {
        return records.stream().filter(r -> caseId.equals(r.caseId())).toList();
    }

    @Override
    public Map<String, ReservoirState> findLatestStatesBefore(String cascadeId, Instant before) {
        Map<String, HydroCascadeRecord> latest = new HashMap<>();
        records.stream()
                .filter(r -> cascadeId.equals(r.cascadeId()))
                .filter(r -> r.timestamp() != null && r.timestamp().isBefore(before))
                .sorted(Comparator.comparing(HydroCascadeRecord::timestamp).reversed())
                .forEach(r -> latest.putIfAbsent(r.reservoirId(), r));

        Map<String, ReservoirState> states = new HashMap<>();
        latest.forEach((reservoirId, r) -> states.put(reservoirId, ReservoirState.builder()
                .reservoirId(reservoirId)
                .timestamp(before)
                .storageAf(r.storageAf())
                .elevationFeet(r.elevationFeet())
                .inflowCfs(r.inflowCfs())
                .releaseCfs(r.releaseCfs())
                .generationMw(r.generationMw())
                .headFeet(r.headFeet())
                .efficiencyPercent(r.efficiencyPercent())
                .build()));
        return states;
    }
}
