package hydrocascade.compute.repository;

import hydrocascade.domain.dto.preprocessing.HydroCascadeRecord;

import java.util.List;

public interface HydroResultRepository {

    /**
     * Borra los registros de un caso de planificación.
     *
     * @return Registros borrados.
     */
    int deleteCase(String caseId);

    void insertBatch(List<HydroCascadeRecord> records);

    List<HydroCascadeRecord> findByCase(String caseId);
}
