package hydrocascade.compute.repository;

import hydrocascade.domain.inflow.RawInflowRow;

import java.time.Instant;
import java.util.List;

public interface InflowRepository {

    /**
     * Filas de aportaciones observadas de una cascada en {@code [start, end)}, sin validar.
     */
    List<RawInflowRow> findInflows(String cascadeId, Instant start, Instant end);
}
