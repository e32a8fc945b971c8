package hydrocascade.compute.repository;

import hydrocascade.domain.reservoir.ReservoirState;

import java.time.Instant;
import java.util.Map;

public interface ReservoirStateRepository {

    /**
     * Último estado conocido de cada embalse de la cascada anterior a {@code before}.
     * Los estados devueltos llevan como instante {@code before}.
     */
    Map<String, ReservoirState> findLatestStatesBefore(String cascadeId, Instant before);
}
