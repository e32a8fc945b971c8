package hydrocascade.compute.repository.memory;

import hydrocascade.domain.dto.preprocessing.HydroCascadeRecord;
import hydrocascade.domain.inflow.RawInflowRow;
import hydrocascade.domain.reservoir.ReservoirState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryHydroResultRepositoryTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private static HydroCascadeRecord record(String caseId, String reservoirId, Instant timestamp, double storageAf) {
        return HydroCascadeRecord.builder()
                .caseId(caseId)
                .cascadeId("C")
                .reservoirId(reservoirId)
                .timestamp(timestamp)
                .storageAf(storageAf)
                .releaseCfs(10.0)
                .build();
    }

    @Test
    @DisplayName("El último registro anterior a la ventana se convierte en estado inicial")
    void latestStatesBefore_shouldPickMostRecentPerReservoir() {
        InMemoryHydroResultRepository repository = new InMemoryHydroResultRepository();
        Instant before = T0.plusSeconds(7_200);
        repository.insertBatch(List.of(
                record("case", "A", T0, 100.0),
                record("case", "A", T0.plusSeconds(3_600), 110.0),
                record("case", "A", before, 999.0),
                record("case", "B", T0, 50.0)));

        Map<String, ReservoirState> states = repository.findLatestStatesBefore("C", before);

        assertThat(states).containsOnlyKeys("A", "B");
        assertThat(states.get("A").storageAf()).isEqualTo(110.0);
        assertThat(states.get("A").timestamp()).isEqualTo(before);
        assertThat(states.get("B").releaseCfs()).isEqualTo(10.0);
        assertThat(repository.findLatestStatesBefore("OTHER", before)).isEmpty();
    }

    @Test
    @DisplayName("Borrar un caso sólo elimina sus registros")
    void deleteCase_shouldOnlyRemoveThatCase() {
        InMemoryHydroResultRepository repository = new InMemoryHydroResultRepository();
        repository.insertBatch(List.of(record("a", "A", T0, 1.0), record("a", "B", T0, 1.0), record("b", "A", T0, 1.0)));

        assertThat(repository.deleteCase("a")).isEqualTo(2);
        assertThat(repository.findByCase("a")).isEmpty();
        assertThat(repository.findByCase("b")).hasSize(1);
    }

    @Test
    @DisplayName("El almacén de aportaciones filtra por ventana y deja pasar los instantes ilegibles")
    void inflowRepository_shouldFilterWindow() {
        InMemoryInflowRepository repository = new InMemoryInflowRepository();
        repository.addAll("C", List.of(
                new RawInflowRow("2024-01-01T00:00:00Z", "A", 1.0),
                new RawInflowRow("2024-01-01T05:00:00Z", "A", 2.0),
                new RawInflowRow("garbage", "A", 3.0)));

        List<RawInflowRow> rows = repository.findInflows("C", T0, T0.plusSeconds(3_600));

        assertThat(rows).extracting(RawInflowRow::inflowCfs).containsExactly(1.0, 3.0);
        assertThat(repository.findInflows("OTHER", T0, T0.plusSeconds(3_600))).isEmpty();
    }
}
