package hydrocascade.factory;

import hydrocascade.domain.cascade.CascadeTopology;
import hydrocascade.domain.dto.cascade.CascadeDescription;
import hydrocascade.domain.dto.cascade.ReservoirDescription;
import hydrocascade.domain.exception.InvalidTopologyException;
import hydrocascade.domain.reservoir.GenerationUnit;
import hydrocascade.domain.reservoir.Reservoir;
import hydrocascade.domain.reservoir.ReservoirType;
import hydrocascade.domain.reservoir.RuleCurve;
import hydrocascade.domain.reservoir.SeasonalRules;
import hydrocascade.physics.simulator.TopologyRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class CascadeTopologyLoaderTest {

    private TopologyRegistry registry;
    private CascadeTopologyLoader loader;

    @BeforeEach
    void setUp() {
        registry = new TopologyRegistry();
        loader = new CascadeTopologyLoader(registry);
    }

    private static ReservoirDescription.ReservoirDescriptionBuilder reservoir(String id) {
        return ReservoirDescription.builder().reservoirId(id);
    }

    private static CascadeDescription cascade(ReservoirDescription... reservoirs) {
        return CascadeDescription.builder()
                .cascadeId("C1")
                .cascadeName("Test cascade")
                .baId("BA1")
                .reservoirs(List.of(reservoirs))
                .build();
    }

    @Test
    @DisplayName("Carga y registra la cascada aplicando los valores por defecto")
    void load_shouldApplyDefaultsAndRegister() {
        // --- 1. Arrange ---
        CascadeDescription description = cascade(
                reservoir("A").maxStorageAf(1_000.0).tailwaterElevationM(10.0).build(),
                reservoir("B").build());

        // --- 2. Act ---
        CascadeTopology topology = loader.load(description);

        // --- 3. Assert ---
        assertThat(registry.require("C1")).isSameAs(topology);
        Reservoir a = topology.reservoir("A");
        assertEquals(ReservoirType.STORAGE, a.type());
        assertEquals(0.0, a.minStorageAf());
        assertEquals(1_000.0, a.maxStorageAf());
        assertEquals(32.8084, a.tailwaterElevationFeet(), 1e-9);

        Reservoir b = topology.reservoir("B");
        assertNull(b.minStorageAf());
        assertNull(b.maxStorageAf());
        assertEquals(0.0, b.tailwaterElevationFeet());
        assertThat(topology.upstreamOf("B")).isEmpty();
    }

    @Test
    @DisplayName("La capacidad métrica se convierte a acre-pies y la imperial prevalece")
    void load_shouldConvertMetricStorage() {
        CascadeTopology topology = loader.load(cascade(
                reservoir("A").activeStorageMcm(2.0).deadStorageMcm(0.5).build(),
                reservoir("B").maxStorageAf(700.0).activeStorageMcm(2.0).build()));

        assertEquals(2_466.96, topology.reservoir("A").maxStorageAf(), 1e-9);
        assertEquals(616.74, topology.reservoir("A").minStorageAf(), 1e-9);
        assertEquals(700.0, topology.reservoir("B").maxStorageAf());
    }

    @Test
    @DisplayName("Los embalses sin reglas propias heredan las de la cascada")
    void load_shouldInheritCascadeRules() {
        SeasonalRules cascadeRules = SeasonalRules.builder()
                .summerRuleCurve(RuleCurve.builder().targetStoragePercent(70.0).build())
                .build();
        SeasonalRules ownRules = SeasonalRules.builder()
                .summerRuleCurve(RuleCurve.builder().targetStoragePercent(30.0).build())
                .build();
        CascadeDescription description = cascade(
                reservoir("A").build(),
                reservoir("B").seasonalRules(ownRules).build(),
                reservoir("C").seasonalRules(SeasonalRules.EMPTY).build())
                .withSeasonalRules(cascadeRules);

        CascadeTopology topology = loader.load(description);

        assertEquals(cascadeRules, topology.reservoir("A").seasonalRules());
        assertEquals(ownRules, topology.reservoir("B").seasonalRules());
        assertEquals(cascadeRules, topology.reservoir("C").seasonalRules());
    }

    @Test
    @DisplayName("El orden de resolución coloca cada embalse después de sus embalses aguas arriba")
    void load_shouldComputeResolutionOrder() {
        // Declarados de aguas abajo a aguas arriba: C <- B <- A, y D independiente
        CascadeTopology topology = loader.load(cascade(
                reservoir("C").upstreamReservoirs(List.of("B")).build(),
                reservoir("D").build(),
                reservoir("B").upstreamReservoirs(List.of("A")).downstreamReservoirs(List.of("C")).build(),
                reservoir("A").downstreamReservoirs(List.of("B")).build()));

        assertThat(topology.resolutionOrder()).containsExactly("D", "A", "B", "C");
    }

    @Test
    @DisplayName("Un ciclo aguas arriba se rechaza al cargar")
    void load_withCycle_shouldThrow() {
        CascadeDescription description = cascade(
                reservoir("A").upstreamReservoirs(List.of("B")).build(),
                reservoir("B").upstreamReservoirs(List.of("A")).build());

        assertThatThrownBy(() -> loader.load(description))
                .isInstanceOf(InvalidTopologyException.class)
                .hasMessageContaining("cycle");
        assertThat(registry.contains("C1")).isFalse();
    }

    @Test
    @DisplayName("Un enlace a un embalse inexistente se rechaza")
    void load_withDanglingLink_shouldThrow() {
        CascadeDescription description = cascade(
                reservoir("A").downstreamReservoirs(List.of("GHOST")).build());

        assertThatThrownBy(() -> loader.load(description))
                .isInstanceOf(InvalidTopologyException.class)
                .hasMessageContaining("GHOST");
    }

    @Test
    @DisplayName("Identificadores obligatorios ausentes o duplicados se rechazan")
    void load_withMissingOrDuplicateIds_shouldThrow() {
        assertThatThrownBy(() -> loader.load(cascade(reservoir("A").build()).withCascadeId(null)))
                .isInstanceOf(InvalidTopologyException.class)
                .hasMessageContaining("cascade_id");
        assertThatThrownBy(() -> loader.load(cascade(reservoir(null).build())))
                .isInstanceOf(InvalidTopologyException.class)
                .hasMessageContaining("reservoir_id");
        assertThatThrownBy(() -> loader.load(cascade(reservoir("A").build(), reservoir("A").build())))
                .isInstanceOf(InvalidTopologyException.class)
                .hasMessageContaining("Duplicate");
    }

    @Test
    @DisplayName("Los grupos generadores suman su potencia al tope de generación")
    void load_shouldAggregateGenerationUnits() {
        List<GenerationUnit> units = List.of(
                GenerationUnit.builder().unitId("U1").capacityMw(40.0).build(),
                GenerationUnit.builder().unitId("U2").capacityMw(40.0).maxGenerationMw(35.0).build());

        CascadeTopology topology = loader.load(cascade(
                reservoir("A").maxGenerationMw(10.0).generationUnits(units).build(),
                reservoir("B").maxGenerationMw(25.0).build(),
                reservoir("C").build()));

        assertEquals(85.0, topology.reservoir("A").maxGenerationMw());
        assertThat(topology.reservoir("A").generationUnitIds()).containsExactly("U1", "U2");
        assertEquals(25.0, topology.reservoir("B").maxGenerationMw());
        assertNull(topology.reservoir("C").maxGenerationMw());
    }

    @Test
    @DisplayName("Recargar una cascada sustituye la topología registrada")
    void load_twice_shouldOverwrite() {
        loader.load(cascade(reservoir("A").build()));
        CascadeTopology second = loader.load(cascade(reservoir("A").build(), reservoir("B").build()));

        assertThat(registry.require("C1")).isSameAs(second);
        assertEquals(1, registry.size());
    }
}
