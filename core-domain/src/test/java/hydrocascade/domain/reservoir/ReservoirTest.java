package hydrocascade.domain.reservoir;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReservoirTest {

    @ParameterizedTest(name = "\"{0}\" -> {1}")
    @CsvSource({
            "storage, STORAGE",
            "RUN_OF_RIVER, RUN_OF_RIVER",
            "' pumped_storage ', PUMPED_STORAGE",
            "'', STORAGE",
            "canal, UNKNOWN"
    })
    @DisplayName("El código de tipología se traduce sin distinguir mayúsculas")
    void fromCode_shouldMapKnownCodes(String code, ReservoirType expected) {
        assertThat(ReservoirType.fromCode(code)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Un embalse sin metadatos opcionales toma valores neutros")
    void minimalReservoir_shouldApplyDefaults() {
        Reservoir reservoir = Reservoir.builder().reservoirId("R").build();

        assertThat(reservoir.type()).isEqualTo(ReservoirType.STORAGE);
        assertThat(reservoir.capacityAf()).isZero();
        assertThat(reservoir.isRunOfRiver()).isFalse();
        assertThat(reservoir.seasonalRules()).isEqualTo(SeasonalRules.EMPTY);
        assertThat(reservoir.elevationRange()).isEqualTo(ElevationRange.UNKNOWN);
        assertThat(reservoir.generationUnitIds()).isEmpty();
        assertThat(ReservoirType.fromCode(null)).isEqualTo(ReservoirType.STORAGE);
    }

    @Test
    @DisplayName("El identificador es obligatorio")
    void missingId_shouldThrow() {
        assertThatThrownBy(() -> Reservoir.builder().maxStorageAf(10.0).build())
                .isInstanceOf(NullPointerException.class);
    }
}
