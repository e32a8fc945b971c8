package hydrocascade.physics.model;

import hydrocascade.domain.inflow.InflowObservation;
import hydrocascade.domain.reservoir.Reservoir;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class SyntheticInflowGeneratorTest {

    private final SyntheticInflowGenerator generator = new SyntheticInflowGenerator();

    private final Reservoir withCapacity = Reservoir.builder().reservoirId("A").maxStorageAf(72_000.0).build();
    private final Reservoir withoutCapacity = Reservoir.builder().reservoirId("B").build();

    @Test
    @DisplayName("Genera una observación por embalse y paso en la ventana semiabierta")
    void generate_shouldCoverWindow() {
        Instant start = Instant.parse("2024-06-01T00:00:00Z");
        Instant end = start.plus(24, ChronoUnit.HOURS);

        List<InflowObservation> observations = generator.generate(List.of(withCapacity, withoutCapacity), start, end, 1.0);

        assertThat(observations).hasSize(48);
        assertThat(observations.get(0).timestamp()).isEqualTo(start);
        assertThat(observations.get(47).timestamp()).isEqualTo(end.minus(1, ChronoUnit.HOURS));
        assertThat(observations).allSatisfy(o -> assertThat(o.inflowCfs()).isGreaterThanOrEqualTo(0.0));
    }

    @Test
    @DisplayName("La aportación base es la capacidad repartida en un mes, o 500 cfs sin capacidad")
    void inflowAt_shouldScaleWithCapacity() {
        // Día 1 a las 00:00: la modulación diaria es nula y la anual casi nula
        Instant t = Instant.parse("2024-01-01T00:00:00Z");

        assertThat(generator.inflowAt(withCapacity, t)).isCloseTo(100.0, within(1.0));
        assertThat(generator.inflowAt(withoutCapacity, t)).isCloseTo(500.0, within(5.0));
    }

    @Test
    @DisplayName("Una ventana vacía produce un único paso en el inicio")
    void emptyWindow_shouldProduceSingleStep() {
        Instant start = Instant.parse("2024-06-01T00:00:00Z");

        List<InflowObservation> observations = generator.generate(List.of(withCapacity), start, start, 1.0);

        assertThat(observations).singleElement().extracting(InflowObservation::timestamp).isEqualTo(start);
    }

    @Test
    @DisplayName("Un paso de tiempo no positivo se rechaza")
    void nonPositiveStep_shouldThrow() {
        Instant start = Instant.parse("2024-06-01T00:00:00Z");

        assertThatThrownBy(() -> generator.generate(List.of(withCapacity), start, start.plusSeconds(3600), 0.0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Un paso positivo que se redondea a cero se rechaza en lugar de no avanzar nunca")
    void stepRoundingToZero_shouldThrow() {
        Instant start = Instant.parse("2024-01-01T00:00:00Z");

        assertThatThrownBy(() -> generator.generate(List.of(withCapacity), start, start.plusSeconds(3600), 1e-14))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("demasiado pequeño");
    }

    @Test
    @DisplayName("Una ventana con más instantes de los indexables se rechaza")
    void tooManySteps_shouldThrow() {
        Instant start = Instant.parse("2024-01-01T00:00:00Z");

        assertThatThrownBy(() -> generator.generate(List.of(withCapacity), start, start.plus(365, ChronoUnit.DAYS), 1e-12))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("demasiado larga");
    }

    @Test
    @DisplayName("Los pasos inferiores al milisegundo avanzan correctamente")
    void subMillisecondStep_shouldAdvance() {
        Instant start = Instant.parse("2024-01-01T00:00:00Z");
        double halfMillisecondHours = 0.0005 / 3600.0;

        List<InflowObservation> observations = generator.generate(
                List.of(withCapacity), start, start.plusMillis(2), halfMillisecondHours);

        assertThat(observations).hasSize(4);
        assertThat(observations.get(1).timestamp()).isEqualTo(start.plusNanos(500_000));
    }
}
