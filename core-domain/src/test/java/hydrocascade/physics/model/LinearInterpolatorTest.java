package hydrocascade.physics.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

class LinearInterpolatorTest {

    @Test
    @DisplayName("Los puntos desordenados se ordenan por x antes de interpolar")
    void unsortedPoints_shouldBeSorted() {
        LinearInterpolator interpolator = LinearInterpolator.of(List.of(10.0, 0.0), List.of(100.0, 0.0));

        assertEquals(50.0, interpolator.interpolateClamped(5.0), 1e-9);
    }

    @Test
    @DisplayName("Clamped satura; Extrapolated prolonga el tramo extremo")
    void outsideRange_shouldClampOrExtrapolate() {
        LinearInterpolator interpolator = LinearInterpolator.of(List.of(0.0, 10.0), List.of(0.0, 100.0));

        assertEquals(100.0, interpolator.interpolateClamped(20.0));
        assertEquals(0.0, interpolator.interpolateClamped(-5.0));
        assertEquals(200.0, interpolator.interpolateExtrapolated(20.0), 1e-9);
        assertEquals(-50.0, interpolator.interpolateExtrapolated(-5.0), 1e-9);
    }

    @Test
    @DisplayName("Con un único punto siempre devuelve su valor")
    void singlePoint_shouldReturnConstant() {
        LinearInterpolator interpolator = LinearInterpolator.of(List.of(3.0), List.of(7.0));

        assertEquals(7.0, interpolator.interpolateExtrapolated(100.0));
        assertEquals(7.0, interpolator.interpolateClamped(-100.0));
    }

    @Test
    @DisplayName("Series vacías o de distinto tamaño se rechazan")
    void invalidSeries_shouldThrow() {
        assertThatThrownBy(() -> LinearInterpolator.of(List.of(), List.of()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> LinearInterpolator.of(List.of(1.0, 2.0), List.of(1.0)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
