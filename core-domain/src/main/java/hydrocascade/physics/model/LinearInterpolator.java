package hydrocascade.physics.model;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Interpolación lineal por tramos sobre una tabla de puntos (x, y).
 * <p>
 * Los puntos se ordenan por x al construir la tabla. Stateless tras la construcción y Thread-Safe.
 */
public final class LinearInterpolator {

    private final double[] xs;
    private final double[] ys;

    private LinearInterpolator(double[] xs, double[] ys) {
        this.xs = xs;
        this.ys = ys;
    }

    /**
     * @throws IllegalArgumentException si las series están vacías o tienen distinto tamaño.
     */
    public static LinearInterpolator of(List<Double> x, List<Double> y) {
        if (x.isEmpty() || x.size() != y.size()) {
            throw new IllegalArgumentException("Las series de interpolación deben ser no vacías y del mismo tamaño.");
        }
        Integer[] order = new Integer[x.size()];
        for (int i = 0; i < order.length; i++) order[i] = i;
        Arrays.sort(order, Comparator.comparingDouble(x::get));

        double[] sortedX = new double[order.length];
        double[] sortedY = new double[order.length];
        for (int i = 0; i < order.length; i++) {
            sortedX[i] = x.get(order[i]);
            sortedY[i] = y.get(order[i]);
        }
        return new LinearInterpolator(sortedX, sortedY);
    }

    /**
     * Interpola dentro de la tabla y satura en los extremos.
     */
    public double interpolateClamped(double x) {
        if (x <= xs[0]) return ys[0];
        int last = xs.length - 1;
        if (x >= xs[last]) return ys[last];
        int i = upperSegment(x);
        return lerp(i - 1, i, x);
    }

    /**
     * Interpola dentro de la tabla y prolonga linealmente el primer y el último tramo fuera de ella.
     * Con un único punto devuelve su valor.
     */
    public double interpolateExtrapolated(double x) {
        if (xs.length == 1) return ys[0];
        int last = xs.length - 1;
        if (x <= xs[0]) return lerp(0, 1, x);
        if (x >= xs[last]) return lerp(last - 1, last, x);
        int i = upperSegment(x);
        return lerp(i - 1, i, x);
    }

    // Primer índice con xs[i] > x, sabiendo que xs[0] < x < xs[last]
    private int upperSegment(double x) {
        int i = 1;
        while (xs[i] <= x) i++;
        return i;
    }

    private double lerp(int a, int b, double x) {
        double dx = xs[b] - xs[a];
        if (dx == 0.0) return ys[b];
        return ys[a] + (ys[b] - ys[a]) * (x - xs[a]) / dx;
    }
}
