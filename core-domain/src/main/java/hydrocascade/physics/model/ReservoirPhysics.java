package hydrocascade.physics.model;

import hydrocascade.domain.reservoir.EfficiencyCurve;
import hydrocascade.domain.reservoir.HeadCurve;
import hydrocascade.domain.reservoir.Reservoir;

import java.util.List;

/**
 * Biblioteca estática de conversiones físicas del embalse:
 * volumen → cota → salto → generación.
 * <p>
 * Funciones puras sin efectos laterales. Stateless y Thread-Safe.
 */
public final class ReservoirPhysics {

    /** Rendimiento de turbinas cuando el embalse no declara curva [%]. */
    public static final double DEFAULT_EFFICIENCY_PERCENT = 85.0;

    /** Constante simplificada de conversión caudal·salto → potencia. */
    public static final double GENERATION_CONVERSION_FACTOR = 11.8;

    private ReservoirPhysics() {}

    /**
     * Cota de la lámina de agua por interpolación lineal entre las cotas mínima y máxima
     * de explotación, proporcional al llenado.
     *
     * @return Cota [ft] saturada al rango de explotación; 0 si la capacidad es nula o desconocida.
     */
    public static double storageToElevation(double storageAf, Reservoir reservoir) {
        double capacityAf = reservoir.capacityAf();
        if (capacityAf <= 0.0) {
            return 0.0;
        }
        double minElevation = reservoir.elevationRange().minElevationFeet();
        double maxElevation = reservoir.elevationRange().maxElevationFeet();

        double ratio = storageAf / capacityAf;
        if (!Double.isFinite(ratio)) {
            return minElevation;
        }
        double elevation = minElevation + (maxElevation - minElevation) * ratio;

        double low = Math.min(minElevation, maxElevation);
        double high = Math.max(minElevation, maxElevation);
        return clamp(elevation, low, high);
    }

    /**
     * Salto hidráulico a partir de la cota. Usa la curva cota-salto si existe (interpolando
     * y extrapolando linealmente); si no, cota menos cota del canal de desagüe.
     *
     * @return Salto [ft], nunca negativo.
     */
    public static double elevationToHead(double elevationFeet, Reservoir reservoir) {
        HeadCurve curve = reservoir.headCurve();
        double head;
        if (curve != null && curve.isUsable()) {
            LinearInterpolator interpolator = LinearInterpolator.of(
                    toFeet(curve.elevationPointsM()),
                    toFeet(curve.headPointsM()));
            head = interpolator.interpolateExtrapolated(elevationFeet);
        } else {
            head = elevationFeet - reservoir.tailwaterElevationFeet();
        }
        return Double.isFinite(head) ? Math.max(0.0, head) : 0.0;
    }

    /**
     * Generación y rendimiento para un caudal turbinado y un salto.
     * <p>
     * Sin caudal o sin salto no hay generación. La potencia se satura al tope del embalse
     * si lo declara.
     */
    public static GenerationResult calculateGeneration(double releaseCfs, double headFeet, Reservoir reservoir) {
        if (!(releaseCfs > 0.0) || !(headFeet > 0.0)) {
            return GenerationResult.NONE;
        }

        double efficiencyPercent = efficiencyAt(releaseCfs, reservoir.efficiencyCurve());
        double generationMw = releaseCfs * headFeet * efficiencyPercent / 100.0 / GENERATION_CONVERSION_FACTOR;

        Double maxGenerationMw = reservoir.maxGenerationMw();
        if (maxGenerationMw != null) {
            generationMw = Math.min(generationMw, maxGenerationMw);
            if (generationMw <= 0.0) {
                efficiencyPercent = 0.0;
            }
        }
        return new GenerationResult(Math.max(0.0, generationMw), efficiencyPercent);
    }

    static double efficiencyAt(double releaseCfs, EfficiencyCurve curve) {
        if (curve == null || !curve.isUsable()) {
            return DEFAULT_EFFICIENCY_PERCENT;
        }
        return LinearInterpolator.of(curve.flowPointsCfs(), curve.efficiencyValuesPercent())
                .interpolateClamped(releaseCfs);
    }

    private static List<Double> toFeet(List<Double> meters) {
        return meters.stream().map(HydroUnits::metersToFeet).toList();
    }

    private static double clamp(double value, double low, double high) {
        return Math.max(low, Math.min(high, value));
    }
}
