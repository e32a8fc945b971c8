package hydrocascade.physics.solver;

import hydrocascade.domain.reservoir.Reservoir;
import hydrocascade.physics.model.HydroUnits;

/**
 * Biblioteca estática para el balance de masas de un embalse en un paso de tiempo.
 * <p>
 * Ecuación de continuidad:
 * <pre>
 *     V(t) = V(t-1) + (Q_entrada - Q_salida) * Δt / 43560
 * </pre>
 * Los límites de volumen se respetan corrigiendo el desembalse (vertido del exceso o
 * retención del déficit) y recalculando el volumen con el desembalse corregido. Sólo si la
 * corrección no basta se satura el volumen directamente.
 * <p>
 * Stateless y Thread-Safe.
 */
public final class MassBalanceSolver {

    /** Diferencia por debajo de la cual la saturación final se atribuye al redondeo [AF]. */
    private static final double CLAMP_EPSILON_AF = 1e-6;

    private MassBalanceSolver() {}

    /**
     * @param reservoir       Embalse (aporta los límites de volumen, que pueden ser nulos).
     * @param priorStorageAf  Volumen al inicio del paso [AF].
     * @param inflowCfs       Caudal de entrada total [cfs].
     * @param releaseCfs      Desembalse propuesto por la política [cfs].
     * @param timeStepSeconds Duración del paso [s].
     */
    public static StorageBalance solve(Reservoir reservoir, double priorStorageAf, double inflowCfs,
                                       double releaseCfs, double timeStepSeconds) {
        Double min = reservoir.minStorageAf();
        Double max = reservoir.maxStorageAf();

        // 1. Balance sin restricciones
        double rawStorage = continuity(priorStorageAf, inflowCfs, releaseCfs, timeStepSeconds);

        // 2. Corrección del desembalse
        double release = releaseCfs;
        if (max != null && rawStorage > max) {
            release += HydroUnits.volumeToFlow(rawStorage - max, timeStepSeconds);
        } else if (min != null && rawStorage < min) {
            release = Math.max(0.0, release - HydroUnits.volumeToFlow(min - rawStorage, timeStepSeconds));
        }
        release = Math.max(0.0, release);
        if (!Double.isFinite(release)) {
            release = 0.0;
        }

        // 3. Volumen coherente con el desembalse corregido y saturación de último recurso
        double storage = continuity(priorStorageAf, inflowCfs, release, timeStepSeconds);
        double clamped = storage;
        if (max != null) clamped = Math.min(clamped, max);
        if (min != null) clamped = Math.max(clamped, min);

        boolean forced = Math.abs(clamped - storage) > CLAMP_EPSILON_AF;
        return new StorageBalance(clamped, release, forced);
    }

    /**
     * Volumen al final del paso sin límites [AF].
     */
    public static double continuity(double priorStorageAf, double inflowCfs, double releaseCfs, double timeStepSeconds) {
        return priorStorageAf + HydroUnits.flowToVolume(inflowCfs - releaseCfs, timeStepSeconds);
    }
}
