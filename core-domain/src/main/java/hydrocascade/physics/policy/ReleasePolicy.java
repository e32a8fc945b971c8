package hydrocascade.physics.policy;

import hydrocascade.domain.reservoir.Reservoir;

import java.time.Instant;

/**
 * Decide el caudal a desembalsar en un paso de tiempo.
 */
@FunctionalInterface
public interface ReleasePolicy {

    /**
     * @param reservoir       Metadatos del embalse, incluidas sus curvas de regla.
     * @param storageAf       Volumen al inicio del paso [AF].
     * @param inflowCfs       Caudal de entrada total del paso [cfs].
     * @param timestamp       Instante simulado (selecciona la temporada).
     * @param timeStepSeconds Duración del paso [s].
     * @return Caudal a desembalsar [cfs].
     */
    double calculateRelease(Reservoir reservoir, double storageAf, double inflowCfs,
                            Instant timestamp, double timeStepSeconds);
}
