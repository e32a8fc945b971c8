package hydrocascade.factory;

import hydrocascade.domain.reservoir.Reservoir;
import hydrocascade.domain.reservoir.ReservoirState;
import hydrocascade.physics.model.ReservoirPhysics;

import java.time.Instant;

/**
 * Construye estados de partida para embalses sin historial.
 */
public final class ReservoirStateFactory {

    private ReservoirStateFactory() {}

    /**
     * Estado por defecto: volumen en el punto medio de los límites si se conocen ambos, en el
     * único límite conocido si sólo hay uno, y 0 si no hay ninguno. Cota y salto se derivan
     * del volumen; caudales, generación y rendimiento parten de 0.
     */
    public static ReservoirState createDefaultState(Reservoir reservoir, Instant timestamp) {
        double storageAf = initialStorage(reservoir);
        double elevationFeet = ReservoirPhysics.storageToElevation(storageAf, reservoir);
        double headFeet = ReservoirPhysics.elevationToHead(elevationFeet, reservoir);

        return ReservoirState.builder()
                .reservoirId(reservoir.reservoirId())
                .timestamp(timestamp)
                .storageAf(storageAf)
                .elevationFeet(elevationFeet)
                .headFeet(headFeet)
                .build();
    }

    static double initialStorage(Reservoir reservoir) {
        Double min = reservoir.minStorageAf();
        Double max = reservoir.maxStorageAf();
        if (min != null && max != null) return (min + max) / 2.0;
        if (max != null) return max;
        if (min != null) return min;
        return 0.0;
    }
}
