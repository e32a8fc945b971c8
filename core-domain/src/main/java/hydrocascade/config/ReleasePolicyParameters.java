package hydrocascade.config;

import lombok.Builder;
import lombok.With;

import java.util.Set;

/**
 * Parámetros ajustables de la política de desembalse por curvas de regla.
 * <p>
 * Los valores por defecto reproducen las constantes históricas del modelo
 * (banda de tolerancia del 5 %, objetivos del 20 % / 60 %, control de avenidas al 90 %).
 *
 * @param tolerancePercent              Semiancho de la banda muerta alrededor del objetivo, en % de la capacidad.
 * @param runOfRiverTargetPercent       Objetivo de llenado por defecto para centrales fluyentes (%).
 * @param defaultTargetPercent          Objetivo de llenado por defecto para el resto de embalses (%).
 * @param defaultFloodMaxStoragePercent Umbral de control de avenidas cuando la curva no lo declara (%).
 * @param floodReleaseFactor            Multiplicador del caudal de entrada aplicado durante avenidas.
 * @param inflowMaxReleaseFactor        Multiplicador del caudal de entrada usado como desembalse máximo de último recurso.
 * @param minimumBandWidthCfs           Anchura mínima entre desembalse mínimo y máximo [cfs].
 * @param winterMonths                  Meses (1-12) que seleccionan la curva de invierno.
 */
@Builder
@With
public record ReleasePolicyParameters(
        double tolerancePercent,
        double runOfRiverTargetPercent,
        double defaultTargetPercent,
        double defaultFloodMaxStoragePercent,
        double floodReleaseFactor,
        double inflowMaxReleaseFactor,
        double minimumBandWidthCfs,
        Set<Integer> winterMonths
) {

    public ReleasePolicyParameters {
        if (tolerancePercent < 0) {
            throw new IllegalArgumentException("La tolerancia no puede ser negativa.");
        }
        if (minimumBandWidthCfs < 0) {
            throw new IllegalArgumentException("La anchura mínima de banda no puede ser negativa.");
        }
        winterMonths = winterMonths == null ? Set.of() : Set.copyOf(winterMonths);
    }

    public static ReleasePolicyParameters defaults() {
        return ReleasePolicyParameters.builder()
                .tolerancePercent(5.0)
                .runOfRiverTargetPercent(20.0)
                .defaultTargetPercent(60.0)
                .defaultFloodMaxStoragePercent(90.0)
                .floodReleaseFactor(1.2)
                .inflowMaxReleaseFactor(2.0)
                .minimumBandWidthCfs(1.0)
                .winterMonths(Set.of(12, 1, 2, 3))
                .build();
    }
}
