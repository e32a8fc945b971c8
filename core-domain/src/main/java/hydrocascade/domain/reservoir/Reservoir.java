package hydrocascade.domain.reservoir;

import lombok.Builder;
import lombok.With;

import java.util.List;
import java.util.Objects;

/**
 * Metadatos tipados de un embalse, ya normalizados por el cargador de topologías.
 * <p>
 * Los campos opcionales se modelan como {@code Double} nulo; nunca se usan valores
 * centinela.
 *
 * @param reservoirId                Identificador estable del embalse.
 * @param reservoirName              Nombre descriptivo (opcional).
 * @param type                       Tipología del aprovechamiento.
 * @param minStorageAf               Volumen mínimo [AF]. Nulo si no hay datos de capacidad.
 * @param maxStorageAf               Volumen máximo o capacidad [AF]. Nulo si no hay datos de capacidad.
 * @param elevationRange             Rango de cotas de explotación.
 * @param headCurve                  Curva cota-salto (opcional).
 * @param efficiencyCurve            Curva caudal-rendimiento (opcional).
 * @param seasonalRules              Reglas de explotación propias o heredadas de la cascada.
 * @param environmentalMinReleaseCfs Caudal ecológico [cfs] (opcional).
 * @param maxReleaseCfs              Desembalse máximo físico [cfs] (opcional).
 * @param downstreamMinReleaseCfs    Caudal mínimo exigido aguas abajo [cfs] (opcional).
 * @param maxGenerationMw            Tope de generación [MW] (opcional).
 * @param tailwaterElevationFeet     Cota del canal de desagüe [ft].
 * @param generationUnitIds          Identificadores de los grupos generadores asociados.
 */
@Builder(toBuilder = true)
@With
public record Reservoir(
        String reservoirId,
        String reservoirName,
        ReservoirType type,
        Double minStorageAf,
        Double maxStorageAf,
        ElevationRange elevationRange,
        HeadCurve headCurve,
        EfficiencyCurve efficiencyCurve,
        SeasonalRules seasonalRules,
        Double environmentalMinReleaseCfs,
        Double maxReleaseCfs,
        Double downstreamMinReleaseCfs,
        Double maxGenerationMw,
        double tailwaterElevationFeet,
        List<String> generationUnitIds
) {

    public Reservoir {
        Objects.requireNonNull(reservoirId, "El identificador del embalse no puede ser nulo.");
        type = type == null ? ReservoirType.STORAGE : type;
        elevationRange = elevationRange == null ? ElevationRange.UNKNOWN : elevationRange;
        seasonalRules = seasonalRules == null ? SeasonalRules.EMPTY : seasonalRules;
        generationUnitIds = generationUnitIds == null ? List.of() : List.copyOf(generationUnitIds);
    }

    /**
     * Capacidad útil del embalse [AF]; 0 si es desconocida.
     */
    public double capacityAf() {
        return maxStorageAf == null ? 0.0 : maxStorageAf;
    }

    public boolean isRunOfRiver() {
        return type == ReservoirType.RUN_OF_RIVER;
    }
}
