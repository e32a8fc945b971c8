package hydrocascade.domain.reservoir;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import hydrocascade.physics.model.HydroUnits;

/**
 * Rango de cotas de explotación del embalse, declarado en metros.
 *
 * @param minElevationM Cota mínima de explotación [m]. Nulo equivale a 0.
 * @param maxElevationM Cota máxima de explotación [m]. Nulo equivale a 0.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ElevationRange(
        @JsonProperty("min_elevation_m") Double minElevationM,
        @JsonProperty("max_elevation_m") Double maxElevationM
) {

    public static final ElevationRange UNKNOWN = new ElevationRange(null, null);

    public double minElevationFeet() {
        return minElevationM == null ? 0.0 : HydroUnits.metersToFeet(minElevationM);
    }

    public double maxElevationFeet() {
        return maxElevationM == null ? 0.0 : HydroUnits.metersToFeet(maxElevationM);
    }
}
