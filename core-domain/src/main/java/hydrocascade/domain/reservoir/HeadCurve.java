package hydrocascade.domain.reservoir;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Curva cota-salto del aprovechamiento. Ambas series están en metros y se
 * emparejan por posición.
 *
 * @param elevationPointsM Cotas de la lámina de agua [m].
 * @param headPointsM      Salto hidráulico correspondiente a cada cota [m].
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record HeadCurve(
        @JsonProperty("elevation_points_m") List<Double> elevationPointsM,
        @JsonProperty("head_points_m") List<Double> headPointsM
) {

    public HeadCurve {
        elevationPointsM = elevationPointsM == null ? List.of() : List.copyOf(elevationPointsM);
        headPointsM = headPointsM == null ? List.of() : List.copyOf(headPointsM);
    }

    /**
     * Una curva sólo se usa si tiene al menos un punto y las dos series son del mismo tamaño.
     */
    @JsonIgnore
    public boolean isUsable() {
        return !elevationPointsM.isEmpty() && elevationPointsM.size() == headPointsM.size();
    }
}
