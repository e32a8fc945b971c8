package hydrocascade.domain.reservoir;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Curva caudal-rendimiento de las turbinas.
 *
 * @param flowPointsCfs           Caudales turbinados [cfs].
 * @param efficiencyValuesPercent Rendimiento para cada caudal [%].
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EfficiencyCurve(
        @JsonProperty("flow_points_cfs") List<Double> flowPointsCfs,
        @JsonProperty("efficiency_values_percent") List<Double> efficiencyValuesPercent
) {

    public EfficiencyCurve {
        flowPointsCfs = flowPointsCfs == null ? List.of() : List.copyOf(flowPointsCfs);
        efficiencyValuesPercent = efficiencyValuesPercent == null ? List.of() : List.copyOf(efficiencyValuesPercent);
    }

    @JsonIgnore
    public boolean isUsable() {
        return !flowPointsCfs.isEmpty() && flowPointsCfs.size() == efficiencyValuesPercent.size();
    }
}
