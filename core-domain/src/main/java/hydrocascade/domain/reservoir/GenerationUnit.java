package hydrocascade.domain.reservoir;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

/**
 * Grupo generador asociado a un embalse.
 */
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public record GenerationUnit(
        @JsonProperty("unit_id") String unitId,
        @JsonProperty("unit_name") String unitName,
        @JsonProperty("capacity_mw") Double capacityMw,
        @JsonProperty("min_generation_mw") Double minGenerationMw,
        @JsonProperty("max_generation_mw") Double maxGenerationMw,
        @JsonProperty("efficiency_percent") Double efficiencyPercent,
        @JsonProperty("head_loss_factor") Double headLossFactor
) {

    /**
     * Potencia que aporta el grupo al tope de generación del embalse: la máxima declarada
     * o, en su defecto, la nominal.
     */
    public double effectiveCapacityMw() {
        if (maxGenerationMw != null && maxGenerationMw != 0.0) return maxGenerationMw;
        if (capacityMw != null) return capacityMw;
        return 0.0;
    }
}
