package hydrocascade.domain.dto.cascade;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import hydrocascade.domain.reservoir.EfficiencyCurve;
import hydrocascade.domain.reservoir.ElevationRange;
import hydrocascade.domain.reservoir.GenerationUnit;
import hydrocascade.domain.reservoir.HeadCurve;
import hydrocascade.domain.reservoir.SeasonalRules;
import lombok.Builder;
import lombok.With;

import java.util.List;

/**
 * Descripción cruda de un embalse. Admite la capacidad en unidades imperiales
 * ({@code max_storage_af}) o métricas ({@code active_storage_mcm}); la imperial prevalece.
 */
@Builder
@With
@JsonIgnoreProperties(ignoreUnknown = true)
public record ReservoirDescription(
        @JsonProperty("reservoir_id") String reservoirId,
        @JsonProperty("reservoir_name") String reservoirName,
        @JsonProperty("reservoir_type") String reservoirType,
        @JsonProperty("upstream_reservoirs") List<String> upstreamReservoirs,
        @JsonProperty("downstream_reservoirs") List<String> downstreamReservoirs,
        @JsonProperty("max_storage_af") Double maxStorageAf,
        @JsonProperty("min_storage_af") Double minStorageAf,
        @JsonProperty("active_storage_mcm") Double activeStorageMcm,
        @JsonProperty("dead_storage_mcm") Double deadStorageMcm,
        @JsonProperty("elevation_range_meters") ElevationRange elevationRange,
        @JsonProperty("head_curve") HeadCurve headCurve,
        @JsonProperty("efficiency_curve") EfficiencyCurve efficiencyCurve,
        @JsonProperty("seasonal_rules") SeasonalRules seasonalRules,
        @JsonProperty("environmental_min_release_cfs") Double environmentalMinReleaseCfs,
        @JsonProperty("max_release_cfs") Double maxReleaseCfs,
        @JsonProperty("downstream_min_release_cfs") Double downstreamMinReleaseCfs,
        @JsonProperty("max_generation_mw") Double maxGenerationMw,
        @JsonProperty("tailwater_elevation_feet") Double tailwaterElevationFeet,
        @JsonProperty("tailwater_elevation_m") Double tailwaterElevationM,
        @JsonProperty("generation_units") List<GenerationUnit> generationUnits
) {

    public ReservoirDescription {
        upstreamReservoirs = upstreamReservoirs == null ? List.of() : List.copyOf(upstreamReservoirs);
        downstreamReservoirs = downstreamReservoirs == null ? List.of() : List.copyOf(downstreamReservoirs);
        generationUnits = generationUnits == null ? List.of() : List.copyOf(generationUnits);
    }
}
