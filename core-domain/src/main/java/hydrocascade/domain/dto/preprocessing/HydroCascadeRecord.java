package hydrocascade.domain.dto.preprocessing;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.time.Instant;

/**
 * Fila persistida por el preprocesador: un estado de embalse enriquecido con el
 * contexto del caso de planificación.
 * <p>
 * {@code metadata} es un documento JSON con la procedencia de las aportaciones, la versión
 * del preprocesador, la tipología del embalse y sus grupos generadores.
 */
@Builder
public record HydroCascadeRecord(
        @JsonProperty("case_id") String caseId,
        @JsonProperty("scenario_id") String scenarioId,
        @JsonProperty("market") String market,
        @JsonProperty("ba_id") String baId,
        @JsonProperty("cascade_id") String cascadeId,
        @JsonProperty("cascade_name") String cascadeName,
        @JsonProperty("reservoir_id") String reservoirId,
        @JsonProperty("reservoir_name") String reservoirName,
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("inflow_cfs") double inflowCfs,
        @JsonProperty("storage_af") double storageAf,
        @JsonProperty("elevation_feet") double elevationFeet,
        @JsonProperty("release_cfs") double releaseCfs,
        @JsonProperty("generation_mw") double generationMw,
        @JsonProperty("head_feet") double headFeet,
        @JsonProperty("efficiency_percent") double efficiencyPercent,
        @JsonProperty("weather_scenario") String weatherScenario,
        @JsonProperty("data_source") String dataSource,
        @JsonProperty("metadata") String metadata
) {}
