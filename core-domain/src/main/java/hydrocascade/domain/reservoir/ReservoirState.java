package hydrocascade.domain.reservoir;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.With;

import java.time.Instant;

/**
 * Instantánea inmutable de un embalse en un instante.
 * <p>
 * El calculador crea una nueva instancia por embalse y paso de tiempo; la anterior
 * nunca se modifica.
 *
 * @param reservoirId       Identificador del embalse.
 * @param timestamp         Instante UTC al que se refiere el estado.
 * @param storageAf         Volumen almacenado [AF].
 * @param elevationFeet     Cota de la lámina de agua [ft].
 * @param inflowCfs         Caudal de entrada total, incluidas las aportaciones de aguas arriba [cfs].
 * @param releaseCfs        Caudal desembalsado [cfs].
 * @param generationMw      Generación instantánea [MW].
 * @param headFeet          Salto hidráulico [ft].
 * @param efficiencyPercent Rendimiento de turbinas usado en la generación [%].
 */
@Builder
@With
@JsonIgnoreProperties(ignoreUnknown = true)
public record ReservoirState(
        @JsonProperty("reservoir_id") String reservoirId,
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("storage_af") double storageAf,
        @JsonProperty("elevation_feet") double elevationFeet,
        @JsonProperty("inflow_cfs") double inflowCfs,
        @JsonProperty("release_cfs") double releaseCfs,
        @JsonProperty("generation_mw") double generationMw,
        @JsonProperty("head_feet") double headFeet,
        @JsonProperty("efficiency_percent") double efficiencyPercent
) {}
