package hydrocascade.domain.inflow;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Fila de aportaciones sin validar, tal y como llega del almacén de series.
 *
 * @param timestamp   Instante en texto; puede traer zona horaria o no.
 * @param reservoirId Embalse al que llega la aportación.
 * @param inflowCfs   Caudal de entrada directo [cfs]; nulo equivale a 0.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RawInflowRow(
        @JsonProperty("timestamp") String timestamp,
        @JsonProperty("reservoir_id") String reservoirId,
        @JsonProperty("inflow_cfs") Double inflowCfs
) {}
