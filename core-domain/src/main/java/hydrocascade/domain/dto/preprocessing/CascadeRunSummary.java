package hydrocascade.domain.dto.preprocessing;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

/**
 * Resultado del preprocesado de una cascada.
 *
 * @param cascadeId      Cascada procesada.
 * @param status         {@code success} o {@code error}.
 * @param reservoirCount Embalses distintos presentes en la trayectoria.
 * @param timeSteps      Estados calculados (embalses x instantes).
 * @param recordsStaged  Registros preparados para almacenar.
 * @param inflowSource   Procedencia de las aportaciones.
 * @param error          Mensaje de error si la cascada falló.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CascadeRunSummary(
        @JsonProperty("cascade_id") String cascadeId,
        @JsonProperty("status") String status,
        @JsonProperty("reservoir_count") int reservoirCount,
        @JsonProperty("time_steps") int timeSteps,
        @JsonProperty("records_staged") int recordsStaged,
        @JsonProperty("inflow_source") InflowSource inflowSource,
        @JsonProperty("error") String error
) {

    public static final String STATUS_SUCCESS = "success";
    public static final String STATUS_ERROR = "error";

    public static CascadeRunSummary failure(String cascadeId, String error) {
        return CascadeRunSummary.builder()
                .cascadeId(cascadeId)
                .status(STATUS_ERROR)
                .error(error)
                .build();
    }

    public boolean isSuccess() {
        return STATUS_SUCCESS.equals(status);
    }
}
