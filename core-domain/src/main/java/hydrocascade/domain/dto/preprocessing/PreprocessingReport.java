package hydrocascade.domain.dto.preprocessing;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Informe de una ejecución del preprocesador.
 *
 * @param status            {@code completed} o {@code completed_with_errors}.
 * @param processedCascades Cascadas procesadas con éxito.
 * @param failedCascades    Cascadas con error.
 * @param storedRows        Registros almacenados.
 * @param windowStart       Inicio de la ventana normalizada.
 * @param windowEnd         Fin de la ventana normalizada.
 * @param results           Resumen por cascada, en orden de proceso.
 */
@Builder
public record PreprocessingReport(
        @JsonProperty("status") String status,
        @JsonProperty("processed_cascades") int processedCascades,
        @JsonProperty("failed_cascades") int failedCascades,
        @JsonProperty("stored_rows") int storedRows,
        @JsonProperty("window_start") Instant windowStart,
        @JsonProperty("window_end") Instant windowEnd,
        @JsonProperty("results") Map<String, CascadeRunSummary> results
) {

    public static final String STATUS_COMPLETED = "completed";
    public static final String STATUS_COMPLETED_WITH_ERRORS = "completed_with_errors";

    public PreprocessingReport {
        results = Collections.unmodifiableMap(new LinkedHashMap<>(results == null ? Map.of() : results));
    }
}
