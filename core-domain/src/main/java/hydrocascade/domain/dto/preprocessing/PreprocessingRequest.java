package hydrocascade.domain.dto.preprocessing;

import lombok.Builder;
import lombok.With;

import java.time.Instant;
import java.util.List;

/**
 * Petición de preprocesado de cascadas.
 *
 * @param cascadeIds        Cascadas a procesar; vacío o nulo procesa todas las disponibles.
 * @param startDate         Inicio de la ventana (incluido). Nulo usa hace un año.
 * @param endDate           Fin de la ventana (excluido). Nulo usa inicio + un año.
 * @param caseId            Caso de planificación al que pertenecen los registros.
 * @param scenarioId        Escenario asociado (opcional).
 * @param market            Mercado almacenado con cada registro.
 * @param weatherScenario   Escenario meteorológico (opcional).
 * @param dataSource        Origen declarado de los registros generados.
 * @param overwriteExisting Borra los registros previos del caso antes de insertar.
 */
@Builder
@With
public record PreprocessingRequest(
        List<String> cascadeIds,
        Instant startDate,
        Instant endDate,
        String caseId,
        String scenarioId,
        String market,
        String weatherScenario,
        String dataSource,
        Boolean overwriteExisting
) {

    public static final String DEFAULT_CASE_ID = "default";
    public static final String DEFAULT_MARKET = "wecc";
    public static final String DEFAULT_DATA_SOURCE = "hydro_preprocessor";

    public PreprocessingRequest {
        cascadeIds = cascadeIds == null ? List.of() : List.copyOf(cascadeIds);
        caseId = caseId == null ? DEFAULT_CASE_ID : caseId;
        market = market == null ? DEFAULT_MARKET : market;
        dataSource = dataSource == null ? DEFAULT_DATA_SOURCE : dataSource;
        overwriteExisting = overwriteExisting == null ? Boolean.TRUE : overwriteExisting;
    }

    public static PreprocessingRequest defaults() {
        return PreprocessingRequest.builder().build();
    }

    public boolean includes(String cascadeId) {
        return cascadeIds.isEmpty() || cascadeIds.contains(cascadeId);
    }
}
