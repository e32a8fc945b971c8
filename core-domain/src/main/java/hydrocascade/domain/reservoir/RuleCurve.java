package hydrocascade.domain.reservoir;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

/**
 * Curva de regla estacional. Todos los campos son opcionales.
 *
 * @param targetStoragePercent Llenado objetivo en % de la capacidad.
 * @param minReleaseCfs        Desembalse mínimo impuesto por la regla [cfs].
 * @param maxReleaseCfs        Desembalse máximo impuesto por la regla [cfs].
 */
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public record RuleCurve(
        @JsonProperty("target_storage_percent") Double targetStoragePercent,
        @JsonProperty("min_release_cfs") Double minReleaseCfs,
        @JsonProperty("max_release_cfs") Double maxReleaseCfs
) {}
