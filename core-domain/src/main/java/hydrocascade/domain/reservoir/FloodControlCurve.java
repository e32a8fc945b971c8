package hydrocascade.domain.reservoir;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Resguardo de avenidas: por encima de este llenado se fuerza un desembalse mayor.
 *
 * @param maxStoragePercent Llenado máximo tolerado [%]. Nulo usa el valor por defecto de la política.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FloodControlCurve(
        @JsonProperty("max_storage_percent") Double maxStoragePercent
) {}
