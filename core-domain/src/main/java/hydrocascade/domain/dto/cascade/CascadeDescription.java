package hydrocascade.domain.dto.cascade;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import hydrocascade.domain.reservoir.SeasonalRules;
import lombok.Builder;
import lombok.With;

import java.util.List;

/**
 * Descripción cruda de una cascada tal y como llega del catálogo de topologías.
 * Las reglas estacionales de cascada se aplican a los embalses que no declaran las suyas.
 */
@Builder
@With
@JsonIgnoreProperties(ignoreUnknown = true)
public record CascadeDescription(
        @JsonProperty("cascade_id") String cascadeId,
        @JsonProperty("cascade_name") String cascadeName,
        @JsonProperty("river_system") String riverSystem,
        @JsonProperty("ba_id") String baId,
        @JsonProperty("region") String region,
        @JsonProperty("reservoirs") List<ReservoirDescription> reservoirs,
        @JsonProperty("seasonal_rules") SeasonalRules seasonalRules
) {

    public CascadeDescription {
        reservoirs = reservoirs == null ? List.of() : List.copyOf(reservoirs);
    }
}
