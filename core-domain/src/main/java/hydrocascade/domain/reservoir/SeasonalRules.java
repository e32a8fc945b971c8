package hydrocascade.domain.reservoir;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.With;

/**
 * Conjunto de reglas de explotación de un embalse (o de toda la cascada).
 * <p>
 * Es un objeto de valor inmutable: los embalses que heredan las reglas de la
 * cascada no pueden corromper las de sus vecinos.
 */
@Builder
@With
@JsonIgnoreProperties(ignoreUnknown = true)
public record SeasonalRules(
        @JsonProperty("winter_rule_curve") RuleCurve winterRuleCurve,
        @JsonProperty("summer_rule_curve") RuleCurve summerRuleCurve,
        @JsonProperty("flood_control_curve") FloodControlCurve floodControlCurve
) {

    public static final SeasonalRules EMPTY = new SeasonalRules(null, null, null);

    @JsonIgnore
    public boolean isEmpty() {
        return winterRuleCurve == null && summerRuleCurve == null && floodControlCurve == null;
    }
}
