package hydrocascade.physics.policy;

import hydrocascade.domain.reservoir.RuleCurve;
import hydrocascade.domain.reservoir.SeasonalRules;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.Set;

public enum Season {
    WINTER,
    SUMMER;

    public static Season of(Instant timestamp, Set<Integer> winterMonths) {
        int month = timestamp.atZone(ZoneOffset.UTC).getMonthValue();
        return winterMonths.contains(month) ? WINTER : SUMMER;
    }

    /**
     * Curva aplicable: en invierno la de invierno si existe; en cualquier otro caso la de verano.
     */
    public Optional<RuleCurve> selectCurve(SeasonalRules rules) {
        if (this == WINTER && rules.winterRuleCurve() != null) {
            return Optional.of(rules.winterRuleCurve());
        }
        return Optional.ofNullable(rules.summerRuleCurve());
    }
}
