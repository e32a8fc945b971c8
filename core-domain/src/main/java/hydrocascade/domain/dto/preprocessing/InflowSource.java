package hydrocascade.domain.dto.preprocessing;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Procedencia de las aportaciones usadas en una simulación.
 */
@Getter
@RequiredArgsConstructor
public enum InflowSource {
    OBSERVED("observed"),
    SYNTHETIC("synthetic");

    @JsonValue
    private final String code;
}
