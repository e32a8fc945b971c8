package hydrocascade.domain.reservoir;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

@Getter
@RequiredArgsConstructor
public enum ReservoirType {

    STORAGE("storage"),
    RUN_OF_RIVER("run_of_river"),
    PUMPED_STORAGE("pumped_storage"),

    // --- FALLBACK ---
    UNKNOWN("unknown");

    private final String code;

    private static final Map<String, ReservoirType> BY_CODE = Collections.unmodifiableMap(
            Arrays.stream(values()).collect(Collectors.toMap(ReservoirType::getCode, Function.identity()))
    );

    /**
     * Traduce el código textual de la descripción. Nulo o vacío equivale a {@link #STORAGE}.
     */
    public static ReservoirType fromCode(String code) {
        if (code == null || code.isBlank()) return STORAGE;
        return BY_CODE.getOrDefault(code.trim().toLowerCase(), UNKNOWN);
    }
}
