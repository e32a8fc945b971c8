package hydrocascade.domain.inflow;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.DisplayName;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class TimestampParserTest {

    @ParameterizedTest(name = "{0} -> {1}")
    @DisplayName("Formatos aceptados se normalizan a UTC")
    @CsvSource({
            "2024-03-01T06:00:00Z,       2024-03-01T06:00:00Z",
            "2024-03-01T06:00:00,        2024-03-01T06:00:00Z",
            "2024-03-01 06:00:00,        2024-03-01T06:00:00Z",
            "2024-03-01T08:00:00+02:00,  2024-03-01T06:00:00Z",
            "2024-03-01 06:00:00+00,     2024-03-01T06:00:00Z",
            "2024-03-01T06:00:00+0000,   2024-03-01T06:00:00Z",
            "2024-03-01 04:30:00-0130,   2024-03-01T06:00:00Z",
            "2024-03-01 11:00:00+05,     2024-03-01T06:00:00Z",
            "2024-03-01 06:00:00.000+00:00, 2024-03-01T06:00:00Z",
            "2024-03-01T06:00,           2024-03-01T06:00:00Z",
            "2024-03-01,                 2024-03-01T00:00:00Z"
    })
    void parse_shouldAcceptCommonFormats(String text, String expected) {
        assertThat(TimestampParser.parse(text)).contains(Instant.parse(expected));
    }

    @ParameterizedTest
    @DisplayName("Texto no interpretable devuelve vacío")
    @NullAndEmptySource
    @ValueSource(strings = {"   ", "not-a-date", "2024-13-01T00:00:00", "01/03/2024 06:00"})
    void parse_shouldRejectGarbage(String text) {
        assertThat(TimestampParser.parse(text)).isEmpty();
    }
}
