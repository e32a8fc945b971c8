package hydrocascade.io;

import com.fasterxml.jackson.core.type.TypeReference;
import hydrocascade.domain.dto.cascade.CascadeDescription;
import hydrocascade.domain.dto.cascade.ReservoirDescription;
import hydrocascade.domain.inflow.RawInflowRow;
import hydrocascade.domain.reservoir.ReservoirState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Pruebas de lectura y escritura de los ficheros JSON del motor.
 */
class JsonFileHandlerTest {

    private JsonFileHandler jsonFileHandler;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        this.jsonFileHandler = new JsonFileHandler();
    }

    private static Path fixture(String name) throws URISyntaxException {
        return Paths.get(Objects.requireNonNull(JsonFileHandlerTest.class.getResource("/fixtures/" + name)).toURI());
    }

    @Test
    @DisplayName("Debería leer una descripción de cascada con reglas, grupos y campos desconocidos")
    void readFromFile_shouldParseCascadeDescription() throws Exception {
        // --- 1. Arrange ---
        Path input = fixture("columbia-cascade.json");

        // --- 2. Act ---
        CascadeDescription description = jsonFileHandler.readFromFile(input.toString(), CascadeDescription.class);

        // --- 3. Assert ---
        assertThat(description.cascadeId()).isEqualTo("COLUMBIA");
        assertThat(description.baId()).isEqualTo("BPAT");
        assertThat(description.seasonalRules().summerRuleCurve().targetStoragePercent()).isEqualTo(80.0);
        assertThat(description.seasonalRules().floodControlCurve().maxStoragePercent()).isEqualTo(95.0);
        assertThat(description.reservoirs()).extracting(ReservoirDescription::reservoirId).containsExactly("GCL", "CHJ");

        ReservoirDescription grandCoulee = description.reservoirs().get(0);
        assertThat(grandCoulee.generationUnits()).hasSize(2);
        assertThat(grandCoulee.elevationRange().maxElevationM()).isEqualTo(393.0);
        assertThat(grandCoulee.upstreamReservoirs()).isEmpty();

        ReservoirDescription chiefJoseph = description.reservoirs().get(1);
        assertThat(chiefJoseph.activeStorageMcm()).isEqualTo(238.0);
        assertThat(chiefJoseph.maxStorageAf()).isNull();
    }

    @Test
    @DisplayName("Debería escribir los instantes de los estados en ISO-8601")
    void writeToFile_shouldWriteInstantsAsIsoText() throws IOException {
        ReservoirState state = ReservoirState.builder()
                .reservoirId("GCL")
                .timestamp(Instant.parse("2024-01-15T06:00:00Z"))
                .storageAf(5_000_000.0)
                .releaseCfs(120.5)
                .build();
        Path output = tempDir.resolve("nested/dir/states.json");

        jsonFileHandler.writeToFile(List.of(state), output.toString());

        assertThat(output).exists();
        assertThat(Files.readString(output))
                .contains("\"timestamp\" : \"2024-01-15T06:00:00Z\"")
                .contains("\"reservoir_id\" : \"GCL\"")
                .contains("\"release_cfs\" : 120.5");
    }

    @Test
    @DisplayName("Debería leer listas genéricas de filas de aportaciones")
    void readFromFile_withTypeReference_shouldParseRows() throws IOException {
        Path input = tempDir.resolve("inflows.json");
        Files.writeString(input, """
                [
                  { "timestamp": "2024-01-01 00:00:00", "reservoir_id": "GCL", "inflow_cfs": 1500.0 },
                  { "timestamp": "2024-01-01T01:00:00Z", "reservoir_id": "GCL" }
                ]
                """);

        List<RawInflowRow> rows = jsonFileHandler.readFromFile(input.toString(), new TypeReference<List<RawInflowRow>>() {});

        assertThat(rows).hasSize(2);
        assertThat(rows.get(0).inflowCfs()).isEqualTo(1500.0);
        assertThat(rows.get(1).inflowCfs()).isNull();
    }

    @Test
    @DisplayName("Debería lanzar IOException al intentar leer un archivo que no existe")
    void readFromFile_whenFileDoesNotExist_shouldThrowIOException() {
        Path nonExistentFile = tempDir.resolve("imaginary.json");

        IOException exception = assertThrows(IOException.class,
                () -> jsonFileHandler.readFromFile(nonExistentFile.toString(), CascadeDescription.class));

        assertThat(exception.getMessage()).contains("El archivo especificado no existe");
    }

    @Test
    @DisplayName("Debería lanzar IOException al intentar leer un archivo JSON mal formado")
    void readFromFile_whenJsonIsMalformed_shouldThrowIOException() throws IOException {
        Path malformed = tempDir.resolve("malformed.json");
        Files.writeString(malformed, "{ \"cascade_id\": \"BROKEN\", ");

        assertThrows(IOException.class,
                () -> jsonFileHandler.readFromFile(malformed.toString(), CascadeDescription.class));
    }
}
