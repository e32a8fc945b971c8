package hydrocascade.io;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Lectura y escritura de descripciones de cascadas, series de aportaciones y trayectorias
 * de embalses en ficheros JSON.
 * <p>
 * Los instantes se escriben en ISO-8601. Thread-Safe.
 */
@Slf4j
public class JsonFileHandler {

    private static final ObjectMapper objectMapper = createConfiguredObjectMapper();

    private static ObjectMapper createConfiguredObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.findAndRegisterModules();
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    /**
     * Serializa un objeto a JSON, sobrescribiendo el fichero si existe y creando los
     * directorios intermedios.
     *
     * @throws IOException si falla la escritura.
     */
    public <T> void writeToFile(T data, String filePath) throws IOException {
        Path path = Paths.get(filePath).toAbsolutePath();
        log.info("Escribiendo {} en {}", data.getClass().getSimpleName(), path);

        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            objectMapper.writeValue(path.toFile(), data);
        } catch (IOException e) {
            log.error("Error al escribir el archivo JSON en {}", path, e);
            throw e;
        }
    }

    /**
     * @throws IOException si el fichero no existe o el JSON no es válido para el tipo pedido.
     */
    public <T> T readFromFile(String filePath, Class<T> objectType) throws IOException {
        Path path = requireExisting(filePath);
        log.info("Leyendo {} como {}", path, objectType.getSimpleName());

        try {
            return objectMapper.readValue(path.toFile(), objectType);
        } catch (IOException e) {
            log.error("Error al leer o interpretar el archivo JSON {}", path, e);
            throw e;
        }
    }

    /**
     * Variante para tipos genéricos (listas de filas, mapas de estados).
     */
    public <T> T readFromFile(String filePath, TypeReference<T> objectType) throws IOException {
        Path path = requireExisting(filePath);
        log.info("Leyendo {} como {}", path, objectType.getType().getTypeName());

        try {
            return objectMapper.readValue(path.toFile(), objectType);
        } catch (IOException e) {
            log.error("Error al leer o interpretar el archivo JSON {}", path, e);
            throw e;
        }
    }

    private static Path requireExisting(String filePath) throws IOException {
        Path path = Paths.get(filePath).toAbsolutePath();
        if (!Files.exists(path)) {
            throw new IOException("El archivo especificado no existe: " + path);
        }
        return path;
    }
}
