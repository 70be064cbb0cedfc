package starabund.io;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import starabund.config.SolverConfig;
import starabund.domain.fit.AbundanceResult;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Lectura y escritura JSON de la configuración del solver y de los informes de resultados.
 */
@Slf4j
public class JsonFileHandler {

    // Reutilizable y thread-safe
    private static final ObjectMapper objectMapper = createConfiguredObjectMapper();

    private static ObjectMapper createConfiguredObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        // Los informes pueden llevar campos añadidos por otras herramientas
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.findAndRegisterModules();
        return mapper;
    }

    public SolverConfig readConfig(Path path) throws IOException {
        return readFromFile(path, SolverConfig.class);
    }

    public void writeConfig(SolverConfig config, Path path) throws IOException {
        writeToFile(config, path);
    }

    /**
     * Escribe el informe de un espectro. Sobrescribe el archivo si existe.
     */
    public void writeReport(AbundanceResult result, Path path) throws IOException {
        writeToFile(result, path);
    }

    public AbundanceResult readReport(Path path) throws IOException {
        return readFromFile(path, AbundanceResult.class);
    }

    public <T> void writeToFile(T data, Path path) throws IOException {
        log.info("Serializando {} a {}", data.getClass().getSimpleName(), path.toAbsolutePath());
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(path.toFile(), data);
        } catch (IOException e) {
            log.error("Error al escribir el archivo JSON {}", path.toAbsolutePath(), e);
            throw e;
        }
    }

    public <T> T readFromFile(Path path, Class<T> type) throws IOException {
        log.info("Deserializando {} como {}", path.toAbsolutePath(), type.getSimpleName());
        if (!Files.exists(path)) {
            throw new IOException("El archivo especificado no existe: " + path.toAbsolutePath());
        }
        try {
            return objectMapper.readValue(path.toFile(), type);
        } catch (IOException e) {
            log.error("Error al leer o parsear el archivo JSON {}", path.toAbsolutePath(), e);
            throw e;
        }
    }
}
