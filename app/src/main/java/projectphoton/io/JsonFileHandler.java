package projectphoton.io;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import projectphoton.config.StackConfig;
import projectphoton.domain.dto.OpticalResultSummaryDTO;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Entrada y salida JSON del lanzador: configuraciones de apilamiento ({@link StackConfig})
 * y resúmenes de resultados ({@link OpticalResultSummaryDTO}).
 */
@Slf4j
public class JsonFileHandler {

    // Configurado una sola vez; ObjectMapper es thread-safe tras su configuración
    private static final ObjectMapper objectMapper = createConfiguredObjectMapper();

    private static ObjectMapper createConfiguredObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        // Campos desconocidos en la configuración se ignoran
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.findAndRegisterModules();
        return mapper;
    }

    /**
     * Lee una configuración de apilamiento. Los campos opcionales ausentes toman sus valores por defecto.
     *
     * @throws IOException Si el archivo no existe o no es una configuración válida.
     */
    public StackConfig readConfig(String filePath) throws IOException {
        Path path = Paths.get(filePath).toAbsolutePath();
        if (!Files.isRegularFile(path)) {
            throw new IOException("No se encuentra la configuración del apilamiento: " + path);
        }

        try {
            StackConfig config = objectMapper.readValue(path.toFile(), StackConfig.class);
            log.info("Configuración cargada de {}: {} capas, {}-{} nm.", path, config.layers().size(),
                    config.wavelengthStart(), config.wavelengthStop());
            return config;
        } catch (IOException e) {
            log.error("Configuración de apilamiento ilegible en {}", path, e);
            throw e;
        }
    }

    /**
     * Guarda una configuración de apilamiento (por ejemplo el dispositivo de referencia) para editarla después.
     */
    public void writeConfig(StackConfig config, String filePath) throws IOException {
        write(config, filePath, "configuración");
    }

    /**
     * Escribe el resumen de una simulación, sobrescribiendo el archivo si existe.
     */
    public void writeSummary(OpticalResultSummaryDTO summary, String filePath) throws IOException {
        write(summary, filePath, "resumen óptico");
    }

    private void write(Object data, String filePath, String description) throws IOException {
        Path path = Paths.get(filePath).toAbsolutePath();
        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            objectMapper.writeValue(path.toFile(), data);
            log.info("Guardado {} en {}", description, path);
        } catch (IOException e) {
            log.error("No se pudo guardar {} en {}", description, path, e);
            throw e;
        }
    }
}
