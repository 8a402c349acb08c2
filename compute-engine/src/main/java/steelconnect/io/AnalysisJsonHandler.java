package steelconnect.io;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import steelconnect.config.AnalysisConfig;
import steelconnect.domain.result.ConnectionDemand;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Lectura y escritura en JSON de resultados y configuraciones del motor.
 * <p>
 * Los resultados se exportan para el colaborador de visualización y para archivar
 * comprobaciones; la configuración puede cargarse desde archivo en lugar de usar
 * {@link AnalysisConfig#defaults()}.
 */
@Slf4j
public class AnalysisJsonHandler {

    // Reutilizable y thread-safe una vez configurado.
    private static final ObjectMapper MAPPER = createMapper();

    private static ObjectMapper createMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.findAndRegisterModules();
        return mapper;
    }

    /**
     * Serializa cualquier objeto compatible con Jackson. Sobrescribe el archivo si existe.
     *
     * @param data Objeto a escribir. No puede ser nulo.
     * @param path Ruta de destino; los directorios padre se crean si faltan.
     * @throws IOException Si falla la escritura.
     */
    public <T> void write(T data, Path path) throws IOException {
        log.info("Escribiendo {} en {}", data.getClass().getSimpleName(), path.toAbsolutePath());
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            MAPPER.writeValue(path.toFile(), data);
        } catch (IOException e) {
            log.error("No se pudo escribir el JSON en {}", path.toAbsolutePath(), e);
            throw e;
        }
    }

    /**
     * @param path Archivo JSON existente.
     * @param type Tipo de destino.
     * @throws IOException Si el archivo no existe o su contenido no es válido.
     */
    public <T> T read(Path path, Class<T> type) throws IOException {
        log.info("Leyendo {} desde {}", type.getSimpleName(), path.toAbsolutePath());
        if (!Files.exists(path)) {
            throw new IOException("El archivo especificado no existe: " + path.toAbsolutePath());
        }
        try {
            return MAPPER.readValue(path.toFile(), type);
        } catch (IOException e) {
            log.error("JSON inválido en {}", path.toAbsolutePath(), e);
            throw e;
        }
    }

    public void writeDemand(ConnectionDemand demand, Path path) throws IOException {
        write(demand, path);
    }

    public ConnectionDemand readDemand(Path path) throws IOException {
        return read(path, ConnectionDemand.class);
    }

    public AnalysisConfig readConfig(Path path) throws IOException {
        return read(path, AnalysisConfig.class);
    }

    /**
     * Representación JSON en memoria, útil para registrar un resultado en logs.
     */
    public String toJson(Object data) throws IOException {
        return MAPPER.writeValueAsString(data);
    }
}
