package hydrogenlab.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import hydrogenlab.config.SimulationConfig;
import hydrogenlab.domain.spectrometer.SpectrometerSnapshot;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Persistencia JSON de la simulación: configuraciones ({@link SimulationConfig}) e
 * instantáneas del espectrómetro ({@link SpectrometerSnapshot}).
 * <p>
 * Toda configuración leída se valida antes de devolverse.
 */
@Slf4j
public class SimulationJsonStore {

    /**
     * Recurso del classpath con la configuración por defecto.
     */
    public static final String DEFAULT_CONFIG_RESOURCE = "config/default-simulation.json";

    // Thread-safe, se comparte entre instancias
    private static final ObjectMapper objectMapper = createConfiguredObjectMapper();

    private static ObjectMapper createConfiguredObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.findAndRegisterModules();
        return mapper;
    }

    /**
     * Carga y valida la configuración empaquetada en {@link #DEFAULT_CONFIG_RESOURCE}.
     *
     * @throws IOException si el recurso falta o no es un JSON válido.
     */
    public SimulationConfig loadDefaultConfig() throws IOException {
        return loadConfigResource(DEFAULT_CONFIG_RESOURCE);
    }

    public SimulationConfig loadConfigResource(String resource) throws IOException {
        log.info("Cargando configuración desde el recurso {}", resource);
        try (InputStream in = SimulationJsonStore.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IOException("El recurso especificado no existe en el classpath: " + resource);
            }
            return objectMapper.readValue(in, SimulationConfig.class).validate();
        } catch (IOException e) {
            log.error("Error al leer o parsear la configuración {}", resource, e);
            throw e;
        }
    }

    /**
     * Carga y valida una configuración desde disco.
     *
     * @throws IOException si el archivo no existe o su contenido no es válido.
     * @throws IllegalArgumentException si la configuración leída no supera {@link SimulationConfig#validate()}.
     */
    public SimulationConfig loadConfig(Path file) throws IOException {
        return read(file, SimulationConfig.class).validate();
    }

    public void saveConfig(SimulationConfig config, Path file) throws IOException {
        write(config, file);
    }

    /**
     * Exporta una instantánea a {@code directory/snapshot-<n>-<modelo>.json}.
     *
     * @return la ruta del archivo escrito.
     */
    public Path exportSnapshot(SpectrometerSnapshot snapshot, Path directory) throws IOException {
        String fileName = String.format("snapshot-%d-%s.json",
                snapshot.snapshotNumber(), snapshot.atomicModel().name().toLowerCase(Locale.ROOT));
        Path file = directory.resolve(fileName);
        write(snapshot, file);
        return file;
    }

    public SpectrometerSnapshot importSnapshot(Path file) throws IOException {
        return read(file, SpectrometerSnapshot.class);
    }

    private <T> void write(T data, Path file) throws IOException {
        Path path = file.toAbsolutePath();
        log.info("Serializando {} a {}", data.getClass().getSimpleName(), path);
        try {
            Files.createDirectories(path.getParent());
            objectMapper.writeValue(path.toFile(), data);
        } catch (IOException e) {
            log.error("Error al escribir el archivo JSON en {}", path, e);
            throw e;
        }
    }

    private <T> T read(Path file, Class<T> type) throws IOException {
        Path path = file.toAbsolutePath();
        log.info("Deserializando {} a {}", path, type.getSimpleName());
        if (!Files.exists(path)) {
            throw new IOException("El archivo especificado no existe: " + path);
        }
        try {
            return objectMapper.readValue(path.toFile(), type);
        } catch (IOException e) {
            log.error("Error al leer o parsear el archivo JSON {}", path, e);
            throw e;
        }
    }
}
