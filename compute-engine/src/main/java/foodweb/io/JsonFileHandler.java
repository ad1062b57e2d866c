package foodweb.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import foodweb.config.SimulationConfig;
import foodweb.domain.ecosystem.Ecosystem;
import foodweb.domain.simulation.Trajectory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Lectura y escritura de ecosistemas, configuraciones y trayectorias en JSON.
 * <p>
 * Los compartimentos se serializan con un discriminador {@code "type"}
 * ({@code autotroph}, {@code heterotroph}, {@code carbonPool}, {@code nutrientPool}).
 */
@Slf4j
public class JsonFileHandler {

    // Costoso de crear y thread-safe: una única instancia compartida.
    private static final ObjectMapper objectMapper = createConfiguredObjectMapper();

    private static ObjectMapper createConfiguredObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.findAndRegisterModules();
        return mapper;
    }

    /**
     * Serializa un objeto a un archivo JSON. Si el archivo ya existe, será sobrescrito.
     *
     * @throws IOException Si ocurre un error durante la escritura del archivo.
     */
    public <T> void writeToFile(T data, Path path) throws IOException {
        log.info("Serializando {} a archivo: {}", data.getClass().getSimpleName(), path.toAbsolutePath());
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(path.toFile(), data);
        } catch (IOException e) {
            log.error("Error al escribir el archivo JSON en {}", path.toAbsolutePath(), e);
            throw e;
        }
    }

    /**
     * Reconstruye un objeto del tipo indicado a partir de un archivo JSON.
     *
     * @throws IOException Si el archivo no existe o su contenido no es válido.
     */
    public <T> T readFromFile(Path path, Class<T> objectType) throws IOException {
        log.info("Deserializando {} a {}", path.toAbsolutePath(), objectType.getSimpleName());

        if (!Files.exists(path)) {
            throw new IOException("El archivo especificado no existe: " + path.toAbsolutePath());
        }
        try {
            return objectMapper.readValue(path.toFile(), objectType);
        } catch (IOException e) {
            log.error("Error al leer o parsear el archivo JSON {}", path.toAbsolutePath(), e);
            throw e;
        }
    }

    public Ecosystem readEcosystem(Path path) throws IOException {
        return readFromFile(path, Ecosystem.class);
    }

    public SimulationConfig readSimulationConfig(Path path) throws IOException {
        return readFromFile(path, SimulationConfig.class);
    }

    public void writeTrajectory(Trajectory trajectory, Path path) throws IOException {
        writeToFile(trajectory, path);
    }
}
