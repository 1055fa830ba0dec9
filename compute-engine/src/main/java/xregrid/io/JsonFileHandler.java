package xregrid.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Gestiona la serialización (escritura) y deserialización (lectura) de objetos
 * hacia y desde archivos JSON: operadores persistidos y configuraciones de regridding.
 * <p>
 * Es genérica y trabaja con cualquier POJO o record compatible con Jackson.
 */
@Slf4j
public class JsonFileHandler {

    // El ObjectMapper es costoso de crear y es thread-safe: uno para toda la aplicación.
    private static final ObjectMapper objectMapper = createConfiguredObjectMapper();

    private static ObjectMapper createConfiguredObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        // Un campo desconocido en un fichero de pesos es un cambio de esquema, no algo a ignorar.
        mapper.enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.findAndRegisterModules();
        return mapper;
    }

    /**
     * Serializa un objeto a un archivo JSON. Si el archivo ya existe, será sobrescrito.
     *
     * @param data     El objeto a serializar. No puede ser nulo.
     * @param filePath Ruta completa del archivo de destino (ej: "cache/weights/3fa1....json").
     * @throws IOException Si ocurre un error durante la escritura.
     */
    public <T> void writeToFile(T data, Path filePath) throws IOException {
        log.debug("Serializando {} a archivo: {}", data.getClass().getSimpleName(), filePath.toAbsolutePath());
        try {
            Path parent = filePath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(filePath.toFile(), data);
        } catch (IOException e) {
            log.error("Error fatal al escribir el archivo JSON en {}", filePath.toAbsolutePath(), e);
            throw e;
        }
    }

    /**
     * Deserializa un archivo JSON a un objeto del tipo indicado.
     *
     * @throws IOException Si el archivo no existe o hay un error de lectura o formato.
     */
    public <T> T readFromFile(Path filePath, Class<T> objectType) throws IOException {
        log.debug("Deserializando {} a {}", filePath.toAbsolutePath(), objectType.getSimpleName());
        if (!Files.exists(filePath)) {
            throw new IOException("El archivo especificado no existe: " + filePath.toAbsolutePath());
        }
        try {
            return objectMapper.readValue(filePath.toFile(), objectType);
        } catch (IOException e) {
            log.error("Error fatal al leer o parsear el archivo JSON desde {}", filePath.toAbsolutePath(), e);
            throw e;
        }
    }

    /**
     * Lee el árbol JSON sin ligarlo a ningún tipo (para inspeccionar versiones de esquema).
     */
    public JsonNode readTree(Path filePath) throws IOException {
        if (!Files.exists(filePath)) {
            throw new IOException("El archivo especificado no existe: " + filePath.toAbsolutePath());
        }
        return objectMapper.readTree(filePath.toFile());
    }

    /**
     * Convierte un árbol ya leído al tipo indicado.
     */
    public <T> T convert(JsonNode node, Class<T> objectType) throws JsonProcessingException {
        return objectMapper.treeToValue(node, objectType);
    }
}
