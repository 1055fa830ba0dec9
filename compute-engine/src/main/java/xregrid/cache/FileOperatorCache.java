package xregrid.cache;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import xregrid.domain.exception.IncompatibleCacheError;
import xregrid.domain.operator.RegridOperator;
import xregrid.io.JsonFileHandler;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Caché de operadores en disco: un documento JSON por clave dentro de un directorio, o un
 * único fichero de pesos fijo ({@link #forFile(Path)}).
 * <p>
 * Política de carga:
 * 1. Fichero inexistente: fallo de caché.
 * 2. Versión de esquema desconocida o documento ilegible: {@link IncompatibleCacheError}.
 * La comparación de huellas con la malla pedida corresponde a quien llama.
 */
@Slf4j
public class FileOperatorCache implements OperatorCache {

    private final JsonFileHandler jsonHandler = new JsonFileHandler();
    private final Path directory;
    private final Path fixedFile;

    public FileOperatorCache(Path directory) {
        this(Objects.requireNonNull(directory, "El directorio de caché no puede ser nulo."), null);
    }

    private FileOperatorCache(Path directory, Path fixedFile) {
        this.directory = directory;
        this.fixedFile = fixedFile;
    }

    /**
     * Caché de un solo fichero de pesos: todas las claves leen y escriben el mismo documento.
     */
    public static FileOperatorCache forFile(Path weightsFile) {
        Objects.requireNonNull(weightsFile, "El fichero de pesos no puede ser nulo.");
        return new FileOperatorCache(null, weightsFile);
    }

    public Path pathFor(String key) {
        return fixedFile != null ? fixedFile : directory.resolve(key + ".json");
    }

    @Override
    public Optional<RegridOperator> load(String key) {
        Path path = pathFor(key);
        if (!Files.exists(path)) {
            log.info("Caché de operadores: sin documento para {} ({})", shortKey(key), path);
            return Optional.empty();
        }
        PersistedOperator persisted = read(path);
        try {
            RegridOperator operator = persisted.toOperator();
            log.info("Caché de operadores: operador {} cargado desde {} (nnz={})", shortKey(key), path, operator.nnz());
            return Optional.of(operator);
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new IncompatibleCacheError("El operador persistido en " + path + " es inconsistente: " + e.getMessage(), e);
        }
    }

    /**
     * Lee y valida un documento persistido sin compararlo con ninguna huella.
     */
    public PersistedOperator read(Path path) {
        JsonNode tree;
        try {
            tree = jsonHandler.readTree(path);
        } catch (IOException e) {
            throw new IncompatibleCacheError("No se pudo leer el operador persistido en " + path, e);
        }
        JsonNode version = tree.get("schemaVersion");
        if (version == null || !version.canConvertToInt() || version.asInt() != PersistedOperator.SCHEMA_VERSION) {
            throw new IncompatibleCacheError(String.format(
                    "Versión de esquema %s en %s; se esperaba %d.",
                    version == null ? "<ausente>" : version.asText(), path, PersistedOperator.SCHEMA_VERSION));
        }
        try {
            return jsonHandler.convert(tree, PersistedOperator.class);
        } catch (IOException e) {
            throw new IncompatibleCacheError("Documento de operador ilegible en " + path + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void store(String key, RegridOperator operator) {
        Path path = pathFor(key);
        try {
            jsonHandler.writeToFile(PersistedOperator.from(operator), path);
        } catch (IOException e) {
            throw new UncheckedIOException("No se pudo guardar el operador en " + path, e);
        }
        log.info("Caché de operadores: operador {} guardado en {} (nnz={})", shortKey(key), path, operator.nnz());
    }

    private static String shortKey(String key) {
        return key == null ? "<sin huella>" : key.substring(0, Math.min(12, key.length()));
    }
}
