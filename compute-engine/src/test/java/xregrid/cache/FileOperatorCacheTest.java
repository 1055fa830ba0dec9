package xregrid.cache;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import xregrid.domain.exception.IncompatibleCacheError;
import xregrid.domain.operator.ExtrapMethod;
import xregrid.domain.operator.Extrapolation;
import xregrid.domain.operator.RegridMethod;
import xregrid.domain.operator.RegridOperator;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class FileOperatorCacheTest {

    @TempDir
    Path tempDir;

    private static RegridOperator operator() {
        return RegridOperator.builder()
                .rows(new int[]{0, 1, 1})
                .cols(new int[]{0, 0, 2})
                .weights(new double[]{1.0, 0.25, 0.75})
                .nTarget(2)
                .nSource(3)
                .sourceShape(new int[]{1, 3})
                .method(RegridMethod.CONSERVATIVE)
                .periodic(true)
                .fingerprint("abc123")
                .build();
    }

    @Test
    @DisplayName("Un operador guardado se recupera idéntico desde su documento JSON")
    void storeAndLoad_shouldRoundTripOperator() {
        // --- 1. ARRANGE ---
        FileOperatorCache cache = new FileOperatorCache(tempDir.resolve("weights"));

        // --- 2. ACT ---
        cache.store("abc123", operator());
        Optional<RegridOperator> loaded = cache.load("abc123");

        // --- 3. ASSERT ---
        assertThat(cache.pathFor("abc123")).exists().hasFileName("abc123.json");
        assertThat(loaded).isPresent();
        RegridOperator op = loaded.get();
        assertThat(op.getRows()).containsExactly(0, 1, 1);
        assertThat(op.getCols()).containsExactly(0, 0, 2);
        assertThat(op.getWeights()).containsExactly(1.0, 0.25, 0.75);
        assertThat(op.getSourceShape()).containsExactly(1, 3);
        assertThat(op.getMethod()).isEqualTo(RegridMethod.CONSERVATIVE);
        assertThat(op.isPeriodic()).isTrue();
        assertThat(op.getFingerprint()).isEqualTo("abc123");
    }

    @Test
    @DisplayName("Una clave sin documento es un fallo de caché, no un error")
    void load_whenMissing_shouldReturnEmpty() {
        FileOperatorCache cache = new FileOperatorCache(tempDir);

        assertThat(cache.load("missing")).isEmpty();
    }

    @Test
    @DisplayName("Una versión de esquema distinta produce IncompatibleCacheError")
    void load_withOtherSchemaVersion_shouldFail() throws IOException {
        FileOperatorCache cache = new FileOperatorCache(tempDir);
        Files.writeString(cache.pathFor("old"), """
        { "schemaVersion": 0, "fingerprint": "old", "method": "bilinear" }
        """);

        IncompatibleCacheError ex = assertThrows(IncompatibleCacheError.class, () -> cache.load("old"));
        assertThat(ex.getMessage()).contains("Versión de esquema 0");
    }

    @Test
    @DisplayName("Un documento ilegible o inconsistente produce IncompatibleCacheError")
    void load_withCorruptDocument_shouldFail() throws IOException {
        FileOperatorCache cache = new FileOperatorCache(tempDir);
        Files.writeString(cache.pathFor("broken"), "{ not json");
        Files.writeString(cache.pathFor("inconsistent"), """
        { "schemaVersion": 1, "fingerprint": "x", "method": "bilinear", "periodic": false,
          "nSource": 2, "nTarget": 1, "sourceShape": [2], "targetShape": [1],
          "rows": [0], "cols": [5], "weights": [1.0] }
        """);

        assertThrows(IncompatibleCacheError.class, () -> cache.load("broken"));
        assertThrows(IncompatibleCacheError.class, () -> cache.load("inconsistent"));
    }

    @Test
    @DisplayName("Un fichero de pesos fijo se usa para cualquier clave")
    void forFile_shouldIgnoreKeys() {
        Path file = tempDir.resolve("weights.json");
        FileOperatorCache cache = FileOperatorCache.forFile(file);

        cache.store("first", operator());

        assertThat(cache.pathFor("other")).isEqualTo(file);
        assertThat(cache.load("other")).map(RegridOperator::nnz).contains(3);
        assertThat(cache.read(file).schemaVersion()).isEqualTo(PersistedOperator.SCHEMA_VERSION);
    }

    @Test
    @DisplayName("La extrapolación se persiste con los pesos y un documento sin ella se carga sin extrapolación")
    void storeAndLoad_shouldPersistExtrapolation() throws IOException {
        // --- 1. ARRANGE ---
        FileOperatorCache cache = new FileOperatorCache(tempDir);
        Extrapolation extrapolation = new Extrapolation(ExtrapMethod.NEAREST_IDW, 3.0);
        Files.writeString(cache.pathFor("legacy"), """
        { "schemaVersion": 1, "fingerprint": "x", "method": "bilinear", "periodic": false,
          "nSource": 2, "nTarget": 1, "sourceShape": [2], "targetShape": [1],
          "rows": [0], "cols": [1], "weights": [1.0] }
        """);

        // --- 2. ACT ---
        cache.store("idw", operator().toBuilder().extrapolation(extrapolation).build());
        RegridOperator loaded = cache.load("idw").orElseThrow();
        RegridOperator legacy = cache.load("legacy").orElseThrow();

        // --- 3. ASSERT ---
        assertThat(Files.readString(cache.pathFor("idw"))).contains("extrapMethod", "nearest_idw");
        assertThat(loaded.getExtrapolation()).isEqualTo(extrapolation);
        assertThat(legacy.getExtrapolation()).isEqualTo(Extrapolation.DISABLED);
    }

    @Test
    @DisplayName("Un método de extrapolación desconocido en el documento produce IncompatibleCacheError")
    void load_withUnknownExtrapolation_shouldFail() throws IOException {
        FileOperatorCache cache = new FileOperatorCache(tempDir);
        Files.writeString(cache.pathFor("creep"), """
        { "schemaVersion": 1, "fingerprint": "x", "method": "bilinear", "periodic": false,
          "nSource": 2, "nTarget": 1, "sourceShape": [2], "targetShape": [1],
          "rows": [0], "cols": [1], "weights": [1.0], "extrapMethod": "creep_fill" }
        """);

        assertThrows(IncompatibleCacheError.class, () -> cache.load("creep"));
    }
}
