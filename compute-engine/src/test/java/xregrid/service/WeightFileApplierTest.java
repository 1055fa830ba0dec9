package xregrid.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import xregrid.TestGrids;
import xregrid.cache.FileOperatorCache;
import xregrid.domain.dataset.DataVariable;
import xregrid.domain.exception.IncompatibleCacheError;
import xregrid.domain.operator.RegridMethod;
import xregrid.domain.operator.RegridOperator;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class WeightFileApplierTest {

    @TempDir
    Path tempDir;

    private Path writeWeights() {
        // Media de las dos primeras celdas de una malla 2x2 en una malla de una celda
        RegridOperator operator = RegridOperator.builder()
                .rows(new int[]{0, 0})
                .cols(new int[]{0, 1})
                .weights(new double[]{0.5, 0.5})
                .nTarget(1).nSource(4)
                .sourceShape(new int[]{2, 2})
                .method(RegridMethod.CONSERVATIVE)
                .fingerprint("abc")
                .build();
        Path file = tempDir.resolve("weights").resolve("pesos.json");
        FileOperatorCache.forFile(file).store("abc", operator);
        return file;
    }

    @Test
    @DisplayName("Los pesos persistidos se aplican sin las mallas que los generaron")
    void apply_shouldUsePersistedOperator() {
        // --- 1. ARRANGE ---
        Path file = writeWeights();
        DataVariable data = TestGrids.ramp("tas", List.of("time", "lat", "lon"), 2, 2, 2);

        // --- 2. ACT ---
        WeightFileApplier applier = new WeightFileApplier(file);
        DataVariable result = applier.apply(data, false);

        // --- 3. ASSERT ---
        assertThat(applier.getOperator().getFingerprint()).isEqualTo("abc");
        assertThat(result.getDims()).containsExactly("time", "cell");
        assertThat(result.getData()).containsExactly(0.5, 4.5);
    }

    @Test
    @DisplayName("Las dimensiones espaciales pueden indicarse por nombre")
    void apply_withExplicitDims_shouldRenameTarget() {
        WeightFileApplier applier = new WeightFileApplier(writeWeights());
        DataVariable data = TestGrids.ramp("tas", List.of("y", "x", "time"), 2, 2, 1);

        DataVariable result = applier.apply(data, List.of("y", "x"), List.of("station"), false);

        assertThat(result.getDims()).containsExactly("station", "time");
        // celdas (0,0) y (0,1) con time=0 valen 0 y 1
        assertThat(result.getData()).containsExactly(0.5);
    }

    @Test
    @DisplayName("Un fichero de pesos inexistente se rechaza con IncompatibleCacheError")
    void constructor_missingFile_shouldFail() {
        assertThrows(IncompatibleCacheError.class, () -> new WeightFileApplier(tempDir.resolve("no-existe.json")));
    }
}
