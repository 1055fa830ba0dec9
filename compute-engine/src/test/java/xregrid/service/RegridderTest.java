package xregrid.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import xregrid.TestGrids;
import xregrid.config.RegridConfig;
import xregrid.domain.dataset.DataVariable;
import xregrid.domain.dataset.GridDataset;
import xregrid.domain.exception.IncompatibleCacheError;
import xregrid.domain.operator.ExtrapMethod;
import xregrid.domain.operator.Extrapolation;
import xregrid.domain.operator.RegridMethod;
import xregrid.factory.GridDatasetFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RegridderTest {

    private final GridDataset globalGrid = GridDatasetFactory.createGlobalGrid(30, 30);
    private final GridDataset regionalGrid = GridDatasetFactory.createRegionalGrid(
            new double[]{-30, 30}, new double[]{0, 90}, 15, 15, true);

    private GridDataset globalData() {
        DataVariable tas = TestGrids.filled("tas", List.of("time", "lat", "lon"), new int[]{2, 6, 12}, 5.0)
                .withAttribute("units", "K");
        DataVariable stations = DataVariable.builder()
                .name("station_id").dims(List.of("station")).shape(new int[]{3})
                .data(new double[]{101, 102, 103})
                .build();
        return globalGrid.withVariable(tas).withVariable(stations);
    }

    @Test
    @DisplayName("Un dataset se regridea completo: datos transformados, no espaciales conservados y coordenadas destino")
    void regrid_dataset_shouldTransformSpatialVariables() {
        // --- 1. ARRANGE ---
        RegridConfig config = RegridConfig.getDefault().withMethod(RegridMethod.BILINEAR);

        // --- 2. ACT ---
        GridDataset result;
        try (Regridder regridder = new Regridder(globalData(), regionalGrid, config)) {
            result = regridder.regrid(globalData());
            assertThat(regridder.isPeriodic()).isTrue();
        }

        // --- 3. ASSERT ---
        assertThat(result.variables()).extracting(DataVariable::getName)
                .containsExactlyInAnyOrder("tas", "station_id", "lat", "lon");
        DataVariable tas = result.variable("tas").orElseThrow();
        assertThat(tas.getDims()).containsExactly("time", "lat", "lon");
        assertThat(tas.getShape()).containsExactly(2, 4, 6);
        for (double value : tas.getData()) {
            assertThat(value).isCloseTo(5.0, within(1e-12));
        }
        assertThat(tas.getAttributes()).containsEntry("units", "K");
        assertThat(result.variable("station_id").orElseThrow().getData()).containsExactly(101, 102, 103);
        assertThat(result.variable("lat").orElseThrow().getData()).containsExactly(-22.5, -7.5, 7.5, 22.5);

        String[] history = result.stringAttribute("history").orElseThrow().split("\n");
        assertThat(history).hasSize(2);
        assertThat(history[0]).endsWith("Regridded Dataset using xregrid (method=bilinear)");
        assertThat(history[1]).endsWith("Created global grid (30.0x30.0) using xregrid.");
    }

    @Test
    @DisplayName("El regridding conservativo preserva un campo constante")
    void regridVariable_conservative_shouldPreserveConstantField() {
        RegridConfig config = RegridConfig.getDefault().withMethod(RegridMethod.CONSERVATIVE);
        DataVariable tas = globalData().variable("tas").orElseThrow();

        DataVariable result;
        try (Regridder regridder = new Regridder(globalGrid, regionalGrid, config)) {
            result = regridder.regridVariable(tas);
        }

        for (double value : result.getData()) {
            assertThat(value).isCloseTo(5.0, within(1e-9));
        }
        assertThat(result.stringAttribute("history")).get().asString()
                .endsWith("Regridded using xregrid (method=conservative)");
    }

    @Test
    @DisplayName("Las celdas destino fuera de la malla origen quedan sin mapear y valen NaN")
    void qualityReport_shouldCountUnmappedTargets() {
        GridDataset smallSource = GridDatasetFactory.createRegionalGrid(
                new double[]{0, 30}, new double[]{0, 30}, 10, 10, true);
        DataVariable field = TestGrids.filled("tas", List.of("lat", "lon"), new int[]{3, 3}, 1.0);

        try (Regridder regridder = new Regridder(smallSource, globalGrid, RegridConfig.getDefault())) {
            QualityReport report = regridder.qualityReport();
            DataVariable result = regridder.regridVariable(field);

            assertThat(regridder.isPeriodic()).isFalse();
            assertThat(report.unmappedCount()).isEqualTo(71);
            assertThat(report.unmappedFraction()).isCloseTo(71.0 / 72.0, within(1e-12));
            assertThat(Arrays.stream(result.getData()).filter(Double::isNaN).count()).isEqualTo(71L);
            assertThat(regridder.toString()).contains("unmapped=71");
        }
    }

    @Test
    @DisplayName("Con reuseWeights el segundo regridder carga el operador persistido en el directorio de caché")
    void reuseWeights_shouldPersistAndReloadOperator(@TempDir Path cacheDir) throws IOException {
        RegridConfig config = RegridConfig.getDefault()
                .withReuseWeights(true)
                .withCacheDirectory(cacheDir.toString());

        Regridder first = new Regridder(globalGrid, regionalGrid, config);
        Regridder second = new Regridder(globalGrid, regionalGrid, config);

        try (Stream<Path> files = Files.list(cacheDir)) {
            assertThat(files.map(p -> p.getFileName().toString()))
                    .containsExactly(first.getOperator().getFingerprint() + ".json");
        }
        assertThat(second.getOperator().getFingerprint()).isEqualTo(first.getOperator().getFingerprint());
        assertThat(second.getOperator().getWeights()).containsExactly(first.getOperator().getWeights());
        first.close();
        second.close();
    }

    @Test
    @DisplayName("Con varios workers el resultado coincide con el secuencial")
    void parallelConfig_shouldMatchSequentialResult() {
        DataVariable tas = TestGrids.ramp("tas", List.of("time", "lat", "lon"), 5, 6, 12);
        RegridConfig sequential = RegridConfig.getDefault();
        RegridConfig parallel = sequential.withWorkerCount(3).withChunkSize(2)
                .withParallelWeights(true).withPartitionCount(4);

        DataVariable expected;
        DataVariable actual;
        try (Regridder serial = new Regridder(globalGrid, regionalGrid, sequential);
             Regridder threaded = new Regridder(globalGrid, regionalGrid, parallel)) {
            expected = serial.regridVariable(tas);
            actual = threaded.regridVariable(tas);
        }

        assertThat(actual.getShape()).containsExactly(expected.getShape());
        assertThat(actual.getData()).containsExactly(expected.getData());
    }

    @Test
    @DisplayName("Sin configuración se usa la configuración por defecto")
    void nullConfig_shouldUseDefaults() {
        try (Regridder regridder = new Regridder(globalGrid, regionalGrid, null)) {
            assertThat(regridder.getConfig()).isEqualTo(RegridConfig.getDefault());
            assertThat(regridder.getOperator().getMethod()).isEqualTo(RegridMethod.BILINEAR);
            assertThat(regridder.getTargetGrid().cellCount()).isEqualTo(24);
            assertThat(regridder.regrid(globalData().variable("tas").orElseThrow()).variable("lon"))
                    .get().extracting(v -> v.getAttributes().get("standard_name"))
                    .isEqualTo("longitude");
        }
    }

    @Test
    @DisplayName("Una coordenada auxiliar sobre la malla se regridea y sigue siendo coordenada")
    void regrid_dataset_shouldRegridAuxiliaryCoordinates() {
        // --- 1. ARRANGE ---
        double[] heights = new double[6 * 12];
        Arrays.fill(heights, 100.0);
        DataVariable altitude = DataVariable.coordinate2d("altitude", List.of("lat", "lon"), new int[]{6, 12},
                heights, Map.of("standard_name", "surface_altitude", "units", "m"));
        GridDataset dataset = globalData().withVariable(altitude);

        // --- 2. ACT ---
        GridDataset result;
        try (Regridder regridder = new Regridder(globalGrid, regionalGrid, RegridConfig.getDefault())) {
            result = regridder.regrid(dataset);
        }

        // --- 3. ASSERT ---
        DataVariable regridded = result.variable("altitude").orElseThrow();
        assertThat(regridded.isCoordinate()).isTrue();
        assertThat(regridded.getDims()).containsExactly("lat", "lon");
        assertThat(regridded.getShape()).containsExactly(4, 6);
        assertThat(regridded.getAttributes()).containsEntry("units", "m");
        for (double value : regridded.getData()) {
            assertThat(value).isCloseTo(100.0, within(1e-12));
        }
        assertThat(result.variables()).extracting(DataVariable::getName).doesNotHaveDuplicates();
    }

    @Test
    @DisplayName("Con extrapolación nearest_s2d no quedan celdas sin mapear y el historial la registra")
    void extrapolation_shouldFillUnmappedTargetsAndRecordHistory() {
        // --- 1. ARRANGE ---
        GridDataset smallSource = GridDatasetFactory.createRegionalGrid(
                new double[]{0, 30}, new double[]{0, 30}, 10, 10, true);
        DataVariable field = TestGrids.filled("tas", List.of("lat", "lon"), new int[]{3, 3}, 1.0);
        RegridConfig config = RegridConfig.getDefault().withExtrapMethod(ExtrapMethod.NEAREST_S2D);

        // --- 2. ACT ---
        DataVariable result;
        QualityReport report;
        try (Regridder regridder = new Regridder(smallSource, globalGrid, config)) {
            report = regridder.qualityReport();
            result = regridder.regridVariable(field);
        }

        // --- 3. ASSERT ---
        assertThat(report.unmappedCount()).isZero();
        for (double value : result.getData()) {
            assertThat(value).isCloseTo(1.0, within(1e-12));
        }
        assertThat(result.stringAttribute("history")).get().asString()
                .endsWith("Regridded using xregrid (method=bilinear, extrap_method=nearest_s2d)");
    }

    @Test
    @DisplayName("La extrapolación se persiste con los pesos y pedir otra al reutilizarlos falla")
    void reuseWeights_withOtherExtrapolation_shouldFail(@TempDir Path cacheDir) {
        // --- 1. ARRANGE ---
        RegridConfig config = RegridConfig.getDefault()
                .withReuseWeights(true)
                .withWeightsFile(cacheDir.resolve("pesos.json").toString())
                .withExtrapMethod(ExtrapMethod.NEAREST_IDW)
                .withExtrapDistExponent(3.0);

        // --- 2. ACT ---
        Regridder first = new Regridder(globalGrid, regionalGrid, config);
        Regridder loaded = new Regridder(globalGrid, regionalGrid, config);
        IncompatibleCacheError mismatch = assertThrows(IncompatibleCacheError.class, () ->
                new Regridder(globalGrid, regionalGrid, config.withExtrapMethod(ExtrapMethod.NEAREST_S2D)));

        // --- 3. ASSERT ---
        assertThat(first.getOperator().getExtrapolation()).isEqualTo(new Extrapolation(ExtrapMethod.NEAREST_IDW, 3.0));
        assertThat(loaded.getOperator().getExtrapolation()).isEqualTo(first.getOperator().getExtrapolation());
        assertThat(loaded.getOperator().getFingerprint()).isEqualTo(first.getOperator().getFingerprint());
        assertThat(mismatch.getMessage()).contains("no coincide");
        first.close();
        loaded.close();
    }
}
