package xregrid.parallel;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import xregrid.TestGrids;
import xregrid.apply.SpatialLayout;
import xregrid.apply.SparseApplicationEngine;
import xregrid.domain.dataset.DataVariable;
import xregrid.domain.exception.ChunkFailure;
import xregrid.domain.exception.PartitionConsistencyError;
import xregrid.domain.grid.CanonicalGrid;
import xregrid.domain.operator.RegridMethod;
import xregrid.domain.operator.RegridOperator;
import xregrid.domain.operator.RowRange;
import xregrid.weights.WeightGenerationEngine;
import xregrid.weights.impl.GeometricWeightBackend;

import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ChunkOrchestratorTest {

    @Mock
    private WeightGenerationEngine mockedWeightEngine;

    private final CanonicalGrid source = TestGrids.rectilinear(-90, 90, 0, 360, 30);
    private final CanonicalGrid target = TestGrids.rectilinear(-60, 60, 0, 360, 20);
    private final WeightGenerationEngine weightEngine = new WeightGenerationEngine(new GeometricWeightBackend());

    private static RegridOperator singleRow(int nTarget, int row) {
        return RegridOperator.builder()
                .rows(new int[]{row}).cols(new int[]{0}).weights(new double[]{1.0})
                .nTarget(nTarget).nSource(2).method(RegridMethod.BILINEAR)
                .build();
    }

    @Test
    @DisplayName("La aplicación paralela por chunks es idéntica a la aplicación secuencial")
    void applyParallel_shouldMatchSerialResult() {
        // --- 1. ARRANGE ---
        RegridOperator op = weightEngine.generate(source, target, RegridMethod.BILINEAR, true);
        Random random = new Random(42);
        double[] values = new double[10 * source.cellCount()];
        for (int i = 0; i < values.length; i++) {
            values[i] = random.nextInt(10) == 0 ? Double.NaN : random.nextGaussian();
        }
        DataVariable data = DataVariable.builder().name("tas")
                .dims(List.of("time", "lat", "lon")).shape(new int[]{10, 6, 12}).data(values).build();
        SpatialLayout layout = new SpatialLayout(List.of("lat", "lon"), List.of("lat", "lon"));
        SparseApplicationEngine applicationEngine = new SparseApplicationEngine();

        // --- 2. ACT ---
        DataVariable serial = applicationEngine.apply(op, data, layout, true);
        DataVariable parallel;
        try (LocalExecutionContext context = new LocalExecutionContext(3)) {
            parallel = new ChunkOrchestrator(context, applicationEngine, null)
                    .applyParallel(op, data, layout, true, 3);
        }

        // --- 3. ASSERT ---
        assertThat(parallel.getDims()).isEqualTo(serial.getDims());
        assertThat(parallel.getShape()).containsExactly(serial.getShape());
        assertThat(parallel.getData()).containsExactly(serial.getData());
    }

    @Test
    @DisplayName("Si fallan varios chunks se lanza ChunkFailure con el índice más bajo")
    void applyParallel_shouldReportLowestFailedChunk() {
        RegridOperator op = weightEngine.generate(source, target, RegridMethod.NEAREST_S2D, false);
        DataVariable data = TestGrids.ramp("tas", List.of("time", "lat", "lon"), 5, 6, 12);
        SparseApplicationEngine applicationEngine = spy(new SparseApplicationEngine());
        IllegalStateException boom = new IllegalStateException("boom");
        lenient().doThrow(boom).when(applicationEngine).applyJob(any(), argThat(job -> job != null && job.chunkIndex() >= 2));
        ChunkOrchestrator orchestrator = new ChunkOrchestrator(ExecutionContext.sameThread(), applicationEngine, null);

        ChunkFailure failure = assertThrows(ChunkFailure.class, () -> orchestrator.applyParallel(
                op, data, new SpatialLayout(List.of("lat", "lon"), List.of("lat", "lon")), false, 1));

        assertThat(failure.getChunkIndex()).isEqualTo(2);
        assertThat(failure.getCause()).isSameAs(boom);
        assertThat(failure.getMessage()).contains("chunk 2");
    }

    @Test
    @DisplayName("Un tamaño de chunk no positivo se rechaza")
    void applyParallel_shouldRejectNonPositiveChunkSize() {
        ChunkOrchestrator orchestrator = new ChunkOrchestrator(
                ExecutionContext.sameThread(), new SparseApplicationEngine(), null);
        DataVariable data = TestGrids.ramp("tas", List.of("x"), 2);

        assertThrows(IllegalArgumentException.class, () -> orchestrator.applyParallel(
                singleRow(1, 0), data, new SpatialLayout(List.of("x"), List.of("x")), false, 0));
    }

    @Test
    @DisplayName("La generación por particiones produce el mismo operador que la generación completa")
    void generateParallel_shouldMatchSerialOperator() {
        RegridOperator serial = weightEngine.generate(source, target, RegridMethod.CONSERVATIVE, true);
        RegridOperator parallel;
        try (LocalExecutionContext context = new LocalExecutionContext(4)) {
            parallel = new ChunkOrchestrator(context, new SparseApplicationEngine(), weightEngine)
                    .generateParallel(source, target, RegridMethod.CONSERVATIVE, true, 5);
        }

        assertThat(parallel.getRows()).containsExactly(serial.getRows());
        assertThat(parallel.getCols()).containsExactly(serial.getCols());
        assertThat(parallel.getWeights()).containsExactly(serial.getWeights(), within(1e-12));
        assertThat(parallel.getTargetShape()).containsExactly(serial.getTargetShape());
        assertThat(parallel.isPeriodic()).isTrue();
    }

    @Test
    @DisplayName("Un fallo en una partición de pesos se propaga como ChunkFailure")
    void generateParallel_shouldWrapPartitionFailure() {
        when(mockedWeightEngine.generatePartition(any(), any(), any(), anyBoolean(), any(), any())).thenAnswer(invocation -> {
            RowRange range = invocation.getArgument(4);
            if (range.start() > 0) {
                throw new IllegalStateException("partición " + range);
            }
            return singleRow(target.cellCount(), 0);
        });
        ChunkOrchestrator orchestrator = new ChunkOrchestrator(
                ExecutionContext.sameThread(), new SparseApplicationEngine(), mockedWeightEngine);

        ChunkFailure failure = assertThrows(ChunkFailure.class,
                () -> orchestrator.generateParallel(source, target, RegridMethod.BILINEAR, false, 3));

        assertThat(failure.getChunkIndex()).isEqualTo(1);
    }

    @Test
    @DisplayName("Las particiones son contiguas de tamaño ceil(n/k) y cubren todas las filas")
    void partition_shouldCoverAllRows() {
        assertThat(ChunkOrchestrator.partition(10, 3))
                .containsExactly(new RowRange(0, 4), new RowRange(4, 8), new RowRange(8, 10));
        assertThat(ChunkOrchestrator.partition(2, 5)).containsExactly(new RowRange(0, 1), new RowRange(1, 2));
        assertThat(ChunkOrchestrator.partition(0, 3)).containsExactly(new RowRange(0, 0));
    }

    @Test
    @DisplayName("El ensamblado ordena las particiones por su fila inicial")
    void assemblePartitions_shouldOrderByRange() {
        RegridOperator assembled = ChunkOrchestrator.assemblePartitions(
                List.of(new RowRange(2, 4), new RowRange(0, 2)),
                List.of(singleRow(4, 3), singleRow(4, 1)),
                4);

        assertThat(assembled.getRows()).containsExactly(1, 3);
        assertThat(assembled.getNTarget()).isEqualTo(4);
    }

    @Test
    @DisplayName("Huecos, solapes, cobertura incompleta o filas ajenas producen PartitionConsistencyError")
    void assemblePartitions_shouldDetectInconsistencies() {
        PartitionConsistencyError gap = assertThrows(PartitionConsistencyError.class, () ->
                ChunkOrchestrator.assemblePartitions(List.of(new RowRange(0, 2), new RowRange(3, 5)),
                        List.of(singleRow(5, 0), singleRow(5, 3)), 5));
        PartitionConsistencyError overlap = assertThrows(PartitionConsistencyError.class, () ->
                ChunkOrchestrator.assemblePartitions(List.of(new RowRange(0, 3), new RowRange(2, 5)),
                        List.of(singleRow(5, 0), singleRow(5, 3)), 5));

        assertThat(gap.getMessage()).contains("hueco");
        assertThat(overlap.getMessage()).contains("solape");
        assertThrows(PartitionConsistencyError.class, () ->
                ChunkOrchestrator.assemblePartitions(List.of(new RowRange(0, 2), new RowRange(2, 4)),
                        List.of(singleRow(5, 0), singleRow(5, 2)), 5));
        assertThrows(PartitionConsistencyError.class, () ->
                ChunkOrchestrator.assemblePartitions(List.of(new RowRange(0, 2), new RowRange(2, 4)),
                        List.of(singleRow(4, 3), singleRow(4, 2)), 4));
        assertThrows(PartitionConsistencyError.class, () ->
                ChunkOrchestrator.assemblePartitions(List.of(new RowRange(0, 4)), List.of(), 4));
    }
}
