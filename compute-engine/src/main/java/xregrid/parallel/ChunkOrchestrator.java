package xregrid.parallel;

import lombok.extern.slf4j.Slf4j;
import xregrid.apply.PreparedBlock;
import xregrid.apply.SparseApplicationEngine;
import xregrid.apply.SpatialLayout;
import xregrid.domain.dataset.DataVariable;
import xregrid.domain.exception.ChunkFailure;
import xregrid.domain.exception.PartitionConsistencyError;
import xregrid.domain.exception.RegridException;
import xregrid.domain.grid.CanonicalGrid;
import xregrid.domain.operator.Extrapolation;
import xregrid.domain.operator.RegridJob;
import xregrid.domain.operator.RegridMethod;
import xregrid.domain.operator.RegridOperator;
import xregrid.domain.operator.RowRange;
import xregrid.weights.WeightGenerationEngine;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * Reparte el trabajo de regridding entre los workers de un {@link ExecutionContext}.
 * <p>
 * Dos regímenes:
 * 1. Aplicación paralela: el mismo operador se aplica a chunks de rebanadas no espaciales.
 * 2. Generación paralela de pesos: las celdas destino se dividen en rangos contiguos de filas
 *    y cada partición se calcula contra la malla origen completa.
 * <p>
 * Los resultados se reensamblan por índice de chunk, nunca por orden de finalización.
 * Si una tarea falla se espera al resto, se descartan todos los resultados y se lanza
 * {@link ChunkFailure} con el índice más bajo que falló.
 */
@Slf4j
public class ChunkOrchestrator {

    private final ExecutionContext context;
    private final SparseApplicationEngine applicationEngine;
    private final WeightGenerationEngine weightEngine;

    public ChunkOrchestrator(ExecutionContext context,
                             SparseApplicationEngine applicationEngine,
                             WeightGenerationEngine weightEngine) {
        this.context = Objects.requireNonNull(context, "El contexto de ejecución no puede ser nulo.");
        this.applicationEngine = Objects.requireNonNull(applicationEngine, "El motor de aplicación no puede ser nulo.");
        this.weightEngine = weightEngine;
    }

    // --- APLICACIÓN PARALELA ---

    public DataVariable applyParallel(RegridOperator operator, DataVariable data, SpatialLayout layout,
                                      boolean skipNa, int chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("El tamaño de chunk debe ser positivo: " + chunkSize);
        }
        PreparedBlock prepared = applicationEngine.prepare(operator, data, layout);
        int batch = prepared.batch();
        int nSource = prepared.nSource();
        int nTarget = operator.getNTarget();

        List<RegridJob> jobs = new ArrayList<>();
        for (int offset = 0, index = 0; offset < batch; offset += chunkSize, index++) {
            int length = Math.min(chunkSize, batch - offset);
            double[] slice = Arrays.copyOfRange(prepared.block(), offset * nSource, (offset + length) * nSource);
            jobs.add(new RegridJob(index, offset, length, slice, prepared.batchDims(), skipNa));
        }
        log.info("Aplicación paralela de '{}': {} rebanadas en {} chunks ({} workers).",
                data.getName(), batch, jobs.size(), context.parallelism());

        List<Future<double[]>> futures = new ArrayList<>(jobs.size());
        for (RegridJob job : jobs) {
            futures.add(context.submit(() -> applicationEngine.applyJob(operator, job)));
        }
        List<double[]> blocks = gather(futures);

        double[] result = new double[batch * nTarget];
        for (int i = 0; i < jobs.size(); i++) {
            RegridJob job = jobs.get(i);
            System.arraycopy(blocks.get(i), 0, result, job.batchOffset() * nTarget, job.batchLength() * nTarget);
        }
        return applicationEngine.assemble(operator, data, prepared, result, layout);
    }

    // --- GENERACIÓN PARALELA DE PESOS ---

    public RegridOperator generateParallel(CanonicalGrid source, CanonicalGrid target, RegridMethod method,
                                           boolean periodic, int partitionCount) {
        return generateParallel(source, target, method, periodic, partitionCount, Extrapolation.DISABLED);
    }

    /**
     * Genera los pesos por particiones de filas destino. Cada partición extrapola solo sus filas.
     */
    public RegridOperator generateParallel(CanonicalGrid source, CanonicalGrid target, RegridMethod method,
                                           boolean periodic, int partitionCount, Extrapolation extrapolation) {
        if (weightEngine == null) {
            throw new IllegalStateException("El orquestador no tiene motor de generación de pesos.");
        }
        List<RowRange> ranges = partition(target.cellCount(), partitionCount);
        log.info("Generación paralela de pesos {}: {} celdas destino en {} particiones.",
                method, target.cellCount(), ranges.size());
        List<Future<RegridOperator>> futures = new ArrayList<>(ranges.size());
        for (RowRange range : ranges) {
            futures.add(context.submit(() -> weightEngine.generatePartition(source, target, method, periodic, range, extrapolation)));
        }
        List<RegridOperator> partials = gather(futures);
        return assemblePartitions(ranges, partials, target.cellCount());
    }

    /**
     * Rangos contiguos de tamaño {@code ceil(n/k)} que cubren {@code [0, n)}.
     */
    public static List<RowRange> partition(int rowCount, int partitionCount) {
        int k = Math.max(1, Math.min(partitionCount, Math.max(rowCount, 1)));
        int size = (rowCount + k - 1) / k;
        List<RowRange> ranges = new ArrayList<>(k);
        for (int start = 0; start < rowCount; start += size) {
            ranges.add(new RowRange(start, Math.min(start + size, rowCount)));
        }
        if (ranges.isEmpty()) {
            ranges.add(new RowRange(0, 0));
        }
        return ranges;
    }

    /**
     * Concatena operadores parciales por rango de filas.
     *
     * @throws PartitionConsistencyError si los rangos dejan huecos, se solapan, no cubren todas
     *                                   las filas, o un parcial tiene filas fuera de su rango.
     */
    public static RegridOperator assemblePartitions(List<RowRange> ranges, List<RegridOperator> partials, int nTarget) {
        if (ranges.size() != partials.size() || partials.isEmpty()) {
            throw new PartitionConsistencyError(String.format(
                    "Hay %d rangos y %d operadores parciales.", ranges.size(), partials.size()));
        }
        List<Integer> order = new ArrayList<>();
        for (int i = 0; i < ranges.size(); i++) {
            order.add(i);
        }
        order.sort((a, b) -> Integer.compare(ranges.get(a).start(), ranges.get(b).start()));

        int expected = 0;
        int total = 0;
        for (int i : order) {
            RowRange range = ranges.get(i);
            if (range.start() != expected) {
                throw new PartitionConsistencyError(String.format(
                        "La partición %d empieza en la fila %d pero se esperaba %d (%s).",
                        i, range.start(), expected, range.start() > expected ? "hueco" : "solape"));
            }
            expected = range.end();
            total += partials.get(i).nnz();
        }
        if (expected != nTarget) {
            throw new PartitionConsistencyError(String.format(
                    "Las particiones cubren %d filas de %d.", expected, nTarget));
        }

        RegridOperator first = partials.get(0);
        int[] rows = new int[total];
        int[] cols = new int[total];
        double[] weights = new double[total];
        int offset = 0;
        for (int i : order) {
            RegridOperator partial = partials.get(i);
            RowRange range = ranges.get(i);
            if (partial.getNTarget() != nTarget || partial.getNSource() != first.getNSource()) {
                throw new PartitionConsistencyError(String.format(
                        "El operador de la partición %d tiene forma (%d x %d), se esperaba (%d x %d).",
                        i, partial.getNTarget(), partial.getNSource(), nTarget, first.getNSource()));
            }
            int[] pRows = partial.getRows();
            for (int row : pRows) {
                if (!range.contains(row)) {
                    throw new PartitionConsistencyError(String.format(
                            "La partición %d %s contiene la fila %d fuera de su rango.", i, range, row));
                }
            }
            int n = pRows.length;
            System.arraycopy(pRows, 0, rows, offset, n);
            System.arraycopy(partial.getCols(), 0, cols, offset, n);
            System.arraycopy(partial.getWeights(), 0, weights, offset, n);
            offset += n;
        }
        return first.toBuilder()
                .rows(rows)
                .cols(cols)
                .weights(weights)
                .build();
    }

    // --- RECOGIDA ---

    /**
     * Espera a todas las tareas. Si alguna falla, lanza {@link ChunkFailure} con el índice más bajo.
     */
    private static <T> List<T> gather(List<Future<T>> futures) {
        List<T> results = new ArrayList<>(futures.size());
        int failedIndex = -1;
        Throwable failure = null;
        for (int i = 0; i < futures.size(); i++) {
            try {
                results.add(futures.get(i).get());
            } catch (ExecutionException e) {
                log.debug("Chunk {} fallido: {}", i, e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
                results.add(null);
                if (failure == null) {
                    failedIndex = i;
                    failure = e.getCause() == null ? e : e.getCause();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.forEach(f -> f.cancel(true));
                throw new RegridException("Orquestación interrumpida esperando el chunk " + i + ".", e);
            }
        }
        if (failure != null) {
            log.error("Fallo en el chunk {}; se descartan los resultados de {} chunks.", failedIndex, futures.size());
            throw new ChunkFailure(failedIndex, failure);
        }
        return results;
    }
}
