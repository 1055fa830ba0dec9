package xregrid.weights;

import lombok.extern.slf4j.Slf4j;
import xregrid.domain.exception.BackendComputationError;
import xregrid.domain.exception.MissingConnectivityError;
import xregrid.domain.exception.RegridException;
import xregrid.domain.exception.UnsupportedMethodError;
import xregrid.domain.grid.CanonicalGrid;
import xregrid.domain.operator.Extrapolation;
import xregrid.domain.operator.RegridMethod;
import xregrid.domain.operator.RegridOperator;
import xregrid.domain.operator.RowRange;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.IntStream;

/**
 * Produce el {@link RegridOperator} de un par de mallas canónicas delegando la geometría en
 * un {@link WeightBackend}.
 * <p>
 * Responsabilidades:
 * 1. Validar que el método es aplicable a los tipos de malla.
 * 2. Preparar los elementos poligonales del método conservativo (triangulando las celdas que
 *    el backend no admite y omitiendo las celdas enmascaradas).
 * 3. Reagregar los pesos de los triángulos sobre su celda de origen.
 * 4. Rellenar, si se pide extrapolación, las celdas destino que quedaron sin pesos.
 * 5. Envolver cualquier fallo del backend en {@link BackendComputationError}.
 * <p>
 * No guarda estado mutable: puede usarse desde varios hilos a la vez.
 */
@Slf4j
public class WeightGenerationEngine {

    private final WeightBackend backend;

    public WeightGenerationEngine(WeightBackend backend) {
        this.backend = Objects.requireNonNull(backend, "El backend de pesos no puede ser nulo.");
    }

    public RegridOperator generate(CanonicalGrid source, CanonicalGrid target, RegridMethod method, boolean periodic) {
        return generate(source, target, method, periodic, Extrapolation.DISABLED);
    }

    public RegridOperator generate(CanonicalGrid source, CanonicalGrid target, RegridMethod method, boolean periodic,
                                   Extrapolation extrapolation) {
        return generatePartition(source, target, method, periodic, RowRange.all(target.cellCount()), extrapolation);
    }

    public RegridOperator generatePartition(CanonicalGrid source, CanonicalGrid target, RegridMethod method,
                                            boolean periodic, RowRange rows) {
        return generatePartition(source, target, method, periodic, rows, Extrapolation.DISABLED);
    }

    /**
     * Genera solo las filas de {@code rows}. El operador resultante tiene la forma completa
     * {@code (nTarget × nSource)} pero sus entradas se limitan a ese rango.
     */
    public RegridOperator generatePartition(CanonicalGrid source, CanonicalGrid target, RegridMethod method,
                                            boolean periodic, RowRange rows, Extrapolation extrapolation) {
        Objects.requireNonNull(method, "El método no puede ser nulo.");
        Extrapolation extrap = extrapolation == null ? Extrapolation.DISABLED : extrapolation;
        if (rows.end() > target.cellCount()) {
            throw new IllegalArgumentException(String.format(
                    "El rango %s excede las %d celdas destino.", rows, target.cellCount()));
        }
        validateMethod(source, target, method);
        long startTime = System.currentTimeMillis();

        List<CellPolygon> sourceElements = List.of();
        List<CellPolygon> targetElements = List.of();
        if (method == RegridMethod.CONSERVATIVE) {
            sourceElements = elements(source, RowRange.all(source.cellCount()));
            targetElements = elements(target, rows);
        }
        GeometryPair pair = new GeometryPair(source, target, sourceElements, targetElements, periodic, rows);

        WeightTriplets raw;
        try {
            raw = backend.compute(pair, method);
        } catch (RegridException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new BackendComputationError(String.format(
                    "El backend falló calculando pesos %s de %s a %s (filas %s): %s",
                    method, source.getKind(), target.getKind(), rows, e.getMessage()), e);
        }
        if (raw == null) {
            throw new BackendComputationError(String.format(
                    "El backend no devolvió pesos para %s de %s a %s.", method, source.getKind(), target.getKind()), null);
        }

        RegridOperator operator = method == RegridMethod.CONSERVATIVE
                ? aggregate(raw, sourceElements, targetElements, source, target, method, periodic)
                : filterMasked(raw, source, target, method, periodic);
        if (extrap.isEnabled()) {
            operator = extrapolate(operator, source, target, rows, extrap);
        }

        log.info("Pesos {} generados: {} -> {}, filas {}, nnz={} ({} ms)", method, source.getKind(), target.getKind(),
                rows, operator.nnz(), System.currentTimeMillis() - startTime);
        return operator;
    }

    // --- VALIDACIÓN ---

    static void validateMethod(CanonicalGrid source, CanonicalGrid target, RegridMethod method) {
        if (!method.requiresCorners()) {
            return;
        }
        boolean srcCorners = source.hasCorners();
        boolean dstCorners = target.hasCorners();
        if (!srcCorners && !dstCorners) {
            throw new UnsupportedMethodError(String.format(
                    "El método %s necesita contornos de celda y ni el origen (%s) ni el destino (%s) los tienen.",
                    method, source.getKind(), target.getKind()));
        }
        if (!srcCorners || !dstCorners) {
            throw new MissingConnectivityError(String.format(
                    "El método %s necesita contornos de celda en la malla %s (%s).",
                    method, srcCorners ? "destino" : "origen", srcCorners ? target.getKind() : source.getKind()));
        }
    }

    // --- ELEMENTOS CONSERVATIVOS ---

    static List<CellPolygon> elements(CanonicalGrid grid, RowRange range) {
        List<CellPolygon> elements = new ArrayList<>(range.size());
        for (int cell = range.start(); cell < range.end(); cell++) {
            if (grid.isMasked(cell)) {
                continue;
            }
            double[][] polygon = grid.cellPolygon(cell);
            elements.addAll(Triangulator.split(cell, polygon[0], polygon[1]));
        }
        return elements;
    }

    // --- AGREGACIÓN ---

    private RegridOperator aggregate(WeightTriplets raw, List<CellPolygon> sourceElements,
                                     List<CellPolygon> targetElements, CanonicalGrid source, CanonicalGrid target,
                                     RegridMethod method, boolean periodic) {
        int nSource = source.cellCount();
        Map<Long, Double> merged = new HashMap<>();
        int[] rows = raw.rows();
        int[] cols = raw.cols();
        double[] weights = raw.weights();
        for (int k = 0; k < rows.length; k++) {
            if (rows[k] < 0 || rows[k] >= targetElements.size() || cols[k] < 0 || cols[k] >= sourceElements.size()) {
                throw new BackendComputationError(String.format(
                        "El backend devolvió el elemento (%d, %d) fuera de rango (%d x %d) para %s de %s a %s.",
                        rows[k], cols[k], targetElements.size(), sourceElements.size(),
                        method, source.getKind(), target.getKind()), null);
            }
            CellPolygon targetElement = targetElements.get(rows[k]);
            CellPolygon sourceElement = sourceElements.get(cols[k]);
            long key = (long) targetElement.parent() * nSource + sourceElement.parent();
            merged.merge(key, weights[k] * targetElement.parentFraction(), Double::sum);
        }

        int[] outRows = new int[merged.size()];
        int[] outCols = new int[merged.size()];
        double[] outWeights = new double[merged.size()];
        int count = 0;
        for (Map.Entry<Long, Double> entry : merged.entrySet()) {
            outRows[count] = (int) (entry.getKey() / nSource);
            outCols[count] = (int) (entry.getKey() % nSource);
            outWeights[count] = entry.getValue();
            count++;
        }
        return filterMasked(new WeightTriplets(outRows, outCols, outWeights), source, target, method, periodic);
    }

    // --- EXTRAPOLACIÓN ---

    private RegridOperator extrapolate(RegridOperator operator, CanonicalGrid source, CanonicalGrid target,
                                       RowRange rows, Extrapolation extrapolation) {
        boolean[] mapped = operator.mappedRows();
        int[] unmapped = IntStream.range(rows.start(), rows.end())
                .filter(t -> !mapped[t] && !target.isMasked(t))
                .toArray();
        if (unmapped.length == 0) {
            return operator.toBuilder().extrapolation(extrapolation).build();
        }
        WeightTriplets fill;
        try {
            fill = backend.extrapolate(source, target, unmapped, extrapolation);
        } catch (RegridException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new BackendComputationError(String.format(
                    "El backend falló extrapolando %d celdas destino (%s): %s",
                    unmapped.length, extrapolation.describe(), e.getMessage()), e);
        }
        if (fill == null) {
            throw new BackendComputationError(String.format(
                    "El backend no devolvió pesos de extrapolación (%s).", extrapolation.describe()), null);
        }
        boolean[] allowed = new boolean[target.cellCount()];
        for (int t : unmapped) {
            allowed[t] = true;
        }
        int base = operator.nnz();
        int[] fillRows = fill.rows();
        int[] fillCols = fill.cols();
        double[] fillWeights = fill.weights();
        int[] outRows = Arrays.copyOf(operator.getRows(), base + fill.size());
        int[] outCols = Arrays.copyOf(operator.getCols(), base + fill.size());
        double[] outWeights = Arrays.copyOf(operator.getWeights(), base + fill.size());
        for (int k = 0; k < fill.size(); k++) {
            if (fillRows[k] < 0 || fillRows[k] >= allowed.length || !allowed[fillRows[k]]) {
                throw new BackendComputationError(String.format(
                        "La extrapolación devolvió la fila %d, que no estaba pendiente de relleno.", fillRows[k]), null);
            }
            outRows[base + k] = fillRows[k];
            outCols[base + k] = fillCols[k];
            outWeights[base + k] = fillWeights[k];
        }
        log.info("Extrapolación {}: {} celdas destino sin pesos rellenadas.", extrapolation.describe(), unmapped.length);
        try {
            return operator.toBuilder()
                    .rows(outRows)
                    .cols(outCols)
                    .weights(outWeights)
                    .extrapolation(extrapolation)
                    .build();
        } catch (IllegalArgumentException e) {
            throw new BackendComputationError(String.format(
                    "Tripletes de extrapolación inválidos (%s): %s", extrapolation.describe(), e.getMessage()), e);
        }
    }

    private RegridOperator filterMasked(WeightTriplets triplets, CanonicalGrid source, CanonicalGrid target,
                                        RegridMethod method, boolean periodic) {
        WeightTriplets.Accumulator kept = WeightTriplets.accumulator();
        int[] rows = triplets.rows();
        int[] cols = triplets.cols();
        double[] weights = triplets.weights();
        for (int k = 0; k < rows.length; k++) {
            if (target.isMasked(rows[k]) || source.isMasked(cols[k])) {
                continue;
            }
            kept.add(rows[k], cols[k], weights[k]);
        }
        WeightTriplets result = kept.build();
        try {
            return RegridOperator.builder()
                    .rows(result.rows())
                    .cols(result.cols())
                    .weights(result.weights())
                    .nTarget(target.cellCount())
                    .nSource(source.cellCount())
                    .targetShape(target.spatialShape())
                    .sourceShape(source.spatialShape())
                    .method(method)
                    .periodic(periodic)
                    .build();
        } catch (IllegalArgumentException e) {
            throw new BackendComputationError(String.format(
                    "Tripletes inválidos del backend para %s de %s a %s: %s",
                    method, source.getKind(), target.getKind(), e.getMessage()), e);
        }
    }
}
