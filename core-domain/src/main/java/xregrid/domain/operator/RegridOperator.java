package xregrid.domain.operator;

import lombok.Builder;
import lombok.Getter;
import org.ejml.data.DMatrixRMaj;
import org.ejml.data.DMatrixSparseCSC;
import org.ejml.data.DMatrixSparseTriplet;
import org.ejml.ops.DConvertMatrixStruct;
import org.ejml.sparse.csc.CommonOps_DSCC;

import java.util.Arrays;
import java.util.Comparator;
import java.util.Objects;
import java.util.stream.IntStream;

/**
 * Matriz dispersa de interpolación {@code (nTarget × nSource)} que transforma el vector plano
 * de valores de la malla origen en el vector plano de la malla destino.
 * <p>
 * Es inmutable: los tripletes se copian al construir, los getters devuelven copias y la
 * matriz CSC interna nunca sale de esta clase. Por ello se puede compartir en lectura entre
 * todos los workers del orquestador sin sincronización.
 * <p>
 * Los pares {@code (fila, columna)} repetidos se fusionan sumando sus pesos y los tripletes
 * quedan ordenados por fila y columna.
 */
public final class RegridOperator {

    private final int[] rows;
    private final int[] cols;
    private final double[] weights;

    @Getter
    private final int nTarget;
    @Getter
    private final int nSource;
    private final int[] sourceShape;
    private final int[] targetShape;
    @Getter
    private final RegridMethod method;
    @Getter
    private final boolean periodic;
    @Getter
    private final String fingerprint;
    @Getter
    private final Extrapolation extrapolation;

    // Vista CSC para el producto disperso × denso. Solo lectura tras la construcción.
    private final DMatrixSparseCSC matrix;

    @Builder(toBuilder = true)
    public RegridOperator(int[] rows,
                          int[] cols,
                          double[] weights,
                          int nTarget,
                          int nSource,
                          int[] sourceShape,
                          int[] targetShape,
                          RegridMethod method,
                          boolean periodic,
                          String fingerprint,
                          Extrapolation extrapolation) {
        Objects.requireNonNull(rows, "Los índices de fila no pueden ser nulos.");
        Objects.requireNonNull(cols, "Los índices de columna no pueden ser nulos.");
        Objects.requireNonNull(weights, "Los pesos no pueden ser nulos.");
        Objects.requireNonNull(method, "El método no puede ser nulo.");
        if (rows.length != cols.length || rows.length != weights.length) {
            throw new IllegalArgumentException(String.format(
                    "Tripletes desalineados: rows=%d, cols=%d, weights=%d",
                    rows.length, cols.length, weights.length));
        }
        if (nTarget <= 0 || nSource <= 0) {
            throw new IllegalArgumentException(String.format(
                    "Dimensiones del operador inválidas: (%d x %d)", nTarget, nSource));
        }
        for (int k = 0; k < rows.length; k++) {
            if (rows[k] < 0 || rows[k] >= nTarget) {
                throw new IllegalArgumentException(String.format(
                        "Fila %d fuera de rango [0, %d) en el triplete %d", rows[k], nTarget, k));
            }
            if (cols[k] < 0 || cols[k] >= nSource) {
                throw new IllegalArgumentException(String.format(
                        "Columna %d fuera de rango [0, %d) en el triplete %d", cols[k], nSource, k));
            }
        }

        this.nTarget = nTarget;
        this.nSource = nSource;
        this.sourceShape = checkShape(sourceShape, nSource, "origen");
        this.targetShape = checkShape(targetShape, nTarget, "destino");
        this.method = method;
        this.periodic = periodic;
        this.fingerprint = fingerprint;
        this.extrapolation = extrapolation == null ? Extrapolation.DISABLED : extrapolation;

        // Ordenar por (fila, columna) y fusionar duplicados
        long[] keys = new long[rows.length];
        for (int k = 0; k < rows.length; k++) {
            keys[k] = (long) rows[k] * nSource + cols[k];
        }
        int[] order = IntStream.range(0, rows.length).boxed()
                .sorted(Comparator.comparingLong(k -> keys[k]))
                .mapToInt(Integer::intValue)
                .toArray();

        int[] mergedRows = new int[rows.length];
        int[] mergedCols = new int[rows.length];
        double[] mergedWeights = new double[rows.length];
        int count = 0;
        long lastKey = -1;
        for (int k : order) {
            if (count > 0 && keys[k] == lastKey) {
                mergedWeights[count - 1] += weights[k];
            } else {
                mergedRows[count] = rows[k];
                mergedCols[count] = cols[k];
                mergedWeights[count] = weights[k];
                lastKey = keys[k];
                count++;
            }
        }
        this.rows = Arrays.copyOf(mergedRows, count);
        this.cols = Arrays.copyOf(mergedCols, count);
        this.weights = Arrays.copyOf(mergedWeights, count);

        DMatrixSparseTriplet triplet = new DMatrixSparseTriplet(nTarget, nSource, Math.max(count, 1));
        for (int k = 0; k < count; k++) {
            triplet.addItem(this.rows[k], this.cols[k], this.weights[k]);
        }
        this.matrix = DConvertMatrixStruct.convert(triplet, (DMatrixSparseCSC) null);
    }

    private static int[] checkShape(int[] shape, int expectedSize, String side) {
        if (shape == null) {
            return new int[]{expectedSize};
        }
        long size = 1;
        for (int s : shape) {
            size *= s;
        }
        if (size != expectedSize) {
            throw new IllegalArgumentException(String.format(
                    "La forma espacial %s %s no cuadra con %d celdas.",
                    side, Arrays.toString(shape), expectedSize));
        }
        return shape.clone();
    }

    // --- CONSULTAS ---

    public int[] getRows() {
        return rows.clone();
    }

    public int[] getCols() {
        return cols.clone();
    }

    public double[] getWeights() {
        return weights.clone();
    }

    public int[] getSourceShape() {
        return sourceShape.clone();
    }

    public int[] getTargetShape() {
        return targetShape.clone();
    }

    public int nnz() {
        return rows.length;
    }

    /**
     * Suma de pesos por fila destino. Las filas sin entradas suman 0.
     */
    public double[] rowSums() {
        double[] sums = new double[nTarget];
        for (int k = 0; k < rows.length; k++) {
            sums[rows[k]] += weights[k];
        }
        return sums;
    }

    /**
     * @return para cada fila destino, si tiene al menos una entrada almacenada.
     */
    public boolean[] mappedRows() {
        boolean[] mapped = new boolean[nTarget];
        for (int row : rows) {
            mapped[row] = true;
        }
        return mapped;
    }

    /**
     * Rango mínimo de filas que contiene todas las entradas, o vacío si no hay ninguna.
     */
    public RowRange occupiedRowRange() {
        if (rows.length == 0) {
            return new RowRange(0, 0);
        }
        return new RowRange(rows[0], rows[rows.length - 1] + 1);
    }

    /**
     * Producto {@code result = W · source}.
     *
     * @param source Matriz densa {@code (nSource × batch)}.
     * @param result Matriz de salida {@code (nTarget × batch)}; se redimensiona si hace falta.
     */
    public void multiply(DMatrixRMaj source, DMatrixRMaj result) {
        if (source.numRows != nSource) {
            throw new IllegalArgumentException(String.format(
                    "El bloque fuente tiene %d filas pero el operador espera %d.", source.numRows, nSource));
        }
        result.reshape(nTarget, source.numCols);
        CommonOps_DSCC.mult(matrix, source, result);
    }

    /**
     * Devuelve una copia con otra huella (ej: al recargar desde caché bajo otra clave).
     */
    public RegridOperator withFingerprint(String newFingerprint) {
        return toBuilder().fingerprint(newFingerprint).build();
    }

    @Override
    public String toString() {
        return String.format("RegridOperator[method=%s, shape=(%d x %d), nnz=%d, periodic=%s, %s]",
                method, nTarget, nSource, rows.length, periodic, extrapolation.describe());
    }
}
