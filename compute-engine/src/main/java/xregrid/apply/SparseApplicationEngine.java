package xregrid.apply;

import lombok.extern.slf4j.Slf4j;
import org.ejml.data.DMatrixRMaj;
import xregrid.domain.dataset.DataVariable;
import xregrid.domain.operator.RegridJob;
import xregrid.domain.operator.RegridOperator;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Aplica un {@link RegridOperator} a una variable N-dimensional con un único producto
 * disperso × denso.
 * <p>
 * Flujo:
 * 1. Localizar los ejes espaciales por nombre (en cualquier posición) y moverlos al final.
 * 2. Aplanar a {@code (batch, nSource)} y multiplicar {@code W · X} con X de {@code nSource × batch}.
 * 3. Restaurar la forma con las dimensiones destino donde estaba el primer eje espacial.
 * <p>
 * Política de NaN:
 * - Sin skipNa: un NaN fuente se propaga a toda fila destino que lo use.
 * - Con skipNa: los NaN cuentan como 0 en el numerador y el denominador es el mismo operador
 *   aplicado a la matriz de validez; resultado = numerador / denominador, NaN si el
 *   denominador es 0.
 * En ambos casos las filas sin pesos (fuera del dominio o enmascaradas) valen NaN.
 * <p>
 * Sin estado: el operador nunca se modifica y la clase es segura entre hilos.
 */
@Slf4j
public class SparseApplicationEngine {

    private static final double DENOMINATOR_EPSILON = 1e-12;

    // --- API PRINCIPAL ---

    /**
     * Aplica el operador suponiendo que las últimas dimensiones de {@code data} son las espaciales
     * y coinciden con la forma fuente del operador.
     */
    public DataVariable apply(RegridOperator operator, DataVariable data, boolean skipNa) {
        int spatialRank = operator.getSourceShape().length;
        if (data.rank() < spatialRank) {
            throw new IllegalArgumentException(String.format(
                    "La variable '%s' tiene rango %d pero el operador espera %d ejes espaciales.",
                    data.getName(), data.rank(), spatialRank));
        }
        List<String> dims = data.getDims();
        List<String> sourceDims = dims.subList(dims.size() - spatialRank, dims.size());
        List<String> targetDims;
        int targetRank = operator.getTargetShape().length;
        if (targetRank == spatialRank) {
            targetDims = sourceDims;
        } else if (targetRank == 1) {
            targetDims = List.of("cell");
        } else {
            targetDims = List.of("y", "x");
        }
        return apply(operator, data, new SpatialLayout(sourceDims, targetDims), skipNa);
    }

    public DataVariable apply(RegridOperator operator, DataVariable data, SpatialLayout layout, boolean skipNa) {
        PreparedBlock prepared = prepare(operator, data, layout);
        double[] result = applyBlock(operator, prepared.block(), prepared.batch(), skipNa);
        return assemble(operator, data, prepared, result, layout);
    }

    /**
     * Aplica el operador al bloque de un {@link RegridJob}.
     *
     * @return Bloque destino {@code [batchLength][nTarget]}.
     */
    public double[] applyJob(RegridOperator operator, RegridJob job) {
        return applyBlock(operator, job.sourceBlock(), job.batchLength(), job.skipNa());
    }

    // --- FASES ---

    /**
     * Reordena y aplana la variable. Falla si faltan dimensiones espaciales o si el tamaño
     * espacial no coincide con las columnas del operador.
     */
    public PreparedBlock prepare(RegridOperator operator, DataVariable data, SpatialLayout layout) {
        Objects.requireNonNull(operator, "El operador no puede ser nulo.");
        List<String> dims = data.getDims();
        int[] shape = data.getShape();

        int[] spatialAxes = new int[layout.sourceDims().size()];
        int nSource = 1;
        for (int k = 0; k < spatialAxes.length; k++) {
            String dim = layout.sourceDims().get(k);
            int axis = dims.indexOf(dim);
            if (axis < 0) {
                throw new IllegalArgumentException(String.format(
                        "La variable '%s' %s no tiene la dimensión espacial '%s'.", data.getName(), dims, dim));
            }
            spatialAxes[k] = axis;
            nSource *= shape[axis];
        }
        if (nSource != operator.getNSource()) {
            throw new IllegalArgumentException(String.format(
                    "El tamaño espacial fuente %d de '%s' no coincide con las %d columnas del operador.",
                    nSource, data.getName(), operator.getNSource()));
        }

        int firstSpatial = Arrays.stream(spatialAxes).min().orElse(0);
        List<Integer> permutation = new ArrayList<>(dims.size());
        List<String> batchDims = new ArrayList<>();
        List<Integer> batchSizes = new ArrayList<>();
        int insertPosition = 0;
        for (int axis = 0; axis < dims.size(); axis++) {
            if (contains(spatialAxes, axis)) {
                continue;
            }
            if (axis < firstSpatial) {
                insertPosition++;
            }
            permutation.add(axis);
            batchDims.add(dims.get(axis));
            batchSizes.add(shape[axis]);
        }
        for (int axis : spatialAxes) {
            permutation.add(axis);
        }
        int[] perm = permutation.stream().mapToInt(Integer::intValue).toArray();
        int batch = batchSizes.stream().reduce(1, (a, b) -> a * b);
        double[] block = permute(data.getData(), shape, perm);
        return new PreparedBlock(block, batch, nSource, batchDims,
                batchSizes.stream().mapToInt(Integer::intValue).toArray(), insertPosition);
    }

    /**
     * Producto {@code W · X} sobre un bloque {@code [batch][nSource]}.
     *
     * @return Bloque {@code [batch][nTarget]}.
     */
    public double[] applyBlock(RegridOperator operator, double[] block, int batch, boolean skipNa) {
        int nSource = operator.getNSource();
        int nTarget = operator.getNTarget();
        if (block.length != batch * nSource) {
            throw new IllegalArgumentException(String.format(
                    "El bloque tiene %d valores pero se esperaban %d x %d.", block.length, batch, nSource));
        }
        int columns = skipNa ? 2 * batch : batch;
        DMatrixRMaj x = new DMatrixRMaj(nSource, Math.max(columns, 1));
        for (int b = 0; b < batch; b++) {
            for (int s = 0; s < nSource; s++) {
                double value = block[b * nSource + s];
                if (skipNa) {
                    boolean valid = !Double.isNaN(value);
                    x.unsafe_set(s, b, valid ? value : 0.0);
                    x.unsafe_set(s, batch + b, valid ? 1.0 : 0.0);
                } else {
                    x.unsafe_set(s, b, value);
                }
            }
        }
        DMatrixRMaj product = new DMatrixRMaj(nTarget, Math.max(columns, 1));
        operator.multiply(x, product);

        boolean[] mapped = operator.mappedRows();
        double[] out = new double[batch * nTarget];
        for (int b = 0; b < batch; b++) {
            for (int t = 0; t < nTarget; t++) {
                double value;
                if (!mapped[t]) {
                    value = Double.NaN;
                } else if (skipNa) {
                    double denominator = product.unsafe_get(t, batch + b);
                    value = Math.abs(denominator) <= DENOMINATOR_EPSILON
                            ? Double.NaN
                            : product.unsafe_get(t, b) / denominator;
                } else {
                    value = product.unsafe_get(t, b);
                }
                out[b * nTarget + t] = value;
            }
        }
        return out;
    }

    /**
     * Reconstruye la variable destino a partir del bloque {@code [batch][nTarget]}.
     */
    public DataVariable assemble(RegridOperator operator, DataVariable source, PreparedBlock prepared,
                                 double[] result, SpatialLayout layout) {
        int[] targetShape = operator.getTargetShape();
        if (layout.targetDims().size() != targetShape.length) {
            throw new IllegalArgumentException(String.format(
                    "Dimensiones destino %s incompatibles con la forma destino %s.",
                    layout.targetDims(), Arrays.toString(targetShape)));
        }
        int nBatchDims = prepared.batchDims().size();
        int rank = nBatchDims + targetShape.length;
        int[] permutedShape = new int[rank];
        System.arraycopy(prepared.batchShape(), 0, permutedShape, 0, nBatchDims);
        System.arraycopy(targetShape, 0, permutedShape, nBatchDims, targetShape.length);

        // Orden final: batch[:p] + destino + batch[p:]
        int p = prepared.insertPosition();
        int[] perm = new int[rank];
        List<String> outDims = new ArrayList<>(rank);
        int k = 0;
        for (int a = 0; a < p; a++) {
            perm[k++] = a;
            outDims.add(prepared.batchDims().get(a));
        }
        for (int a = 0; a < targetShape.length; a++) {
            perm[k++] = nBatchDims + a;
            outDims.add(layout.targetDims().get(a));
        }
        for (int a = p; a < nBatchDims; a++) {
            perm[k++] = a;
            outDims.add(prepared.batchDims().get(a));
        }
        int[] outShape = new int[rank];
        for (int a = 0; a < rank; a++) {
            outShape[a] = permutedShape[perm[a]];
        }
        double[] values = permute(result, permutedShape, perm);
        log.debug("Variable '{}' regriddeada: {} -> {}", source.getName(), source.getDims(), outDims);
        return DataVariable.builder()
                .name(source.getName())
                .dims(outDims)
                .shape(outShape)
                .data(values)
                .attributes(source.getAttributes())
                .coordinate(false)
                .build();
    }

    // --- UTILIDADES ---

    /**
     * Transpone un array fila-mayor: el eje {@code i} de la salida es el eje {@code perm[i]} de la entrada.
     */
    static double[] permute(double[] data, int[] shape, int[] perm) {
        int rank = shape.length;
        boolean identity = true;
        for (int i = 0; i < rank; i++) {
            identity &= perm[i] == i;
        }
        if (identity) {
            return data.clone();
        }
        int[] strides = new int[rank];
        int stride = 1;
        for (int a = rank - 1; a >= 0; a--) {
            strides[a] = stride;
            stride *= shape[a];
        }
        int[] outShape = new int[rank];
        int[] outStrides = new int[rank];
        for (int i = 0; i < rank; i++) {
            outShape[i] = shape[perm[i]];
            outStrides[i] = strides[perm[i]];
        }
        double[] out = new double[data.length];
        int[] index = new int[rank];
        int offset = 0;
        for (int n = 0; n < out.length; n++) {
            out[n] = data[offset];
            // Incremento del multi-índice de salida (último eje más rápido)
            for (int i = rank - 1; i >= 0; i--) {
                index[i]++;
                offset += outStrides[i];
                if (index[i] < outShape[i]) {
                    break;
                }
                offset -= outStrides[i] * outShape[i];
                index[i] = 0;
            }
        }
        return out;
    }

    private static boolean contains(int[] values, int value) {
        for (int v : values) {
            if (v == value) {
                return true;
            }
        }
        return false;
    }
}
