package xregrid.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.With;
import xregrid.domain.operator.ExtrapMethod;
import xregrid.domain.operator.Extrapolation;
import xregrid.domain.operator.RegridMethod;

/**
 * Un objeto de valor inmutable con todos los parámetros de una llamada de regridding.
 * <p>
 * Agrupa la elección del método, la política de NaN, la reutilización de pesos y los
 * parámetros de ejecución paralela. Se construye con el builder o se carga desde JSON.
 *
 * @param method            Método de interpolación.
 * @param periodic          Longitud periódica (360°). {@code null} = detección automática.
 * @param skipNa            Renormalizar los pesos ignorando celdas fuente NaN.
 * @param reuseWeights      Reutilizar un operador persistido si la huella coincide.
 * @param weightsFile       Fichero de pesos fijo. Si es nulo se usa {@code cacheDirectory}.
 * @param cacheDirectory    Directorio de la caché de operadores (un fichero por huella).
 * @param workerCount       Número de hilos del contexto de ejecución local. 0 o 1 = secuencial.
 * @param chunkSize         Rebanadas no espaciales por chunk en la aplicación paralela.
 * @param partitionCount    Particiones de celdas destino en la generación paralela de pesos.
 * @param parallelWeights   Activa la generación de pesos por particiones.
 * @param patchNeighbours   Vecinos usados en el ajuste por mínimos cuadrados del método patch.
 * @param extrapMethod      Relleno de celdas destino sin pesos. {@code null} = sin extrapolación.
 * @param extrapDistExponent Exponente de distancia de {@code nearest_idw}. 0 = valor por defecto (2).
 */
@Builder
@With
public record RegridConfig(
        RegridMethod method,
        Boolean periodic,
        boolean skipNa,
        boolean reuseWeights,
        String weightsFile,
        String cacheDirectory,
        int workerCount,
        int chunkSize,
        int partitionCount,
        boolean parallelWeights,
        int patchNeighbours,
        ExtrapMethod extrapMethod,
        double extrapDistExponent
) {

    public RegridConfig {
        if (method == null) {
            method = RegridMethod.BILINEAR;
        }
        if (workerCount < 0 || chunkSize < 0 || partitionCount < 0 || patchNeighbours < 0) {
            throw new IllegalArgumentException("Los parámetros de ejecución no pueden ser negativos.");
        }
        if (extrapMethod == null) {
            extrapMethod = ExtrapMethod.NONE;
        }
        if (extrapDistExponent == 0.0) {
            extrapDistExponent = Extrapolation.DEFAULT_DIST_EXPONENT;
        }
        if (!(extrapDistExponent > 0) || Double.isInfinite(extrapDistExponent)) {
            throw new IllegalArgumentException(String.format(
                    "El exponente de distancia de la extrapolación debe ser positivo: %s", extrapDistExponent));
        }
    }

    @JsonIgnore
    public boolean isParallel() {
        return workerCount > 1;
    }

    public int effectiveChunkSize() {
        return chunkSize > 0 ? chunkSize : 16;
    }

    public int effectivePartitionCount() {
        return partitionCount > 0 ? partitionCount : Math.max(workerCount, 1);
    }

    @JsonIgnore
    public Extrapolation extrapolation() {
        return new Extrapolation(extrapMethod, extrapDistExponent);
    }

    public int effectivePatchNeighbours() {
        return patchNeighbours >= 3 ? patchNeighbours : 8;
    }

    /**
     * Configuración por defecto: bilinear, periodicidad automática, sin paralelismo.
     */
    public static RegridConfig getDefault() {
        return RegridConfig.builder()
                .method(RegridMethod.BILINEAR)
                .periodic(null)
                .skipNa(false)
                .reuseWeights(false)
                .weightsFile(null)
                .cacheDirectory(null)
                .workerCount(1)
                .chunkSize(16)
                .partitionCount(1)
                .parallelWeights(false)
                .patchNeighbours(8)
                .extrapMethod(ExtrapMethod.NONE)
                .extrapDistExponent(Extrapolation.DEFAULT_DIST_EXPONENT)
                .build();
    }
}
