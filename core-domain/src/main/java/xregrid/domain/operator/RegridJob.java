package xregrid.domain.operator;

import java.util.List;

/**
 * Unidad de trabajo de la aplicación paralela: un bloque de rebanadas no espaciales
 * ya aplanado a {@code [batchLength][nSource]} en orden fila-mayor.
 *
 * @param chunkIndex      Posición del chunk en el orden global (para reensamblar).
 * @param batchOffset     Primera rebanada del lote global que contiene este bloque.
 * @param batchLength     Número de rebanadas del bloque.
 * @param sourceBlock     Datos fuente del bloque. Solo lectura.
 * @param preservedDims   Etiquetas de las dimensiones no espaciales que se conservan.
 * @param skipNa          Renormalizar los pesos ignorando NaN.
 */
public record RegridJob(int chunkIndex,
                        int batchOffset,
                        int batchLength,
                        double[] sourceBlock,
                        List<String> preservedDims,
                        boolean skipNa) {

    public RegridJob {
        if (chunkIndex < 0 || batchOffset < 0 || batchLength < 0) {
            throw new IllegalArgumentException("Índices de RegridJob negativos.");
        }
        preservedDims = List.copyOf(preservedDims);
    }
}
