package xregrid.apply;

import java.util.List;

/**
 * Datos de una variable reordenados con los ejes espaciales al final y aplanados a
 * {@code [batch][nSource]} en orden fila-mayor.
 *
 * @param block          Valores aplanados.
 * @param batch          Número de rebanadas no espaciales (1 si no hay ninguna).
 * @param nSource        Celdas espaciales por rebanada.
 * @param batchDims      Dimensiones no espaciales en su orden original.
 * @param batchShape     Tamaños de esas dimensiones.
 * @param insertPosition Posición que ocupaba el primer eje espacial entre las dimensiones no espaciales.
 */
public record PreparedBlock(double[] block,
                            int batch,
                            int nSource,
                            List<String> batchDims,
                            int[] batchShape,
                            int insertPosition) {

    public PreparedBlock {
        batchDims = List.copyOf(batchDims);
    }
}
