package xregrid.apply;

import xregrid.domain.grid.CanonicalGrid;

import java.util.List;

/**
 * Nombres de las dimensiones espaciales a ambos lados del regridding.
 *
 * @param sourceDims Dimensiones espaciales de los datos de entrada, en el orden de aplanado de la malla origen.
 * @param targetDims Dimensiones espaciales de la salida, en el orden de la malla destino.
 */
public record SpatialLayout(List<String> sourceDims, List<String> targetDims) {

    public SpatialLayout {
        if (sourceDims == null || sourceDims.isEmpty() || targetDims == null || targetDims.isEmpty()) {
            throw new IllegalArgumentException("Las dimensiones espaciales no pueden estar vacías.");
        }
        sourceDims = List.copyOf(sourceDims);
        targetDims = List.copyOf(targetDims);
    }

    public static SpatialLayout of(CanonicalGrid source, CanonicalGrid target) {
        return new SpatialLayout(source.getDescriptor().spatialDims(), target.getDescriptor().spatialDims());
    }
}
