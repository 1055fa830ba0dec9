package xregrid.domain.dataset;

import java.util.List;

/**
 * Cualquier descripción de malla que el normalizador pueda inspeccionar.
 * <p>
 * Las capacidades concretas ({@link HasConnectivity}, {@link HasBounds}, {@link Has1DCoords})
 * se expresan implementando interfaces adicionales.
 */
public interface GridSource {

    /**
     * Nombres de coordenadas visibles, usados en los mensajes de error de detección.
     */
    List<String> coordinateNames();
}
