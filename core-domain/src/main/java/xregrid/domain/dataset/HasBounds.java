package xregrid.domain.dataset;

import java.util.Optional;

/**
 * Capacidad: la fuente puede resolver la variable de límites de celda asociada a una coordenada.
 */
public interface HasBounds extends GridSource {

    Optional<DataVariable> findBounds(DataVariable coordinate);
}
