package xregrid.cache;

import xregrid.domain.operator.RegridOperator;

import java.util.Optional;

/**
 * Almacén de operadores indexado por clave (normalmente la huella de las mallas).
 * <p>
 * Una clave ausente es un fallo de caché, nunca un error. Última escritura gana.
 */
public interface OperatorCache {

    /**
     * @throws xregrid.domain.exception.IncompatibleCacheError si el documento existe pero
     *                                                           no es legible con este esquema.
     */
    Optional<RegridOperator> load(String key);

    void store(String key, RegridOperator operator);
}
