package xregrid.domain.exception;

/**
 * El operador persistido no se puede usar: versión de esquema desconocida, documento ilegible o
 * extrapolación distinta de la pedida.
 * Nunca se aplican pesos obsoletos en silencio.
 */
public class IncompatibleCacheError extends RegridException {

    public IncompatibleCacheError(String message) {
        super(message);
    }

    public IncompatibleCacheError(String message, Throwable cause) {
        super(message, cause);
    }
}
