package xregrid.domain.exception;

/**
 * Método de interpolación desconocido o incompatible con los tipos de malla implicados
 * (ej: conservativo entre dos nubes de puntos sin conectividad).
 */
public class UnsupportedMethodError extends RegridException {

    public UnsupportedMethodError(String message) {
        super(message);
    }
}
