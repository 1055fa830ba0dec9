package xregrid.domain.exception;

/**
 * Raíz de la taxonomía de errores del motor de regridding.
 * <p>
 * Todas las excepciones del motor son no comprobadas: un operador incorrecto o parcial
 * es peor que ningún resultado, así que cualquier fallo aborta la llamada completa.
 */
public class RegridException extends RuntimeException {

    public RegridException(String message) {
        super(message);
    }

    public RegridException(String message, Throwable cause) {
        super(message, cause);
    }
}
