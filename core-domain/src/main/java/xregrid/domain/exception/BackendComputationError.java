package xregrid.domain.exception;

/**
 * Envuelve cualquier fallo del backend de pesos (geometría degenerada, configuración inválida...)
 * junto con el contexto de mallas y método que lo provocó.
 */
public class BackendComputationError extends RegridException {

    public BackendComputationError(String message, Throwable cause) {
        super(message, cause);
    }
}
