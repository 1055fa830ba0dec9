package xregrid.domain.exception;

/**
 * El método solicitado necesita conectividad o límites de celda que la malla no aporta.
 */
public class MissingConnectivityError extends RegridException {

    public MissingConnectivityError(String message) {
        super(message);
    }
}
