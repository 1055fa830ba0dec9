package xregrid.domain.exception;

/**
 * Los rangos de filas de las particiones no cubren las celdas destino exactamente una vez
 * (hueco, solapamiento o filas fuera del rango declarado).
 */
public class PartitionConsistencyError extends RegridException {

    public PartitionConsistencyError(String message) {
        super(message);
    }
}
