package xregrid.domain.exception;

import java.util.List;

/**
 * Ninguna convención de malla reconocida encaja con el dataset de entrada.
 * El mensaje incluye los nombres de coordenadas inspeccionados.
 */
public class UnsupportedGridError extends RegridException {

    private final List<String> inspectedCoordinates;

    public UnsupportedGridError(String message, List<String> inspectedCoordinates) {
        super(message + " Coordenadas inspeccionadas: " + inspectedCoordinates);
        this.inspectedCoordinates = List.copyOf(inspectedCoordinates);
    }

    public List<String> getInspectedCoordinates() {
        return inspectedCoordinates;
    }
}
