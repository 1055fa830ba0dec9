package xregrid.domain.operator;

/**
 * Rango semiabierto {@code [start, end)} de filas (celdas destino).
 * Unidad de reparto en la generación paralela de pesos.
 */
public record RowRange(int start, int end) {

    public RowRange {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException(String.format("Rango de filas inválido: [%d, %d)", start, end));
        }
    }

    public static RowRange all(int rowCount) {
        return new RowRange(0, rowCount);
    }

    public int size() {
        return end - start;
    }

    public boolean contains(int row) {
        return row >= start && row < end;
    }

    public boolean isEmpty() {
        return start == end;
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
