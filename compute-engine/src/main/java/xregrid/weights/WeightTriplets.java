package xregrid.weights;

import java.util.Arrays;

/**
 * Tripletes {@code (fila, columna, peso)} devueltos por el backend, en arrays paralelos.
 */
public record WeightTriplets(int[] rows, int[] cols, double[] weights) {

    public WeightTriplets {
        if (rows.length != cols.length || rows.length != weights.length) {
            throw new IllegalArgumentException(String.format(
                    "Tripletes desalineados: rows=%d, cols=%d, weights=%d", rows.length, cols.length, weights.length));
        }
    }

    public static WeightTriplets empty() {
        return new WeightTriplets(new int[0], new int[0], new double[0]);
    }

    public int size() {
        return rows.length;
    }

    public static Accumulator accumulator() {
        return new Accumulator();
    }

    /**
     * Acumulador creciente de tripletes. No es seguro entre hilos: uno por tarea.
     */
    public static final class Accumulator {
        private int[] rows = new int[64];
        private int[] cols = new int[64];
        private double[] weights = new double[64];
        private int size;

        public Accumulator add(int row, int col, double weight) {
            if (size == rows.length) {
                int capacity = rows.length * 2;
                rows = Arrays.copyOf(rows, capacity);
                cols = Arrays.copyOf(cols, capacity);
                weights = Arrays.copyOf(weights, capacity);
            }
            rows[size] = row;
            cols[size] = col;
            weights[size] = weight;
            size++;
            return this;
        }

        public int size() {
            return size;
        }

        public WeightTriplets build() {
            return new WeightTriplets(Arrays.copyOf(rows, size), Arrays.copyOf(cols, size), Arrays.copyOf(weights, size));
        }
    }
}
