package xregrid.domain.dataset;

import lombok.Builder;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Variable N-dimensional etiquetada (equivalente a un array con dimensiones con nombre).
 * <p>
 * Los datos se guardan planos en orden fila-mayor (la última dimensión varía más rápido).
 * La instancia es inmutable: el constructor clona los datos y los atributos, y los getters
 * devuelven copias o vistas no modificables.
 */
public final class DataVariable {

    @Getter
    private final String name;
    private final List<String> dims;
    private final int[] shape;
    private final double[] data;
    private final Map<String, Object> attributes;
    @Getter
    private final boolean coordinate;

    @Builder(toBuilder = true)
    public DataVariable(String name,
                        List<String> dims,
                        int[] shape,
                        double[] data,
                        Map<String, Object> attributes,
                        boolean coordinate) {
        Objects.requireNonNull(name, "El nombre de la variable no puede ser nulo.");
        Objects.requireNonNull(dims, "Las dimensiones no pueden ser nulas.");
        Objects.requireNonNull(shape, "La forma no puede ser nula.");
        if (dims.size() != shape.length) {
            throw new IllegalArgumentException(String.format(
                    "La variable '%s' declara %d dimensiones pero su forma tiene rango %d.",
                    name, dims.size(), shape.length));
        }
        if (dims.stream().distinct().count() != dims.size()) {
            throw new IllegalArgumentException("Dimensiones repetidas en la variable '" + name + "': " + dims);
        }
        long size = 1;
        for (int s : shape) {
            if (s < 0) {
                throw new IllegalArgumentException("Tamaño de dimensión negativo en '" + name + "'.");
            }
            size *= s;
        }
        double[] values = data == null ? new double[(int) size] : data;
        if (values.length != size) {
            throw new IllegalArgumentException(String.format(
                    "La variable '%s' con forma %s necesita %d valores pero recibió %d.",
                    name, Arrays.toString(shape), size, values.length));
        }
        this.name = name;
        this.dims = List.copyOf(dims);
        this.shape = shape.clone();
        this.data = values.clone();
        this.attributes = attributes == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        this.coordinate = coordinate;
    }

    // --- CONSULTAS ---

    public List<String> getDims() {
        return dims;
    }

    public int[] getShape() {
        return shape.clone();
    }

    public double[] getData() {
        return data.clone();
    }

    public Map<String, Object> getAttributes() {
        return attributes;
    }

    public int rank() {
        return shape.length;
    }

    public int size() {
        return data.length;
    }

    public int dimIndex(String dim) {
        return dims.indexOf(dim);
    }

    public boolean hasDim(String dim) {
        return dims.contains(dim);
    }

    public int dimSize(String dim) {
        int idx = dims.indexOf(dim);
        if (idx < 0) {
            throw new IllegalArgumentException("La variable '" + name + "' no tiene la dimensión '" + dim + "'.");
        }
        return shape[idx];
    }

    /**
     * Acceso directo al valor plano {@code index} sin copiar el array.
     */
    public double valueAt(int index) {
        return data[index];
    }

    /**
     * Atributo como texto, si existe.
     */
    public Optional<String> stringAttribute(String key) {
        Object value = attributes.get(key);
        return value == null ? Optional.empty() : Optional.of(value.toString());
    }

    /**
     * Atributo numérico, si existe y es interpretable como número.
     */
    public Optional<Double> numericAttribute(String key) {
        Object value = attributes.get(key);
        if (value instanceof Number number) {
            return Optional.of(number.doubleValue());
        }
        if (value != null) {
            try {
                return Optional.of(Double.parseDouble(value.toString().trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    // --- DERIVADAS ---

    public DataVariable withAttributes(Map<String, Object> newAttributes) {
        return toBuilder().attributes(newAttributes).build();
    }

    public DataVariable withAttribute(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(attributes);
        copy.put(key, value);
        return withAttributes(copy);
    }

    public DataVariable withoutAttributes(List<String> keys) {
        Map<String, Object> copy = new LinkedHashMap<>(attributes);
        keys.forEach(copy::remove);
        return withAttributes(copy);
    }

    public DataVariable withName(String newName) {
        return toBuilder().name(newName).build();
    }

    /**
     * Crea una variable 1-D marcada como coordenada.
     */
    public static DataVariable coordinate(String name, String dim, double[] values, Map<String, Object> attributes) {
        return DataVariable.builder()
                .name(name)
                .dims(List.of(dim))
                .shape(new int[]{values.length})
                .data(values)
                .attributes(attributes)
                .coordinate(true)
                .build();
    }

    /**
     * Crea una variable 2-D marcada como coordenada.
     */
    public static DataVariable coordinate2d(String name, List<String> dims, int[] shape,
                                            double[] values, Map<String, Object> attributes) {
        return DataVariable.builder()
                .name(name)
                .dims(new ArrayList<>(dims))
                .shape(shape)
                .data(values)
                .attributes(attributes)
                .coordinate(true)
                .build();
    }

    @Override
    public String toString() {
        return String.format("DataVariable[%s%s %s]", name, dims, Arrays.toString(shape));
    }
}
