package xregrid.domain.dataset;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Colección de variables con dimensiones compartidas y atributos globales.
 * <p>
 * Sustituye al dataset autodescriptivo de los ficheros NetCDF: el normalizador inspecciona
 * sus nombres y atributos para deducir la malla. Inmutable; los métodos {@code with*}
 * devuelven una copia.
 */
public final class GridDataset implements GridSource, HasBounds {

    private final Map<String, DataVariable> variables;
    private final Map<String, Object> attributes;

    public GridDataset(Collection<DataVariable> variables, Map<String, Object> attributes) {
        Objects.requireNonNull(variables, "La lista de variables no puede ser nula.");
        Map<String, DataVariable> byName = new LinkedHashMap<>();
        Map<String, Integer> dimSizes = new LinkedHashMap<>();
        for (DataVariable variable : variables) {
            if (byName.put(variable.getName(), variable) != null) {
                throw new IllegalArgumentException("Variable duplicada en el dataset: " + variable.getName());
            }
            int[] shape = variable.getShape();
            for (int d = 0; d < shape.length; d++) {
                String dim = variable.getDims().get(d);
                Integer previous = dimSizes.putIfAbsent(dim, shape[d]);
                if (previous != null && previous != shape[d]) {
                    throw new IllegalArgumentException(String.format(
                            "La dimensión '%s' tiene tamaños inconsistentes (%d vs %d) en '%s'.",
                            dim, previous, shape[d], variable.getName()));
                }
            }
        }
        this.variables = Collections.unmodifiableMap(byName);
        this.attributes = attributes == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static GridDataset of(DataVariable... variables) {
        return new GridDataset(List.of(variables), Map.of());
    }

    public Optional<DataVariable> variable(String name) {
        return Optional.ofNullable(variables.get(name));
    }

    public Collection<DataVariable> variables() {
        return variables.values();
    }

    public List<DataVariable> coordinates() {
        return variables.values().stream().filter(DataVariable::isCoordinate).toList();
    }

    public List<DataVariable> dataVariables() {
        return variables.values().stream().filter(v -> !v.isCoordinate()).toList();
    }

    public Map<String, Object> getAttributes() {
        return attributes;
    }

    public Optional<String> stringAttribute(String key) {
        Object value = attributes.get(key);
        return value == null ? Optional.empty() : Optional.of(value.toString());
    }

    /**
     * Tamaño de una dimensión, buscando en cualquier variable que la use.
     */
    public Optional<Integer> dimSize(String dim) {
        return variables.values().stream()
                .filter(v -> v.hasDim(dim))
                .findFirst()
                .map(v -> v.dimSize(dim));
    }

    public GridDataset withVariable(DataVariable variable) {
        Map<String, DataVariable> copy = new LinkedHashMap<>(variables);
        copy.put(variable.getName(), variable);
        return new GridDataset(copy.values(), attributes);
    }

    public GridDataset withAttributes(Map<String, Object> newAttributes) {
        return new GridDataset(variables.values(), newAttributes);
    }

    @Override
    public List<String> coordinateNames() {
        List<String> coords = coordinates().stream().map(DataVariable::getName).toList();
        return coords.isEmpty() ? List.copyOf(variables.keySet()) : coords;
    }

    /**
     * Resuelve los límites CF: el atributo {@code bounds} de la coordenada nombra la variable.
     */
    @Override
    public Optional<DataVariable> findBounds(DataVariable coordinate) {
        return coordinate.stringAttribute("bounds").flatMap(this::variable);
    }

    @Override
    public String toString() {
        return "GridDataset" + variables.keySet();
    }
}
