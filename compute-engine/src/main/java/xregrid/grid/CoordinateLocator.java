package xregrid.grid;

import xregrid.domain.dataset.DataVariable;
import xregrid.domain.dataset.GridDataset;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Descubre las coordenadas de latitud y longitud de un dataset sin depender de nombres fijos.
 * <p>
 * Orden de búsqueda: {@code standard_name}, {@code units}, {@code axis} y por último una lista
 * de nombres habituales. Las variables de límites (las referenciadas por un atributo
 * {@code bounds}) nunca se devuelven como coordenada.
 */
public final class CoordinateLocator {

    public enum Role {
        LATITUDE("latitude", "Y",
                Set.of("degrees_north", "degree_north", "degree_n", "degrees_n", "degreen", "degreesn"),
                List.of("lat", "latitude", "nav_lat", "yc", "lat_rho", "xlat", "glat", "lats", "y")),
        LONGITUDE("longitude", "X",
                Set.of("degrees_east", "degree_east", "degree_e", "degrees_e", "degreee", "degreese"),
                List.of("lon", "longitude", "nav_lon", "xc", "lon_rho", "xlong", "glon", "lons", "x"));

        private final String standardName;
        private final String axis;
        private final Set<String> units;
        private final List<String> names;

        Role(String standardName, String axis, Set<String> units, List<String> names) {
            this.standardName = standardName;
            this.axis = axis;
            this.units = units;
            this.names = names;
        }
    }

    private static final double RAD_TO_DEG = 180.0 / Math.PI;

    private CoordinateLocator() {
    }

    public static Optional<DataVariable> find(GridDataset ds, Role role) {
        Set<String> boundsNames = boundsVariableNames(ds);
        List<DataVariable> candidates = ds.variables().stream()
                .filter(v -> !boundsNames.contains(v.getName()))
                .filter(v -> v.rank() >= 1)
                .toList();

        List<Predicate<DataVariable>> rules = List.of(
                v -> v.stringAttribute("standard_name").map(role.standardName::equalsIgnoreCase).orElse(false),
                v -> v.stringAttribute("units").map(u -> role.units.contains(u.toLowerCase(Locale.ROOT))).orElse(false),
                v -> v.stringAttribute("axis").map(role.axis::equalsIgnoreCase).orElse(false)
        );
        for (Predicate<DataVariable> rule : rules) {
            // Se prefieren las variables marcadas como coordenada
            Optional<DataVariable> hit = candidates.stream().filter(DataVariable::isCoordinate).filter(rule).findFirst()
                    .or(() -> candidates.stream().filter(rule).findFirst());
            if (hit.isPresent()) {
                return hit;
            }
        }
        for (String name : role.names) {
            Optional<DataVariable> hit = candidates.stream()
                    .filter(v -> v.getName().equalsIgnoreCase(name))
                    .findFirst();
            if (hit.isPresent()) {
                return hit;
            }
        }
        return Optional.empty();
    }

    private static Set<String> boundsVariableNames(GridDataset ds) {
        Set<String> names = new HashSet<>();
        for (DataVariable v : ds.variables()) {
            v.stringAttribute("bounds").ifPresent(names::add);
        }
        return names;
    }

    /**
     * @return true si el atributo {@code units} indica radianes.
     */
    public static boolean isRadians(DataVariable variable) {
        return variable.stringAttribute("units")
                .map(u -> u.trim().toLowerCase(Locale.ROOT))
                .map(u -> u.equals("rad") || u.startsWith("radian"))
                .orElse(false);
    }

    /**
     * Valores de la variable en grados (convierte desde radianes si sus unidades lo indican).
     * Sin atributo de unidades se asume grados.
     */
    public static double[] valuesInDegrees(DataVariable variable) {
        return toDegrees(variable.getData(), isRadians(variable));
    }

    public static double[] toDegrees(double[] values, boolean radians) {
        if (!radians) {
            return values;
        }
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = values[i] * RAD_TO_DEG;
        }
        return out;
    }
}
