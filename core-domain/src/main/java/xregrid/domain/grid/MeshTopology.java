package xregrid.domain.grid;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Descripción de la topología UGRID de una malla, tal y como debe reaparecer en la salida.
 *
 * @param variableName Nombre de la variable de topología (la que lleva {@code cf_role = mesh_topology}).
 * @param attributes   Atributos de esa variable.
 * @param location     Localización de los datos sobre la malla ({@code face}, {@code node}...).
 */
public record MeshTopology(String variableName, Map<String, Object> attributes, String location) {

    public MeshTopology {
        attributes = attributes == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        location = location == null ? "face" : location;
    }
}
