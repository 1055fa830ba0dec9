package xregrid.metadata;

import lombok.extern.slf4j.Slf4j;
import xregrid.domain.dataset.DataVariable;
import xregrid.domain.dataset.GridDataset;
import xregrid.domain.grid.CanonicalGrid;
import xregrid.domain.grid.GridDescriptor;
import xregrid.domain.grid.MeshTopology;
import xregrid.domain.operator.Extrapolation;
import xregrid.domain.operator.RegridMethod;
import xregrid.factory.GridDatasetFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Adjunta al resultado la descripción espacial de la malla destino: coordenadas (valores y
 * atributos), nombres de dimensión y, si la malla destino es UGRID, el enlace con su topología.
 * <p>
 * Solo toca atributos que describen la discretización espacial; el resto de atributos de la
 * variable se conservan tal cual.
 */
@Slf4j
public class MetadataPropagator {

    /**
     * Atributos que enlazan una variable con la malla origen y dejan de ser válidos tras el regridding.
     */
    public static final List<String> SPATIAL_LINK_ATTRIBUTES = List.of("mesh", "location", "coordinates", "grid_mapping");

    public GridDataset propagate(DataVariable regridded, CanonicalGrid target) {
        return new GridDataset(withTargetCoordinates(List.of(link(regridded, target)), target), Map.of());
    }

    /**
     * Añade las coordenadas (y la topología UGRID) de la malla destino a una lista de variables.
     */
    public List<DataVariable> withTargetCoordinates(List<DataVariable> variables, CanonicalGrid target) {
        List<DataVariable> out = new ArrayList<>(variables);
        out.addAll(targetCoordinates(target));
        GridDescriptor descriptor = target.getDescriptor();
        if (descriptor.isUgrid()) {
            MeshTopology topology = descriptor.topology();
            boolean present = out.stream().anyMatch(v -> v.getName().equals(topology.variableName()));
            if (!present) {
                out.add(DataVariable.builder()
                        .name(topology.variableName())
                        .dims(List.of())
                        .shape(new int[0])
                        .attributes(topology.attributes())
                        .build());
            }
        }
        return out;
    }

    /**
     * Sustituye los atributos de enlace espacial de la variable por los de la malla destino.
     */
    public DataVariable link(DataVariable variable, CanonicalGrid target) {
        DataVariable stripped = variable.withoutAttributes(SPATIAL_LINK_ATTRIBUTES);
        GridDescriptor descriptor = target.getDescriptor();
        if (descriptor.isUgrid()) {
            MeshTopology topology = descriptor.topology();
            stripped = stripped.withAttribute("mesh", topology.variableName())
                    .withAttribute("location", topology.location());
        }
        return stripped;
    }

    List<DataVariable> targetCoordinates(CanonicalGrid target) {
        GridDescriptor descriptor = target.getDescriptor();
        List<String> dims = descriptor.spatialDims();
        Map<String, Object> latAttrs = coordinateAttributes(descriptor.latAttributes(), "latitude", "degrees_north");
        Map<String, Object> lonAttrs = coordinateAttributes(descriptor.lonAttributes(), "longitude", "degrees_east");
        return switch (target.getKind()) {
            case RECTILINEAR -> List.of(
                    DataVariable.coordinate(descriptor.latName(), dims.get(0), target.getCenterLat(), latAttrs),
                    DataVariable.coordinate(descriptor.lonName(), dims.get(1), target.getCenterLon(), lonAttrs));
            case CURVILINEAR -> List.of(
                    DataVariable.coordinate2d(descriptor.latName(), dims, target.spatialShape(), target.getCenterLat(), latAttrs),
                    DataVariable.coordinate2d(descriptor.lonName(), dims, target.spatialShape(), target.getCenterLon(), lonAttrs));
            case UNSTRUCTURED -> List.of(
                    DataVariable.coordinate(descriptor.latName(), dims.get(0), target.getCenterLat(), latAttrs),
                    DataVariable.coordinate(descriptor.lonName(), dims.get(0), target.getCenterLon(), lonAttrs));
        };
    }

    /**
     * Atributos de la coordenada destino sin referencias a límites (no se propagan) y con
     * {@code standard_name}/{@code units} garantizados.
     */
    private static Map<String, Object> coordinateAttributes(Map<String, Object> original, String standardName, String units) {
        Map<String, Object> attrs = new LinkedHashMap<>(original);
        attrs.remove("bounds");
        attrs.putIfAbsent("standard_name", standardName);
        attrs.putIfAbsent("units", units);
        return attrs;
    }

    /**
     * Añade la línea de procedencia del regridding al atributo {@code history}.
     */
    public Map<String, Object> appendHistory(Map<String, Object> attributes, String message) {
        Map<String, Object> attrs = new LinkedHashMap<>(attributes);
        Object previous = attrs.get("history");
        attrs.put("history", GridDatasetFactory.historyLine(message, previous == null ? null : previous.toString()));
        return attrs;
    }

    public static String provenance(RegridMethod method) {
        return provenance(method, Extrapolation.DISABLED);
    }

    public static String provenance(RegridMethod method, Extrapolation extrapolation) {
        return "Regridded using xregrid " + settings(method, extrapolation);
    }

    /**
     * Parámetros del operador entre paréntesis. La extrapolación solo aparece si está activa.
     */
    public static String settings(RegridMethod method, Extrapolation extrapolation) {
        String settings = "method=" + method.getExternalName();
        if (extrapolation != null && extrapolation.isEnabled()) {
            settings += ", " + extrapolation.describe();
        }
        return "(" + settings + ")";
    }
}
