package xregrid.domain.grid;

import lombok.Builder;
import lombok.With;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Metadatos de la discretización espacial que acompañan a una {@link CanonicalGrid}:
 * nombres de dimensiones y coordenadas, sus atributos y, si aplica, la topología UGRID.
 * <p>
 * No interviene en el cálculo de pesos; lo consume el propagador de metadatos.
 *
 * @param spatialDims    Dimensiones espaciales en el orden de aplanado (fila-mayor).
 * @param latName        Nombre de la coordenada de latitud.
 * @param lonName        Nombre de la coordenada de longitud.
 * @param latAttributes  Atributos originales de la latitud.
 * @param lonAttributes  Atributos originales de la longitud.
 * @param topology       Topología UGRID, o {@code null} si la malla no es UGRID.
 */
@Builder
@With
public record GridDescriptor(List<String> spatialDims,
                             String latName,
                             String lonName,
                             Map<String, Object> latAttributes,
                             Map<String, Object> lonAttributes,
                             MeshTopology topology) {

    public GridDescriptor {
        spatialDims = spatialDims == null ? List.of() : List.copyOf(spatialDims);
        latName = latName == null ? "lat" : latName;
        lonName = lonName == null ? "lon" : lonName;
        latAttributes = latAttributes == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(latAttributes));
        lonAttributes = lonAttributes == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(lonAttributes));
    }

    /**
     * Descriptor por defecto para mallas construidas sin dataset de origen.
     */
    public static GridDescriptor defaults(GridKind kind) {
        List<String> dims = switch (kind) {
            case RECTILINEAR -> List.of("lat", "lon");
            case CURVILINEAR -> List.of("y", "x");
            case UNSTRUCTURED -> List.of("n_face");
        };
        return GridDescriptor.builder()
                .spatialDims(dims)
                .latName("lat")
                .lonName("lon")
                .latAttributes(Map.of("standard_name", "latitude", "units", "degrees_north"))
                .lonAttributes(Map.of("standard_name", "longitude", "units", "degrees_east"))
                .build();
    }

    public boolean isUgrid() {
        return topology != null;
    }
}
