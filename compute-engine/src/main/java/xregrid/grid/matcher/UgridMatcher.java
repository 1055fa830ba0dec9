package xregrid.grid.matcher;

import lombok.extern.slf4j.Slf4j;
import xregrid.domain.dataset.DataVariable;
import xregrid.domain.dataset.GridDataset;
import xregrid.domain.dataset.GridSource;
import xregrid.domain.exception.MissingConnectivityError;
import xregrid.domain.grid.CanonicalGrid;
import xregrid.domain.grid.GridDescriptor;
import xregrid.domain.grid.GridKind;
import xregrid.domain.grid.MeshTopology;
import xregrid.domain.operator.RegridMethod;
import xregrid.grid.CoordinateLocator;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Malla UGRID: una variable con {@code cf_role = mesh_topology} describe nodos, caras y
 * conectividad.
 * <p>
 * La conectividad cara-nodo se resuelve por el atributo {@code face_node_connectivity} de la
 * topología o, si falta, por cualquier variable con {@code cf_role = face_node_connectivity}.
 * Se respetan {@code start_index} y los huecos de caras con menos vértices
 * ({@code _FillValue} o valores negativos).
 */
@Slf4j
public class UgridMatcher implements GridMatcher {

    static final String MESH_TOPOLOGY = "mesh_topology";
    static final String FACE_NODE_CONNECTIVITY = "face_node_connectivity";

    @Override
    public String name() {
        return "ugrid";
    }

    @Override
    public boolean matches(GridSource source) {
        return source instanceof GridDataset ds && findTopology(ds).isPresent();
    }

    @Override
    public CanonicalGrid extract(GridSource source, RegridMethod method) {
        GridDataset ds = (GridDataset) source;
        DataVariable topology = findTopology(ds).orElseThrow();

        List<DataVariable> nodeCoords = referencedVariables(ds, topology, "node_coordinates");
        DataVariable nodeLon = pick(nodeCoords, true);
        DataVariable nodeLat = pick(nodeCoords, false);

        Optional<DataVariable> connectivity = topology.stringAttribute(FACE_NODE_CONNECTIVITY)
                .flatMap(ds::variable)
                .or(() -> ds.variables().stream()
                        .filter(v -> v.stringAttribute("cf_role").map(FACE_NODE_CONNECTIVITY::equals).orElse(false))
                        .findFirst());

        if (connectivity.isEmpty()) {
            if (method.requiresCorners()) {
                throw new MissingConnectivityError(String.format(
                        "La malla UGRID '%s' no tiene conectividad cara-nodo y el método %s necesita "
                                + "los contornos de celda.", topology.getName(), method));
            }
            return centersOnly(ds, topology, nodeLon, nodeLat);
        }

        DataVariable conn = connectivity.get();
        int[][] faces = readConnectivity(conn, nodeLon.size());
        String faceDim = conn.getDims().get(0);

        double[] nodeLonDeg = CoordinateLocator.valuesInDegrees(nodeLon);
        double[] nodeLatDeg = CoordinateLocator.valuesInDegrees(nodeLat);
        double[] faceLon;
        double[] faceLat;
        List<DataVariable> faceCoords = referencedVariables(ds, topology, "face_coordinates");
        String lonName = faceDim + "_lon";
        String latName = faceDim + "_lat";
        if (faceCoords.size() >= 2) {
            DataVariable fLon = pick(faceCoords, true);
            DataVariable fLat = pick(faceCoords, false);
            faceLon = CoordinateLocator.valuesInDegrees(fLon);
            faceLat = CoordinateLocator.valuesInDegrees(fLat);
            lonName = fLon.getName();
            latName = fLat.getName();
        } else {
            double[][] centroids = centroids(faces, nodeLonDeg, nodeLatDeg);
            faceLon = centroids[0];
            faceLat = centroids[1];
        }
        log.debug("UGRID '{}': {} caras, {} nodos.", topology.getName(), faces.length, nodeLonDeg.length);

        return CanonicalGrid.builder()
                .kind(GridKind.UNSTRUCTURED)
                .centerLat(faceLat)
                .centerLon(faceLon)
                .cornerLat(nodeLatDeg)
                .cornerLon(nodeLonDeg)
                .connectivity(faces)
                .mask(maskFor(ds, faceDim))
                .descriptor(descriptor(faceDim, latName, lonName, nodeLat, nodeLon, topology))
                .build();
    }

    private CanonicalGrid centersOnly(GridDataset ds, DataVariable topology, DataVariable nodeLon, DataVariable nodeLat) {
        List<DataVariable> faceCoords = referencedVariables(ds, topology, "face_coordinates");
        DataVariable lon = faceCoords.size() >= 2 ? pick(faceCoords, true) : nodeLon;
        DataVariable lat = faceCoords.size() >= 2 ? pick(faceCoords, false) : nodeLat;
        String dim = lon.getDims().get(0);
        String location = faceCoords.size() >= 2 ? "face" : "node";
        log.info("UGRID '{}' sin conectividad: se usan solo los centros ({}).", topology.getName(), location);
        return CanonicalGrid.builder()
                .kind(GridKind.UNSTRUCTURED)
                .centerLat(CoordinateLocator.valuesInDegrees(lat))
                .centerLon(CoordinateLocator.valuesInDegrees(lon))
                .mask(maskFor(ds, dim))
                .descriptor(GridDescriptor.builder()
                        .spatialDims(List.of(dim))
                        .latName(lat.getName())
                        .lonName(lon.getName())
                        .latAttributes(lat.getAttributes())
                        .lonAttributes(lon.getAttributes())
                        .topology(new MeshTopology(topology.getName(), topology.getAttributes(), location))
                        .build())
                .build();
    }

    private static GridDescriptor descriptor(String faceDim, String latName, String lonName,
                                             DataVariable nodeLat, DataVariable nodeLon, DataVariable topology) {
        return GridDescriptor.builder()
                .spatialDims(List.of(faceDim))
                .latName(latName)
                .lonName(lonName)
                .latAttributes(nodeLat.getAttributes())
                .lonAttributes(nodeLon.getAttributes())
                .topology(new MeshTopology(topology.getName(), topology.getAttributes(), "face"))
                .build();
    }

    static Optional<DataVariable> findTopology(GridDataset ds) {
        return ds.variables().stream()
                .filter(v -> v.stringAttribute("cf_role").map(MESH_TOPOLOGY::equals).orElse(false))
                .findFirst();
    }

    private static List<DataVariable> referencedVariables(GridDataset ds, DataVariable topology, String attribute) {
        List<DataVariable> found = new ArrayList<>();
        topology.stringAttribute(attribute).ifPresent(value -> {
            for (String name : value.trim().split("\\s+")) {
                ds.variable(name).ifPresent(found::add);
            }
        });
        if (found.size() < 2 && "node_coordinates".equals(attribute)) {
            throw new IllegalArgumentException(String.format(
                    "La topología '%s' no referencia dos coordenadas de nodo válidas (%s).",
                    topology.getName(), topology.stringAttribute(attribute).orElse("<ausente>")));
        }
        return found;
    }

    /**
     * Elige longitud o latitud de entre un par de variables por standard_name, unidades o nombre.
     */
    private static DataVariable pick(List<DataVariable> pair, boolean longitude) {
        for (DataVariable v : pair) {
            String std = v.stringAttribute("standard_name").orElse("").toLowerCase(Locale.ROOT);
            String units = v.stringAttribute("units").orElse("").toLowerCase(Locale.ROOT);
            if (longitude ? std.equals("longitude") || units.endsWith("east") : std.equals("latitude") || units.endsWith("north")) {
                return v;
            }
        }
        for (DataVariable v : pair) {
            String name = v.getName().toLowerCase(Locale.ROOT);
            if (longitude ? name.contains("lon") || name.endsWith("x") : name.contains("lat") || name.endsWith("y")) {
                return v;
            }
        }
        // Convención UGRID: el primero es la coordenada x
        return longitude ? pair.get(0) : pair.get(1);
    }

    /**
     * Convierte la variable de conectividad {@code (nFace, maxNodes)} a índices base 0,
     * descartando los huecos de relleno.
     */
    static int[][] readConnectivity(DataVariable conn, int nodeCount) {
        if (conn.rank() != 2) {
            throw new IllegalArgumentException("La conectividad '" + conn.getName() + "' debe ser 2-D.");
        }
        int start = conn.numericAttribute("start_index").map(Double::intValue).orElse(0);
        Optional<Double> fill = conn.numericAttribute("_FillValue");
        int nFace = conn.getShape()[0];
        int maxNodes = conn.getShape()[1];
        double[] raw = conn.getData();
        int[][] faces = new int[nFace][];
        for (int f = 0; f < nFace; f++) {
            int[] nodes = new int[maxNodes];
            int count = 0;
            for (int k = 0; k < maxNodes; k++) {
                double value = raw[f * maxNodes + k];
                if (Double.isNaN(value) || (fill.isPresent() && value == fill.get()) || value - start < 0) {
                    continue;
                }
                int node = (int) value - start;
                if (node >= nodeCount) {
                    throw new IllegalArgumentException(String.format(
                            "La cara %d referencia el nodo %d pero solo hay %d nodos.", f, node, nodeCount));
                }
                nodes[count++] = node;
            }
            faces[f] = Arrays.copyOf(nodes, count);
        }
        return faces;
    }

    static double[][] centroids(int[][] faces, double[] nodeLon, double[] nodeLat) {
        double[] lon = new double[faces.length];
        double[] lat = new double[faces.length];
        for (int f = 0; f < faces.length; f++) {
            double ref = nodeLon[faces[f][0]];
            double sumLon = 0;
            double sumLat = 0;
            for (int node : faces[f]) {
                double x = nodeLon[node];
                while (x - ref > 180) x -= 360;
                while (x - ref < -180) x += 360;
                sumLon += x;
                sumLat += nodeLat[node];
            }
            lon[f] = sumLon / faces[f].length;
            lat[f] = sumLat / faces[f].length;
        }
        return new double[][]{lon, lat};
    }

    private static boolean[] maskFor(GridDataset ds, String dim) {
        return MaskResolver.resolve(ds, List.of(dim), List.of());
    }
}
