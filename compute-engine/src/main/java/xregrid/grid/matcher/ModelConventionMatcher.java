package xregrid.grid.matcher;

import lombok.extern.slf4j.Slf4j;
import xregrid.domain.dataset.DataVariable;
import xregrid.domain.dataset.GridDataset;
import xregrid.domain.dataset.GridSource;
import xregrid.domain.exception.MissingConnectivityError;
import xregrid.domain.grid.CanonicalGrid;
import xregrid.domain.grid.GridDescriptor;
import xregrid.domain.grid.GridKind;
import xregrid.domain.operator.RegridMethod;
import xregrid.grid.CoordinateLocator;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Mallas no estructuradas de modelos concretos identificadas por sus nombres de variables
 * (MPAS, ICON). Los ángulos se convierten a grados según el atributo {@code units}.
 */
@Slf4j
public class ModelConventionMatcher implements GridMatcher {

    /**
     * Convención de nombres de un modelo.
     *
     * @param model            Nombre del modelo (para logs).
     * @param cellLat          Latitud del centro de celda.
     * @param cellLon          Longitud del centro de celda.
     * @param vertexLat        Latitud de vértice.
     * @param vertexLon        Longitud de vértice.
     * @param connectivity     Índices de vértice por celda.
     * @param vertexCount      Número de vértices por celda, o {@code null} si no existe.
     * @param vertexMajor      La conectividad tiene forma {@code (nv, nCells)} en vez de {@code (nCells, nv)}.
     * @param unitsRadiansDefault Asumir radianes si falta el atributo units.
     */
    public record Convention(String model, String cellLat, String cellLon, String vertexLat, String vertexLon,
                             String connectivity, String vertexCount, boolean vertexMajor,
                             boolean unitsRadiansDefault) {
    }

    public static final List<Convention> CONVENTIONS = List.of(
            new Convention("MPAS", "latCell", "lonCell", "latVertex", "lonVertex",
                    "verticesOnCell", "nEdgesOnCell", false, true),
            new Convention("ICON", "clat", "clon", "vlat", "vlon",
                    "vertex_of_cell", null, true, true)
    );

    @Override
    public String name() {
        return "model-convention";
    }

    @Override
    public boolean matches(GridSource source) {
        return source instanceof GridDataset ds && convention(ds).isPresent();
    }

    @Override
    public CanonicalGrid extract(GridSource source, RegridMethod method) {
        GridDataset ds = (GridDataset) source;
        Convention c = convention(ds).orElseThrow();
        DataVariable latVar = ds.variable(c.cellLat()).orElseThrow();
        DataVariable lonVar = ds.variable(c.cellLon()).orElseThrow();
        double[] lat = toDegrees(latVar, c);
        double[] lon = toDegrees(lonVar, c);
        String cellDim = latVar.getDims().get(0);

        Optional<DataVariable> vLat = ds.variable(c.vertexLat());
        Optional<DataVariable> vLon = ds.variable(c.vertexLon());
        Optional<DataVariable> conn = ds.variable(c.connectivity());
        CanonicalGrid.CanonicalGridBuilder builder = CanonicalGrid.builder()
                .kind(GridKind.UNSTRUCTURED)
                .centerLat(lat)
                .centerLon(lon)
                .mask(MaskResolver.resolve(ds, List.of(cellDim), List.of(latVar, lonVar)))
                .descriptor(GridDescriptor.builder()
                        .spatialDims(List.of(cellDim))
                        .latName(latVar.getName())
                        .lonName(lonVar.getName())
                        .latAttributes(latVar.getAttributes())
                        .lonAttributes(lonVar.getAttributes())
                        .build());

        if (vLat.isPresent() && vLon.isPresent() && conn.isPresent()) {
            double[] nodeLat = toDegrees(vLat.get(), c);
            double[] nodeLon = toDegrees(vLon.get(), c);
            int[][] faces = readConnectivity(ds, c, conn.get(), lat.length, nodeLat.length);
            builder.cornerLat(nodeLat).cornerLon(nodeLon).connectivity(faces);
            log.debug("Malla {}: {} celdas, {} vértices.", c.model(), lat.length, nodeLat.length);
        } else if (method.requiresCorners()) {
            throw new MissingConnectivityError(String.format(
                    "La malla %s no incluye '%s'/'%s'/'%s' y el método %s necesita los contornos de celda.",
                    c.model(), c.vertexLat(), c.vertexLon(), c.connectivity(), method));
        }
        return builder.build();
    }

    static Optional<Convention> convention(GridDataset ds) {
        return CONVENTIONS.stream()
                .filter(c -> ds.variable(c.cellLat()).isPresent() && ds.variable(c.cellLon()).isPresent())
                .findFirst();
    }

    private static double[] toDegrees(DataVariable variable, Convention c) {
        boolean radians = variable.stringAttribute("units").isPresent()
                ? CoordinateLocator.isRadians(variable)
                : c.unitsRadiansDefault();
        return CoordinateLocator.toDegrees(variable.getData(), radians);
    }

    /**
     * Lee la conectividad (índices base 1, 0 = relleno) y la devuelve en base 0.
     */
    private static int[][] readConnectivity(GridDataset ds, Convention c, DataVariable conn, int nCells, int nNodes) {
        int[] shape = conn.getShape();
        if (shape.length != 2) {
            throw new IllegalArgumentException("La conectividad '" + conn.getName() + "' debe ser 2-D.");
        }
        int maxNodes = c.vertexMajor() ? shape[0] : shape[1];
        int cells = c.vertexMajor() ? shape[1] : shape[0];
        if (cells != nCells) {
            throw new IllegalArgumentException(String.format(
                    "La conectividad '%s' describe %d celdas pero hay %d centros.", conn.getName(), cells, nCells));
        }
        double[] counts = c.vertexCount() == null ? null
                : ds.variable(c.vertexCount()).map(DataVariable::getData).orElse(null);
        double[] raw = conn.getData();
        int[][] faces = new int[nCells][];
        for (int cell = 0; cell < nCells; cell++) {
            int limit = counts == null ? maxNodes : Math.min((int) counts[cell], maxNodes);
            int[] nodes = new int[limit];
            int n = 0;
            for (int k = 0; k < limit; k++) {
                double value = c.vertexMajor() ? raw[k * nCells + cell] : raw[cell * maxNodes + k];
                int node = (int) value - 1;
                if (node < 0) {
                    continue;
                }
                if (node >= nNodes) {
                    throw new IllegalArgumentException(String.format(
                            "La celda %d referencia el vértice %d pero solo hay %d.", cell, node, nNodes));
                }
                nodes[n++] = node;
            }
            faces[cell] = Arrays.copyOf(nodes, n);
        }
        return faces;
    }
}
