package xregrid.grid.matcher;

import lombok.extern.slf4j.Slf4j;
import xregrid.domain.dataset.DataVariable;
import xregrid.domain.dataset.GridDataset;
import xregrid.domain.dataset.GridSource;
import xregrid.domain.dataset.Has1DCoords;
import xregrid.domain.dataset.HasBounds;
import xregrid.domain.grid.CanonicalGrid;
import xregrid.domain.grid.GridDescriptor;
import xregrid.domain.grid.GridKind;
import xregrid.domain.operator.RegridMethod;
import xregrid.grid.BoundsSynthesizer;
import xregrid.grid.CoordinateLocator;
import xregrid.grid.CoordinateLocator.Role;

import java.util.List;
import java.util.Optional;

/**
 * Dos coordenadas 1-D monótonas sobre dimensiones distintas: malla rectilínea.
 * <p>
 * Los límites se toman del atributo CF {@code bounds} (vector de aristas n+1 o pares (n,2));
 * si faltan y el método los necesita, se sintetizan por puntos medios.
 */
@Slf4j
public class RectilinearMatcher implements GridMatcher {

    @Override
    public String name() {
        return "rectilinear";
    }

    @Override
    public boolean matches(GridSource source) {
        if (source instanceof Has1DCoords) {
            return true;
        }
        if (!(source instanceof GridDataset ds)) {
            return false;
        }
        Optional<DataVariable> lat = CoordinateLocator.find(ds, Role.LATITUDE);
        Optional<DataVariable> lon = CoordinateLocator.find(ds, Role.LONGITUDE);
        if (lat.isEmpty() || lon.isEmpty()) {
            return false;
        }
        DataVariable la = lat.get();
        DataVariable lo = lon.get();
        return la.rank() == 1 && lo.rank() == 1
                && !la.getDims().get(0).equals(lo.getDims().get(0))
                && isMonotonic(la.getData()) && isMonotonic(lo.getData());
    }

    @Override
    public CanonicalGrid extract(GridSource source, RegridMethod method) {
        if (source instanceof Has1DCoords axes) {
            double[] lat = axes.latitudes();
            double[] lon = axes.longitudes();
            CanonicalGrid.CanonicalGridBuilder builder = CanonicalGrid.builder()
                    .kind(GridKind.RECTILINEAR)
                    .centerLat(lat)
                    .centerLon(lon)
                    .descriptor(GridDescriptor.defaults(GridKind.RECTILINEAR));
            if (method.requiresCorners()) {
                builder.cornerLat(BoundsSynthesizer.edgesFromCenters(lat, true))
                        .cornerLon(BoundsSynthesizer.edgesFromCenters(lon, false));
            }
            return builder.build();
        }

        GridDataset ds = (GridDataset) source;
        DataVariable latVar = CoordinateLocator.find(ds, Role.LATITUDE).orElseThrow();
        DataVariable lonVar = CoordinateLocator.find(ds, Role.LONGITUDE).orElseThrow();
        double[] lat = CoordinateLocator.valuesInDegrees(latVar);
        double[] lon = CoordinateLocator.valuesInDegrees(lonVar);
        List<String> dims = List.of(latVar.getDims().get(0), lonVar.getDims().get(0));

        double[] latEdges = explicitEdges(ds, latVar, lat.length).orElse(null);
        double[] lonEdges = explicitEdges(ds, lonVar, lon.length).orElse(null);
        if ((latEdges == null || lonEdges == null) && method.requiresCorners()) {
            log.info("Límites ausentes en '{}'/'{}': se sintetizan por puntos medios.", latVar.getName(), lonVar.getName());
            latEdges = latEdges == null ? BoundsSynthesizer.edgesFromCenters(lat, true) : latEdges;
            lonEdges = lonEdges == null ? BoundsSynthesizer.edgesFromCenters(lon, false) : lonEdges;
        }
        if (latEdges == null || lonEdges == null) {
            latEdges = null;
            lonEdges = null;
        }

        return CanonicalGrid.builder()
                .kind(GridKind.RECTILINEAR)
                .centerLat(lat)
                .centerLon(lon)
                .cornerLat(latEdges)
                .cornerLon(lonEdges)
                .mask(MaskResolver.resolve(ds, dims, List.of(latVar, lonVar)))
                .descriptor(GridDescriptor.builder()
                        .spatialDims(dims)
                        .latName(latVar.getName())
                        .lonName(lonVar.getName())
                        .latAttributes(latVar.getAttributes())
                        .lonAttributes(lonVar.getAttributes())
                        .build())
                .build();
    }

    private Optional<double[]> explicitEdges(HasBounds ds, DataVariable coordinate, int n) {
        Optional<DataVariable> bounds = ds.findBounds(coordinate);
        if (bounds.isEmpty()) {
            return Optional.empty();
        }
        DataVariable b = bounds.get();
        double[] values = CoordinateLocator.toDegrees(b.getData(), CoordinateLocator.isRadians(coordinate)
                || CoordinateLocator.isRadians(b));
        if (b.rank() == 1 && values.length == n + 1) {
            return Optional.of(values);
        }
        if (b.rank() == 2 && b.getShape()[0] == n && b.getShape()[1] == 2) {
            double[] edges = new double[n + 1];
            for (int i = 0; i < n; i++) {
                edges[i] = values[2 * i];
            }
            edges[n] = values[2 * (n - 1) + 1];
            return Optional.of(edges);
        }
        throw new IllegalArgumentException(String.format(
                "Límites '%s' con forma no soportada para un eje de %d celdas.", b.getName(), n));
    }

    static boolean isMonotonic(double[] axis) {
        if (axis.length < 2) {
            return axis.length == 1;
        }
        boolean increasing = axis[1] > axis[0];
        for (int i = 0; i < axis.length - 1; i++) {
            if (increasing ? axis[i + 1] <= axis[i] : axis[i + 1] >= axis[i]) {
                return false;
            }
        }
        return true;
    }
}
