package xregrid.grid.matcher;

import lombok.extern.slf4j.Slf4j;
import xregrid.domain.dataset.DataVariable;
import xregrid.domain.dataset.GridDataset;
import xregrid.domain.dataset.GridSource;
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
 * Dos coordenadas 2-D que comparten dimensiones: malla curvilínea.
 * <p>
 * Límites aceptados: esquinas {@code (ny+1, nx+1)} o vértices CF {@code (ny, nx, 4)} en sentido
 * antihorario empezando por la esquina inferior izquierda.
 */
@Slf4j
public class CurvilinearMatcher implements GridMatcher {

    @Override
    public String name() {
        return "curvilinear";
    }

    @Override
    public boolean matches(GridSource source) {
        if (!(source instanceof GridDataset ds)) {
            return false;
        }
        Optional<DataVariable> lat = CoordinateLocator.find(ds, Role.LATITUDE);
        Optional<DataVariable> lon = CoordinateLocator.find(ds, Role.LONGITUDE);
        return lat.isPresent() && lon.isPresent()
                && lat.get().rank() == 2
                && lat.get().getDims().equals(lon.get().getDims());
    }

    @Override
    public CanonicalGrid extract(GridSource source, RegridMethod method) {
        GridDataset ds = (GridDataset) source;
        DataVariable latVar = CoordinateLocator.find(ds, Role.LATITUDE).orElseThrow();
        DataVariable lonVar = CoordinateLocator.find(ds, Role.LONGITUDE).orElseThrow();
        int ny = latVar.getShape()[0];
        int nx = latVar.getShape()[1];
        double[] lat = CoordinateLocator.valuesInDegrees(latVar);
        double[] lon = CoordinateLocator.valuesInDegrees(lonVar);

        double[] cornerLat = explicitCorners(ds, latVar, ny, nx);
        double[] cornerLon = explicitCorners(ds, lonVar, ny, nx);
        if ((cornerLat == null || cornerLon == null) && method.requiresCorners()) {
            log.info("Esquinas ausentes en la malla curvilínea {}x{}: se sintetizan.", ny, nx);
            double[][] corners = BoundsSynthesizer.cornersFromCenters(lat, lon, ny, nx);
            cornerLat = corners[0];
            cornerLon = corners[1];
        }
        if (cornerLat == null || cornerLon == null) {
            cornerLat = null;
            cornerLon = null;
        }

        return CanonicalGrid.builder()
                .kind(GridKind.CURVILINEAR)
                .centerLat(lat)
                .centerLon(lon)
                .cornerLat(cornerLat)
                .cornerLon(cornerLon)
                .spatialShape(new int[]{ny, nx})
                .mask(MaskResolver.resolve(ds, latVar.getDims(), List.of(latVar, lonVar)))
                .descriptor(GridDescriptor.builder()
                        .spatialDims(latVar.getDims())
                        .latName(latVar.getName())
                        .lonName(lonVar.getName())
                        .latAttributes(latVar.getAttributes())
                        .lonAttributes(lonVar.getAttributes())
                        .build())
                .build();
    }

    private double[] explicitCorners(GridDataset ds, DataVariable coordinate, int ny, int nx) {
        Optional<DataVariable> bounds = ds.findBounds(coordinate);
        if (bounds.isEmpty()) {
            return null;
        }
        DataVariable b = bounds.get();
        double[] values = CoordinateLocator.toDegrees(b.getData(),
                CoordinateLocator.isRadians(coordinate) || CoordinateLocator.isRadians(b));
        int[] shape = b.getShape();
        if (shape.length == 2 && shape[0] == ny + 1 && shape[1] == nx + 1) {
            return values;
        }
        if (shape.length == 3 && shape[0] == ny && shape[1] == nx && shape[2] == 4) {
            return verticesToCorners(values, ny, nx);
        }
        throw new IllegalArgumentException(String.format(
                "Límites '%s' con forma no soportada para una malla %dx%d.", b.getName(), ny, nx));
    }

    private static double[] verticesToCorners(double[] v, int ny, int nx) {
        double[] corners = new double[(ny + 1) * (nx + 1)];
        int stride = nx + 1;
        for (int j = 0; j < ny; j++) {
            for (int i = 0; i < nx; i++) {
                int base = (j * nx + i) * 4;
                corners[j * stride + i] = v[base];
                if (i == nx - 1) {
                    corners[j * stride + nx] = v[base + 1];
                }
                if (j == ny - 1) {
                    corners[ny * stride + i] = v[base + 3];
                }
                if (i == nx - 1 && j == ny - 1) {
                    corners[ny * stride + nx] = v[base + 2];
                }
            }
        }
        return corners;
    }
}
