package xregrid.grid;

import xregrid.domain.exception.MissingConnectivityError;

/**
 * Sintetiza esquinas de celda por interpolación de puntos medios entre centros adyacentes
 * (solo mallas rectilíneas y curvilíneas). Las latitudes se recortan a ±90.
 */
public final class BoundsSynthesizer {

    private BoundsSynthesizer() {
    }

    /**
     * Aristas de un eje 1-D: puntos medios interiores y extrapolación de medio paso en los extremos.
     */
    public static double[] edgesFromCenters(double[] centers, boolean latitude) {
        int n = centers.length;
        if (n < 2) {
            throw new MissingConnectivityError(
                    "No se pueden sintetizar límites de celda a partir de un único centro por eje.");
        }
        double[] edges = new double[n + 1];
        edges[0] = centers[0] - (centers[1] - centers[0]) / 2.0;
        for (int i = 1; i < n; i++) {
            edges[i] = (centers[i - 1] + centers[i]) / 2.0;
        }
        edges[n] = centers[n - 1] + (centers[n - 1] - centers[n - 2]) / 2.0;
        if (latitude) {
            clampLatitudes(edges);
        }
        return edges;
    }

    /**
     * Esquinas {@code (ny+1)*(nx+1)} de una malla curvilínea a partir de sus centros {@code ny*nx}.
     * <p>
     * Se extiende la malla de centros una fila/columna por cada lado por extrapolación lineal y
     * cada esquina es la media de los cuatro centros que la rodean. Las longitudes se desenrollan
     * antes de promediar para no romper celdas que cruzan el meridiano 0/360.
     *
     * @return {@code {cornerLat, cornerLon}}.
     */
    public static double[][] cornersFromCenters(double[] lat, double[] lon, int ny, int nx) {
        if (ny < 2 || nx < 2) {
            throw new MissingConnectivityError(String.format(
                    "Malla curvilínea %dx%d demasiado pequeña para sintetizar esquinas.", ny, nx));
        }
        double[][] padLat = pad(lat, ny, nx, false);
        double[][] padLon = pad(lon, ny, nx, true);

        double[] cornerLat = new double[(ny + 1) * (nx + 1)];
        double[] cornerLon = new double[(ny + 1) * (nx + 1)];
        for (int j = 0; j <= ny; j++) {
            for (int i = 0; i <= nx; i++) {
                double ref = padLon[j][i];
                double sumLon = 0;
                for (double v : new double[]{padLon[j][i], padLon[j][i + 1], padLon[j + 1][i], padLon[j + 1][i + 1]}) {
                    sumLon += unwrap(v, ref);
                }
                int k = j * (nx + 1) + i;
                cornerLon[k] = sumLon / 4.0;
                cornerLat[k] = (padLat[j][i] + padLat[j][i + 1] + padLat[j + 1][i] + padLat[j + 1][i + 1]) / 4.0;
            }
        }
        clampLatitudes(cornerLat);
        return new double[][]{cornerLat, cornerLon};
    }

    private static double[][] pad(double[] values, int ny, int nx, boolean longitude) {
        double[][] out = new double[ny + 2][nx + 2];
        for (int j = 0; j < ny; j++) {
            double ref = values[j * nx];
            for (int i = 0; i < nx; i++) {
                double v = values[j * nx + i];
                out[j + 1][i + 1] = longitude ? unwrap(v, ref) : v;
                if (longitude) {
                    ref = out[j + 1][i + 1];
                }
            }
            out[j + 1][0] = 2 * out[j + 1][1] - out[j + 1][2];
            out[j + 1][nx + 1] = 2 * out[j + 1][nx] - out[j + 1][nx - 1];
        }
        for (int i = 0; i < nx + 2; i++) {
            out[0][i] = 2 * out[1][i] - out[2][i];
            out[ny + 1][i] = 2 * out[ny][i] - out[ny - 1][i];
        }
        return out;
    }

    private static double unwrap(double value, double reference) {
        double v = value;
        while (v - reference > 180.0) v -= 360.0;
        while (v - reference < -180.0) v += 360.0;
        return v;
    }

    private static void clampLatitudes(double[] lat) {
        for (int i = 0; i < lat.length; i++) {
            lat[i] = Math.max(-90.0, Math.min(90.0, lat[i]));
        }
    }
}
