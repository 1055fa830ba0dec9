package xregrid.weights;

import java.util.ArrayList;
import java.util.List;

/**
 * Divide las celdas que el backend conservativo no admite (más de 4 vértices o no convexas)
 * en un abanico de triángulos desde el primer vértice.
 * <p>
 * Cada triángulo guarda la fracción de área de su celda para poder reagregar los pesos.
 * Las áreas son planas en el espacio lon/lat.
 */
public final class Triangulator {

    private static final double AREA_EPSILON = 1e-14;

    private Triangulator() {
    }

    public static List<CellPolygon> split(int parent, double[] lon, double[] lat) {
        int n = lon.length;
        if (n <= 4 && isConvex(lon, lat)) {
            return List.of(new CellPolygon(parent, lon, lat, 1.0));
        }
        double total = planarArea(lon, lat);
        List<CellPolygon> triangles = new ArrayList<>(n - 2);
        for (int k = 1; k < n - 1; k++) {
            double[] tLon = {lon[0], lon[k], lon[k + 1]};
            double[] tLat = {lat[0], lat[k], lat[k + 1]};
            double area = planarArea(tLon, tLat);
            if (area < AREA_EPSILON) {
                continue;
            }
            triangles.add(new CellPolygon(parent, tLon, tLat, total > 0 ? area / total : 0.0));
        }
        return triangles;
    }

    /**
     * Área plana (fórmula del cordón) en valor absoluto.
     */
    public static double planarArea(double[] lon, double[] lat) {
        double sum = 0;
        int n = lon.length;
        for (int i = 0; i < n; i++) {
            int j = (i + 1) % n;
            sum += lon[i] * lat[j] - lon[j] * lat[i];
        }
        return Math.abs(sum) / 2.0;
    }

    /**
     * Convexidad estricta: todos los productos cruzados del contorno con el mismo signo
     * (los nulos, de vértices alineados, se ignoran).
     */
    public static boolean isConvex(double[] lon, double[] lat) {
        int n = lon.length;
        if (n < 3) {
            return false;
        }
        int sign = 0;
        for (int i = 0; i < n; i++) {
            double ax = lon[(i + 1) % n] - lon[i];
            double ay = lat[(i + 1) % n] - lat[i];
            double bx = lon[(i + 2) % n] - lon[(i + 1) % n];
            double by = lat[(i + 2) % n] - lat[(i + 1) % n];
            double cross = ax * by - ay * bx;
            if (Math.abs(cross) < AREA_EPSILON) {
                continue;
            }
            int s = cross > 0 ? 1 : -1;
            if (sign == 0) {
                sign = s;
            } else if (s != sign) {
                return false;
            }
        }
        return sign != 0;
    }
}
