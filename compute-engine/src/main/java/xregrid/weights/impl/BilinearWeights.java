package xregrid.weights.impl;

import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.index.strtree.STRtree;
import org.locationtech.jts.triangulate.DelaunayTriangulationBuilder;
import xregrid.domain.grid.CanonicalGrid;
import xregrid.domain.operator.RowRange;
import xregrid.weights.WeightTriplets;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Interpolación bilineal sobre los centros de la malla origen.
 * <ul>
 *     <li>Rectilínea: búsqueda del intervalo que contiene al punto en cada eje.</li>
 *     <li>Curvilínea: inversión de la transformación bilineal dentro de cada cuadrilátero de
 *     centros, localizado con un {@link STRtree}.</li>
 *     <li>No estructurada: coordenadas baricéntricas en la triangulación de Delaunay de los centros.</li>
 * </ul>
 * Los puntos destino fuera del dominio fuente quedan sin pesos. Si alguno de los vértices con
 * peso no nulo está enmascarado, la fila se descarta entera.
 */
@Slf4j
final class BilinearWeights {

    private static final double WEIGHT_EPSILON = 1e-15;
    private static final double INSIDE_TOLERANCE = 1e-9;

    private final GeometryFactory geometryFactory = new GeometryFactory();

    WeightTriplets compute(CanonicalGrid source, CanonicalGrid target, boolean periodic, RowRange rows) {
        return switch (source.getKind()) {
            case RECTILINEAR -> rectilinear(source, target, periodic, rows);
            case CURVILINEAR -> curvilinear(source, target, periodic, rows);
            case UNSTRUCTURED -> unstructured(source, target, rows);
        };
    }

    // --- RECTILÍNEA ---

    /**
     * Intervalo {@code [lower, upper]} de un eje que contiene un valor y la fracción de avance.
     */
    record Bracket(int lower, int upper, double fraction) {
    }

    private WeightTriplets rectilinear(CanonicalGrid source, CanonicalGrid target, boolean periodic, RowRange rows) {
        double[] lat = source.getCenterLat();
        double[] lon = source.getCenterLon();
        int nLon = lon.length;
        WeightTriplets.Accumulator acc = WeightTriplets.accumulator();
        for (int t = rows.start(); t < rows.end(); t++) {
            if (target.isMasked(t)) {
                continue;
            }
            Bracket by = bracket(lat, target.cellLat(t));
            Bracket bx = lonBracket(lon, target.cellLon(t), periodic);
            if (by == null || bx == null) {
                continue;
            }
            int[] cells = {
                    by.lower() * nLon + bx.lower(),
                    by.lower() * nLon + bx.upper(),
                    by.upper() * nLon + bx.upper(),
                    by.upper() * nLon + bx.lower()
            };
            double u = bx.fraction();
            double v = by.fraction();
            double[] w = {(1 - u) * (1 - v), u * (1 - v), u * v, (1 - u) * v};
            addRow(acc, source, t, cells, w);
        }
        return acc.build();
    }

    /**
     * Busca el intervalo de un eje estrictamente monótono (creciente o decreciente).
     */
    static Bracket bracket(double[] axis, double x) {
        int n = axis.length;
        if (n == 1) {
            return Math.abs(axis[0] - x) <= INSIDE_TOLERANCE ? new Bracket(0, 0, 0.0) : null;
        }
        boolean increasing = axis[n - 1] > axis[0];
        double min = increasing ? axis[0] : axis[n - 1];
        double max = increasing ? axis[n - 1] : axis[0];
        if (x < min - INSIDE_TOLERANCE || x > max + INSIDE_TOLERANCE) {
            return null;
        }
        int lo = 0;
        int hi = n - 1;
        while (hi - lo > 1) {
            int mid = (lo + hi) >>> 1;
            boolean below = increasing ? x >= axis[mid] : x <= axis[mid];
            if (below) {
                lo = mid;
            } else {
                hi = mid;
            }
        }
        double fraction = (x - axis[lo]) / (axis[hi] - axis[lo]);
        return new Bracket(lo, hi, Math.min(1.0, Math.max(0.0, fraction)));
    }

    /**
     * Intervalo en longitud. Prueba el valor y sus desplazamientos de ±360° y, si la malla es
     * periódica, el tramo que une el último centro con el primero.
     */
    static Bracket lonBracket(double[] lon, double x, boolean periodic) {
        for (double shift : new double[]{0.0, 360.0, -360.0}) {
            Bracket b = bracket(lon, x + shift);
            if (b != null) {
                return b;
            }
        }
        if (!periodic || lon.length < 2) {
            return null;
        }
        int n = lon.length;
        boolean increasing = lon[n - 1] > lon[0];
        double last = lon[n - 1];
        double first = increasing ? lon[0] + 360.0 : lon[0] - 360.0;
        for (double shift : new double[]{0.0, 360.0, -360.0}) {
            double xs = x + shift;
            double fraction = (xs - last) / (first - last);
            if (fraction >= -INSIDE_TOLERANCE && fraction <= 1 + INSIDE_TOLERANCE) {
                return new Bracket(n - 1, 0, Math.min(1.0, Math.max(0.0, fraction)));
            }
        }
        return null;
    }

    // --- CURVILÍNEA ---

    private record Quad(int[] cells, double[] x, double[] y) {
    }

    private WeightTriplets curvilinear(CanonicalGrid source, CanonicalGrid target, boolean periodic, RowRange rows) {
        int[] shape = source.spatialShape();
        int ny = shape[0];
        int nx = shape[1];
        double[] lat = source.getCenterLat();
        double[] lon = source.getCenterLon();
        STRtree tree = new STRtree();
        int columns = periodic ? nx : nx - 1;
        for (int j = 0; j < ny - 1; j++) {
            for (int i = 0; i < columns; i++) {
                int i1 = (i + 1) % nx;
                int[] cells = {j * nx + i, j * nx + i1, (j + 1) * nx + i1, (j + 1) * nx + i};
                double[] x = new double[4];
                double[] y = new double[4];
                for (int k = 0; k < 4; k++) {
                    x[k] = unwrap(lon[cells[k]], lon[cells[0]]);
                    y[k] = lat[cells[k]];
                }
                Quad quad = new Quad(cells, x, y);
                tree.insert(envelope(x, y), quad);
            }
        }
        tree.build();

        WeightTriplets.Accumulator acc = WeightTriplets.accumulator();
        for (int t = rows.start(); t < rows.end(); t++) {
            if (target.isMasked(t)) {
                continue;
            }
            double ty = target.cellLat(t);
            double tx0 = target.cellLon(t);
            boolean done = false;
            for (double shift : new double[]{0.0, 360.0, -360.0}) {
                double tx = tx0 + shift;
                @SuppressWarnings("unchecked")
                List<Quad> candidates = tree.query(new Envelope(tx, tx, ty, ty));
                for (Quad quad : candidates) {
                    double[] st = invertBilinear(quad.x(), quad.y(), tx, ty);
                    if (st == null) {
                        continue;
                    }
                    double s = st[0];
                    double u = st[1];
                    double[] w = {(1 - s) * (1 - u), s * (1 - u), s * u, (1 - s) * u};
                    addRow(acc, source, t, quad.cells(), w);
                    done = true;
                    break;
                }
                if (done) {
                    break;
                }
            }
        }
        return acc.build();
    }

    /**
     * Resuelve {@code P(s,t) = (x,y)} por Newton en el cuadrilátero {@code p0..p3}.
     *
     * @return {@code {s, t}} en [0,1]² o {@code null} si el punto no cae dentro.
     */
    static double[] invertBilinear(double[] x, double[] y, double px, double py) {
        double s = 0.5;
        double t = 0.5;
        for (int iter = 0; iter < 30; iter++) {
            double fx = (1 - s) * (1 - t) * x[0] + s * (1 - t) * x[1] + s * t * x[2] + (1 - s) * t * x[3] - px;
            double fy = (1 - s) * (1 - t) * y[0] + s * (1 - t) * y[1] + s * t * y[2] + (1 - s) * t * y[3] - py;
            double dxs = (1 - t) * (x[1] - x[0]) + t * (x[2] - x[3]);
            double dxt = (1 - s) * (x[3] - x[0]) + s * (x[2] - x[1]);
            double dys = (1 - t) * (y[1] - y[0]) + t * (y[2] - y[3]);
            double dyt = (1 - s) * (y[3] - y[0]) + s * (y[2] - y[1]);
            double det = dxs * dyt - dxt * dys;
            if (Math.abs(det) < 1e-14) {
                return null;
            }
            double ds = (fx * dyt - fy * dxt) / det;
            double dt = (fy * dxs - fx * dys) / det;
            s -= ds;
            t -= dt;
            if (Math.abs(ds) < 1e-12 && Math.abs(dt) < 1e-12) {
                break;
            }
        }
        if (s < -INSIDE_TOLERANCE || s > 1 + INSIDE_TOLERANCE || t < -INSIDE_TOLERANCE || t > 1 + INSIDE_TOLERANCE) {
            return null;
        }
        return new double[]{Math.min(1, Math.max(0, s)), Math.min(1, Math.max(0, t))};
    }

    // --- NO ESTRUCTURADA ---

    private record Triangle(int[] cells, double[] x, double[] y) {
    }

    private WeightTriplets unstructured(CanonicalGrid source, CanonicalGrid target, RowRange rows) {
        double[] lat = source.getCenterLat();
        double[] lon = source.getCenterLon();
        Map<Coordinate, Integer> indexByCoordinate = new HashMap<>();
        List<Coordinate> sites = new ArrayList<>();
        for (int i = 0; i < lat.length; i++) {
            Coordinate c = new Coordinate(lon[i], lat[i]);
            if (indexByCoordinate.putIfAbsent(c, i) == null) {
                sites.add(c);
            }
        }
        WeightTriplets.Accumulator acc = WeightTriplets.accumulator();
        if (sites.size() < 3) {
            log.warn("Menos de 3 centros distintos en la malla origen: no se puede triangular.");
            return acc.build();
        }
        DelaunayTriangulationBuilder builder = new DelaunayTriangulationBuilder();
        builder.setSites(sites);
        Geometry triangles = builder.getTriangles(geometryFactory);

        STRtree tree = new STRtree();
        for (int g = 0; g < triangles.getNumGeometries(); g++) {
            Coordinate[] ring = triangles.getGeometryN(g).getCoordinates();
            int[] cells = new int[3];
            double[] x = new double[3];
            double[] y = new double[3];
            for (int k = 0; k < 3; k++) {
                cells[k] = indexByCoordinate.get(new Coordinate(ring[k].x, ring[k].y));
                x[k] = ring[k].x;
                y[k] = ring[k].y;
            }
            tree.insert(envelope(x, y), new Triangle(cells, x, y));
        }
        tree.build();

        for (int t = rows.start(); t < rows.end(); t++) {
            if (target.isMasked(t)) {
                continue;
            }
            double px = target.cellLon(t);
            double py = target.cellLat(t);
            @SuppressWarnings("unchecked")
            List<Triangle> candidates = tree.query(new Envelope(px, px, py, py));
            for (Triangle tri : candidates) {
                double[] w = barycentric(tri.x(), tri.y(), px, py);
                if (w != null) {
                    addRow(acc, source, t, tri.cells(), w);
                    break;
                }
            }
        }
        return acc.build();
    }

    static double[] barycentric(double[] x, double[] y, double px, double py) {
        double det = (y[1] - y[2]) * (x[0] - x[2]) + (x[2] - x[1]) * (y[0] - y[2]);
        if (Math.abs(det) < 1e-14) {
            return null;
        }
        double l0 = ((y[1] - y[2]) * (px - x[2]) + (x[2] - x[1]) * (py - y[2])) / det;
        double l1 = ((y[2] - y[0]) * (px - x[2]) + (x[0] - x[2]) * (py - y[2])) / det;
        double l2 = 1 - l0 - l1;
        if (l0 < -INSIDE_TOLERANCE || l1 < -INSIDE_TOLERANCE || l2 < -INSIDE_TOLERANCE) {
            return null;
        }
        return new double[]{l0, l1, l2};
    }

    // --- COMÚN ---

    private static void addRow(WeightTriplets.Accumulator acc, CanonicalGrid source, int row, int[] cells, double[] w) {
        for (int k = 0; k < cells.length; k++) {
            if (Math.abs(w[k]) > WEIGHT_EPSILON && source.isMasked(cells[k])) {
                return;
            }
        }
        // Vértices repetidos (ej: eje de una sola celda) se suman en el operador
        for (int k = 0; k < cells.length; k++) {
            if (Math.abs(w[k]) > WEIGHT_EPSILON) {
                acc.add(row, cells[k], w[k]);
            }
        }
    }

    static double unwrap(double lon, double reference) {
        double x = lon;
        while (x - reference > 180.0) x -= 360.0;
        while (x - reference < -180.0) x += 360.0;
        return x;
    }

    private static Envelope envelope(double[] x, double[] y) {
        Envelope env = new Envelope();
        for (int k = 0; k < x.length; k++) {
            env.expandToInclude(x[k], y[k]);
        }
        return env;
    }
}
