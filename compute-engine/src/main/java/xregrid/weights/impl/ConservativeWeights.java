package xregrid.weights.impl;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.index.strtree.STRtree;
import xregrid.weights.CellPolygon;
import xregrid.weights.GeometryPair;
import xregrid.weights.Triangulator;
import xregrid.weights.WeightTriplets;

import java.util.List;

/**
 * Pesos conservativos de primer orden: área de solape entre elementos dividida por el área
 * del elemento destino, calculada con la intersección de polígonos de JTS en el plano lon/lat.
 * <p>
 * Solo admite elementos convexos de hasta 4 vértices; el motor de generación ya triangula
 * los demás. Con longitud periódica el índice espacial incluye copias de los elementos fuente
 * desplazadas ±360°. Sin periodicidad cada elemento destino se traslada (0 o ±360°) al
 * convenio de longitudes de la malla fuente, de modo que una malla en [-180, 180] y otra en
 * [0, 360] se solapan igualmente.
 */
final class ConservativeWeights {

    private static final double AREA_EPSILON = 1e-14;
    private static final double WEIGHT_EPSILON = 1e-15;

    private final GeometryFactory geometryFactory = new GeometryFactory();

    private record IndexedPolygon(int element, Polygon polygon) {
    }

    WeightTriplets compute(GeometryPair pair) {
        List<CellPolygon> sources = pair.sourceElements();
        List<CellPolygon> targets = pair.targetElements();

        STRtree tree = new STRtree();
        double[] shifts = pair.periodic() ? new double[]{0.0, 360.0, -360.0} : new double[]{0.0};
        double sourceMinLon = Double.POSITIVE_INFINITY;
        double sourceMaxLon = Double.NEGATIVE_INFINITY;
        for (int e = 0; e < sources.size(); e++) {
            CellPolygon element = sources.get(e);
            requireSupported(element, "fuente");
            for (double shift : shifts) {
                Polygon polygon = toPolygon(element, shift);
                tree.insert(polygon.getEnvelopeInternal(), new IndexedPolygon(e, polygon));
            }
            for (double lon : element.lon()) {
                sourceMinLon = Math.min(sourceMinLon, lon);
                sourceMaxLon = Math.max(sourceMaxLon, lon);
            }
        }
        tree.build();

        WeightTriplets.Accumulator acc = WeightTriplets.accumulator();
        for (int e = 0; e < targets.size(); e++) {
            CellPolygon element = targets.get(e);
            requireSupported(element, "destino");
            double targetShift = pair.periodic() ? 0.0 : conventionShift(element, sourceMinLon, sourceMaxLon);
            Polygon polygon = toPolygon(element, targetShift);
            double area = polygon.getArea();
            if (area < AREA_EPSILON) {
                continue;
            }
            @SuppressWarnings("unchecked")
            List<IndexedPolygon> candidates = tree.query(polygon.getEnvelopeInternal());
            for (IndexedPolygon candidate : candidates) {
                Geometry overlap = polygon.intersection(candidate.polygon());
                double weight = overlap.getArea() / area;
                if (weight > WEIGHT_EPSILON) {
                    acc.add(e, candidate.element(), weight);
                }
            }
        }
        return acc.build();
    }

    private static void requireSupported(CellPolygon element, String side) {
        if (element.vertexCount() > 4) {
            throw new IllegalArgumentException(String.format(
                    "Elemento %s de la celda %d con %d vértices: el cálculo conservativo admite como máximo 4.",
                    side, element.parent(), element.vertexCount()));
        }
        if (!Triangulator.isConvex(element.lon(), element.lat())) {
            throw new IllegalArgumentException(String.format(
                    "Elemento %s de la celda %d no convexo.", side, element.parent()));
        }
    }

    /**
     * Desplazamiento (0, +360 o -360) que maximiza el solape en longitud del elemento con el
     * rango de la malla fuente. En caso de empate se queda en 0.
     */
    static double conventionShift(CellPolygon element, double sourceMinLon, double sourceMaxLon) {
        if (sourceMinLon > sourceMaxLon) {
            return 0.0;
        }
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double lon : element.lon()) {
            min = Math.min(min, lon);
            max = Math.max(max, lon);
        }
        double best = 0.0;
        double bestOverlap = lonOverlap(min, max, sourceMinLon, sourceMaxLon);
        for (double shift : new double[]{360.0, -360.0}) {
            double overlap = lonOverlap(min + shift, max + shift, sourceMinLon, sourceMaxLon);
            if (overlap > bestOverlap) {
                best = shift;
                bestOverlap = overlap;
            }
        }
        return best;
    }

    private static double lonOverlap(double aMin, double aMax, double bMin, double bMax) {
        return Math.max(0.0, Math.min(aMax, bMax) - Math.max(aMin, bMin));
    }

    private Polygon toPolygon(CellPolygon element, double lonShift) {
        int n = element.vertexCount();
        Coordinate[] ring = new Coordinate[n + 1];
        for (int k = 0; k < n; k++) {
            ring[k] = new Coordinate(element.lon()[k] + lonShift, element.lat()[k]);
        }
        ring[n] = new Coordinate(ring[0]);
        return geometryFactory.createPolygon(ring);
    }
}
