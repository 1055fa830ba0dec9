package xregrid.weights.impl;

import xregrid.domain.grid.CanonicalGrid;
import xregrid.domain.operator.Extrapolation;
import xregrid.weights.WeightTriplets;

/**
 * Rellena celdas destino sin pesos a partir de las celdas fuente no enmascaradas más próximas.
 * <ul>
 *     <li>{@code nearest_s2d}: peso 1 desde la fuente más próxima.</li>
 *     <li>{@code nearest_idw}: pesos {@code 1/d^p} sobre las {@link #IDW_SOURCE_POINTS} fuentes
 *     más próximas, normalizados a suma 1. Una fuente a distancia nula recibe todo el peso.</li>
 * </ul>
 */
final class NearestExtrapolator {

    static final int IDW_SOURCE_POINTS = 8;

    private static final double COINCIDENT_DISTANCE = 1e-12;

    WeightTriplets fill(CanonicalGrid source, CanonicalGrid target, int[] unmappedRows, Extrapolation extrapolation) {
        WeightTriplets.Accumulator acc = WeightTriplets.accumulator();
        if (!extrapolation.isEnabled() || unmappedRows.length == 0) {
            return acc.build();
        }
        double[] lats = source.cellLats();
        double[] lons = source.cellLons();
        UnitSphereIndex index = new UnitSphereIndex(lats, lons, source.getMask());
        for (int t : unmappedRows) {
            double lat = target.cellLat(t);
            double lon = target.cellLon(t);
            switch (extrapolation.method()) {
                case NEAREST_S2D -> {
                    int s = index.nearest(lat, lon);
                    if (s >= 0) {
                        acc.add(t, s, 1.0);
                    }
                }
                case NEAREST_IDW -> inverseDistance(acc, t, lat, lon,
                        index.nearest(lat, lon, IDW_SOURCE_POINTS), lats, lons, extrapolation.distExponent());
                default -> throw new IllegalStateException("Método de extrapolación sin implementar: " + extrapolation.method());
            }
        }
        return acc.build();
    }

    private static void inverseDistance(WeightTriplets.Accumulator acc, int row, double lat, double lon,
                                        int[] near, double[] lats, double[] lons, double exponent) {
        if (near.length == 0) {
            return;
        }
        double[] w = new double[near.length];
        double total = 0.0;
        for (int k = 0; k < near.length; k++) {
            double d = angularDistance(lat, lon, lats[near[k]], lons[near[k]]);
            if (d < COINCIDENT_DISTANCE) {
                acc.add(row, near[k], 1.0);
                return;
            }
            w[k] = 1.0 / Math.pow(d, exponent);
            total += w[k];
        }
        for (int k = 0; k < near.length; k++) {
            acc.add(row, near[k], w[k] / total);
        }
    }

    /**
     * Ángulo central en radianes entre dos puntos dados en grados.
     */
    static double angularDistance(double lat1, double lon1, double lat2, double lon2) {
        double[] a = UnitSphereIndex.toUnitVector(lat1, lon1);
        double[] b = UnitSphereIndex.toUnitVector(lat2, lon2);
        double dx = a[0] - b[0];
        double dy = a[1] - b[1];
        double dz = a[2] - b[2];
        double chord = Math.sqrt(dx * dx + dy * dy + dz * dz);
        return 2.0 * Math.asin(Math.min(1.0, chord / 2.0));
    }
}
