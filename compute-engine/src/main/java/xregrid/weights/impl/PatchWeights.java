package xregrid.weights.impl;

import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.SingularOps_DDRM;
import org.ejml.dense.row.factory.LinearSolverFactory_DDRM;
import org.ejml.interfaces.linsol.LinearSolverDense;
import xregrid.domain.grid.CanonicalGrid;
import xregrid.domain.operator.RowRange;
import xregrid.weights.WeightTriplets;

import java.util.Arrays;

/**
 * Recuperación por parches: ajuste por mínimos cuadrados de un plano
 * {@code f ≈ a + b·dx + c·dy} sobre los {@code k} centros fuente más próximos, en un plano
 * tangente local. El valor interpolado es {@code a}, así que los pesos son la primera fila de
 * la pseudoinversa de la matriz de diseño y suman 1.
 * <p>
 * Si los vecinos están alineados (rango de la matriz de diseño menor que 3) se cae a la media
 * de los vecinos.
 */
final class PatchWeights {

    private static final double SUM_TOLERANCE = 1e-6;

    private final int neighbours;

    PatchWeights(int neighbours) {
        this.neighbours = Math.max(neighbours, 3);
    }

    WeightTriplets compute(CanonicalGrid source, CanonicalGrid target, RowRange rows) {
        UnitSphereIndex index = new UnitSphereIndex(source.cellLats(), source.cellLons(), source.getMask());
        WeightTriplets.Accumulator acc = WeightTriplets.accumulator();
        DMatrixRMaj design = new DMatrixRMaj(1, 3);
        DMatrixRMaj pinv = new DMatrixRMaj(3, 1);
        for (int t = rows.start(); t < rows.end(); t++) {
            if (target.isMasked(t)) {
                continue;
            }
            double lat0 = target.cellLat(t);
            double lon0 = target.cellLon(t);
            int[] near = index.nearest(lat0, lon0, neighbours);
            if (near.length == 0) {
                continue;
            }
            double[] w = near.length >= 3 ? fit(source, near, lat0, lon0, design, pinv) : null;
            if (w == null) {
                w = new double[near.length];
                Arrays.fill(w, 1.0 / near.length);
            }
            for (int k = 0; k < near.length; k++) {
                if (w[k] != 0.0) {
                    acc.add(t, near[k], w[k]);
                }
            }
        }
        return acc.build();
    }

    private static double[] fit(CanonicalGrid source, int[] near, double lat0, double lon0,
                                DMatrixRMaj design, DMatrixRMaj pinv) {
        int k = near.length;
        double cosLat = Math.cos(Math.toRadians(lat0));
        design.reshape(k, 3);
        for (int r = 0; r < k; r++) {
            double dx = (BilinearWeights.unwrap(source.cellLon(near[r]), lon0) - lon0) * cosLat;
            double dy = source.cellLat(near[r]) - lat0;
            design.set(r, 0, 1.0);
            design.set(r, 1, dx);
            design.set(r, 2, dy);
        }
        if (SingularOps_DDRM.rank(design.copy()) < 3) {
            return null;
        }
        LinearSolverDense<DMatrixRMaj> solver = LinearSolverFactory_DDRM.pseudoInverse(true);
        if (!solver.setA(design.copy())) {
            return null;
        }
        pinv.reshape(3, k);
        solver.invert(pinv);
        double[] w = new double[k];
        double sum = 0;
        for (int c = 0; c < k; c++) {
            w[c] = pinv.get(0, c);
            sum += w[c];
        }
        return Math.abs(sum - 1.0) <= SUM_TOLERANCE ? w : null;
    }
}
