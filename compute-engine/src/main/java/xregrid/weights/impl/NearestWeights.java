package xregrid.weights.impl;

import xregrid.domain.grid.CanonicalGrid;
import xregrid.domain.operator.RowRange;
import xregrid.weights.WeightTriplets;

/**
 * Vecino más próximo por distancia de gran círculo con peso 1.
 * <ul>
 *     <li>s2d: cada celda destino toma el valor de su celda fuente más próxima.</li>
 *     <li>d2s: cada celda fuente se asigna a su celda destino más próxima; una celda destino
 *     acumula la suma de todas las fuentes que recibe y puede quedar sin pesos.</li>
 * </ul>
 */
final class NearestWeights {

    WeightTriplets sourceToDestination(CanonicalGrid source, CanonicalGrid target, RowRange rows) {
        UnitSphereIndex index = new UnitSphereIndex(source.cellLats(), source.cellLons(), source.getMask());
        WeightTriplets.Accumulator acc = WeightTriplets.accumulator();
        for (int t = rows.start(); t < rows.end(); t++) {
            if (target.isMasked(t)) {
                continue;
            }
            int s = index.nearest(target.cellLat(t), target.cellLon(t));
            if (s >= 0) {
                acc.add(t, s, 1.0);
            }
        }
        return acc.build();
    }

    WeightTriplets destinationToSource(CanonicalGrid source, CanonicalGrid target, RowRange rows) {
        UnitSphereIndex index = new UnitSphereIndex(target.cellLats(), target.cellLons(), target.getMask());
        WeightTriplets.Accumulator acc = WeightTriplets.accumulator();
        int nSource = source.cellCount();
        for (int s = 0; s < nSource; s++) {
            if (source.isMasked(s)) {
                continue;
            }
            int t = index.nearest(source.cellLat(s), source.cellLon(s));
            if (t >= 0 && rows.contains(t)) {
                acc.add(t, s, 1.0);
            }
        }
        return acc.build();
    }
}
