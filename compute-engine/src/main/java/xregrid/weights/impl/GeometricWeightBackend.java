package xregrid.weights.impl;

import lombok.extern.slf4j.Slf4j;
import xregrid.domain.grid.CanonicalGrid;
import xregrid.domain.operator.Extrapolation;
import xregrid.domain.operator.RegridMethod;
import xregrid.weights.GeometryPair;
import xregrid.weights.WeightBackend;
import xregrid.weights.WeightTriplets;

/**
 * Backend de pesos en Java puro sobre JTS (geometría, índices espaciales, Delaunay) y EJML
 * (mínimos cuadrados).
 * <p>
 * Las distancias de vecino más próximo son de gran círculo; las áreas y la interpolación
 * bilineal trabajan en el plano lon/lat.
 */
@Slf4j
public class GeometricWeightBackend implements WeightBackend {

    public static final int DEFAULT_PATCH_NEIGHBOURS = 8;

    private final BilinearWeights bilinear = new BilinearWeights();
    private final NearestWeights nearest = new NearestWeights();
    private final ConservativeWeights conservative = new ConservativeWeights();
    private final PatchWeights patch;
    private final NearestExtrapolator extrapolator = new NearestExtrapolator();

    public GeometricWeightBackend() {
        this(DEFAULT_PATCH_NEIGHBOURS);
    }

    public GeometricWeightBackend(int patchNeighbours) {
        this.patch = new PatchWeights(patchNeighbours);
    }

    @Override
    public WeightTriplets compute(GeometryPair geometry, RegridMethod method) {
        log.debug("Calculando pesos {} ({} -> {}, filas {})", method,
                geometry.source().getKind(), geometry.target().getKind(), geometry.targetRows());
        return switch (method) {
            case BILINEAR -> bilinear.compute(geometry.source(), geometry.target(), geometry.periodic(), geometry.targetRows());
            case PATCH -> patch.compute(geometry.source(), geometry.target(), geometry.targetRows());
            case NEAREST_S2D -> nearest.sourceToDestination(geometry.source(), geometry.target(), geometry.targetRows());
            case NEAREST_D2S -> nearest.destinationToSource(geometry.source(), geometry.target(), geometry.targetRows());
            case CONSERVATIVE -> conservative.compute(geometry);
        };
    }

    @Override
    public WeightTriplets extrapolate(CanonicalGrid source, CanonicalGrid target, int[] unmappedRows,
                                      Extrapolation extrapolation) {
        log.debug("Extrapolando {} celdas destino sin pesos ({})", unmappedRows.length, extrapolation.describe());
        return extrapolator.fill(source, target, unmappedRows, extrapolation);
    }
}
