package xregrid.grid.matcher;

import xregrid.domain.dataset.GridSource;
import xregrid.domain.dataset.HasConnectivity;
import xregrid.domain.dataset.UnstructuredMesh;
import xregrid.domain.grid.CanonicalGrid;
import xregrid.domain.grid.GridDescriptor;
import xregrid.domain.grid.GridKind;
import xregrid.domain.operator.RegridMethod;

import java.util.List;

/**
 * Objeto de malla que expone la topología directamente: centros, nodos y conectividad se
 * copian tal cual.
 */
public class MeshObjectMatcher implements GridMatcher {

    @Override
    public String name() {
        return "mesh-object";
    }

    @Override
    public boolean matches(GridSource source) {
        return source instanceof HasConnectivity;
    }

    @Override
    public CanonicalGrid extract(GridSource source, RegridMethod method) {
        HasConnectivity mesh = (HasConnectivity) source;
        String faceDim = source instanceof UnstructuredMesh um ? um.faceDimension() : "n_face";
        return CanonicalGrid.builder()
                .kind(GridKind.UNSTRUCTURED)
                .centerLat(mesh.faceLat())
                .centerLon(mesh.faceLon())
                .cornerLat(mesh.nodeLat())
                .cornerLon(mesh.nodeLon())
                .connectivity(mesh.faceNodes())
                .descriptor(GridDescriptor.defaults(GridKind.UNSTRUCTURED).withSpatialDims(List.of(faceDim)))
                .build();
    }
}
