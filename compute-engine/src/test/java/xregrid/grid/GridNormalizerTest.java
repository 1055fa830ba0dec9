package xregrid.grid;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import xregrid.TestGrids;
import xregrid.domain.dataset.DataVariable;
import xregrid.domain.dataset.GridDataset;
import xregrid.domain.dataset.LatLonAxes;
import xregrid.domain.dataset.UnstructuredMesh;
import xregrid.domain.exception.UnsupportedGridError;
import xregrid.domain.grid.CanonicalGrid;
import xregrid.domain.grid.GridKind;
import xregrid.domain.operator.RegridMethod;
import xregrid.factory.GridDatasetFactory;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class GridNormalizerTest {

    private final GridNormalizer normalizer = new GridNormalizer();

    @Test
    @DisplayName("Una malla global de la fábrica se normaliza como rectilínea con aristas explícitas")
    void normalize_shouldRecognizeFactoryGrid() {
        // --- 1. ARRANGE ---
        GridDataset ds = GridDatasetFactory.createGlobalGrid(30.0, 30.0);

        // --- 2. ACT ---
        CanonicalGrid grid = normalizer.normalize(ds, RegridMethod.CONSERVATIVE);

        // --- 3. ASSERT ---
        assertThat(grid.getKind()).isEqualTo(GridKind.RECTILINEAR);
        assertThat(grid.spatialShape()).containsExactly(6, 12);
        assertThat(grid.getCornerLat()).startsWith(-90.0).endsWith(90.0);
        assertThat(grid.getDescriptor().spatialDims()).containsExactly("lat", "lon");
    }

    @Test
    @DisplayName("La prioridad UGRID gana sobre la detección rectilínea/curvilínea")
    void normalize_shouldPreferUgrid() {
        CanonicalGrid grid = normalizer.normalize(TestGrids.ugridSquare(true));

        assertThat(grid.getKind()).isEqualTo(GridKind.UNSTRUCTURED);
        assertThat(grid.getDescriptor().isUgrid()).isTrue();
    }

    @Test
    @DisplayName("Un objeto de malla se copia tal cual con su dimensión de caras")
    void normalize_shouldAcceptMeshObjects() {
        UnstructuredMesh mesh = UnstructuredMesh.builder()
                .nodeLon(new double[]{0, 10, 10, 0})
                .nodeLat(new double[]{0, 0, 10, 10})
                .faceNodes(new int[][]{{0, 1, 2, 3}})
                .faceDimension("cell")
                .build();

        CanonicalGrid grid = normalizer.normalize(mesh, RegridMethod.CONSERVATIVE);

        assertThat(grid.getKind()).isEqualTo(GridKind.UNSTRUCTURED);
        assertThat(grid.hasCorners()).isTrue();
        assertThat(grid.cellLon(0)).isEqualTo(5.0);
        assertThat(grid.getDescriptor().spatialDims()).containsExactly("cell");
    }

    @Test
    @DisplayName("Unos ejes desnudos sintetizan aristas cuando el método las necesita")
    void normalize_shouldSynthesizeEdgesForBareAxes() {
        LatLonAxes axes = new LatLonAxes(new double[]{-45, 45}, new double[]{0, 90, 180, 270});

        CanonicalGrid withCorners = normalizer.normalize(axes, RegridMethod.CONSERVATIVE);
        CanonicalGrid withoutCorners = normalizer.normalize(axes, RegridMethod.BILINEAR);

        assertThat(withCorners.getCornerLat()).containsExactly(-90.0, 0.0, 90.0);
        assertThat(withCorners.getCornerLon()).containsExactly(-45.0, 45.0, 135.0, 225.0, 315.0);
        assertThat(withoutCorners.hasCorners()).isFalse();
    }

    @Test
    @DisplayName("Si ninguna convención encaja se lanza UnsupportedGridError con las coordenadas inspeccionadas")
    void normalize_shouldFailOnUnknownConvention() {
        GridDataset ds = GridDataset.of(DataVariable.builder()
                .name("temperature").dims(List.of("t")).shape(new int[]{3}).attributes(Map.of("units", "K"))
                .build());

        UnsupportedGridError ex = assertThrows(UnsupportedGridError.class, () -> normalizer.normalize(ds));

        assertThat(ex.getInspectedCoordinates()).containsExactly("temperature");
        assertThat(ex.getMessage()).contains("temperature");
    }

    @Test
    @DisplayName("La cadena de matchers sigue el orden de prioridad fijo")
    void getMatchers_shouldFollowPriorityOrder() {
        assertThat(normalizer.getMatchers())
                .extracting(m -> m.name())
                .containsExactly("mesh-object", "ugrid", "model-convention", "rectilinear", "curvilinear");
    }
}
