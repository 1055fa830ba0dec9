package xregrid.grid.matcher;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import xregrid.TestGrids;
import xregrid.domain.dataset.DataVariable;
import xregrid.domain.dataset.GridDataset;
import xregrid.domain.grid.CanonicalGrid;
import xregrid.domain.operator.RegridMethod;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static xregrid.TestGrids.attrs;

class RectilinearMatcherTest {

    private final RectilinearMatcher matcher = new RectilinearMatcher();

    @Test
    @DisplayName("Los límites CF en pares (n, 2) se convierten en aristas n+1")
    void extract_shouldReadPairBounds() {
        // --- 1. ARRANGE ---
        DataVariable lat = DataVariable.coordinate("lat", "lat", new double[]{-45, 45},
                attrs("standard_name", "latitude", "bounds", "lat_bnds"));
        DataVariable latBnds = DataVariable.builder().name("lat_bnds").dims(List.of("lat", "nb"))
                .shape(new int[]{2, 2}).data(new double[]{-90, 0, 0, 90}).build();
        GridDataset ds = GridDataset.of(lat, latBnds, TestGrids.longitude("lon", "lon", 90, 270));

        // --- 2. ACT ---
        CanonicalGrid grid = matcher.extract(ds, RegridMethod.CONSERVATIVE);

        // --- 3. ASSERT ---
        assertThat(grid.getCornerLat()).containsExactly(-90.0, 0.0, 90.0);
        assertThat(grid.getCornerLon()).containsExactly(0.0, 180.0, 360.0);
    }

    @Test
    @DisplayName("Las coordenadas en radianes se convierten a grados")
    void extract_shouldConvertRadians() {
        GridDataset ds = GridDataset.of(
                DataVariable.coordinate("lat", "lat", new double[]{0.0, Math.PI / 4},
                        attrs("standard_name", "latitude", "units", "radians")),
                DataVariable.coordinate("lon", "lon", new double[]{0.0, Math.PI},
                        attrs("standard_name", "longitude", "units", "radians")));

        CanonicalGrid grid = matcher.extract(ds, RegridMethod.BILINEAR);

        assertThat(grid.getCenterLat()[1]).isCloseTo(45.0, within(1e-12));
        assertThat(grid.getCenterLon()[1]).isCloseTo(180.0, within(1e-12));
    }

    @Test
    @DisplayName("Un eje no monótono no se reconoce como rectilíneo")
    void matches_shouldRequireMonotonicAxes() {
        GridDataset ds = GridDataset.of(
                TestGrids.latitude("lat", "lat", 0, 10, 5),
                TestGrids.longitude("lon", "lon", 0, 10));

        assertThat(matcher.matches(ds)).isFalse();
        assertThat(RectilinearMatcher.isMonotonic(new double[]{3, 2, 1})).isTrue();
    }

    @Test
    @DisplayName("Unos límites con forma desconocida se rechazan")
    void extract_shouldRejectUnsupportedBoundsShape() {
        DataVariable lat = DataVariable.coordinate("lat", "lat", new double[]{-45, 45},
                attrs("standard_name", "latitude", "bounds", "lat_bnds"));
        DataVariable latBnds = DataVariable.coordinate("lat_bnds", "nb", new double[]{-90, 0, 45, 90}, null);
        GridDataset ds = GridDataset.of(lat, latBnds, TestGrids.longitude("lon", "lon", 90, 270));

        assertThrows(IllegalArgumentException.class, () -> matcher.extract(ds, RegridMethod.BILINEAR));
    }
}
