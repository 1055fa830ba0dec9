package xregrid.grid;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import xregrid.domain.exception.MissingConnectivityError;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertThrows;

class BoundsSynthesizerTest {

    @Test
    @DisplayName("Las aristas 1-D son puntos medios y se extrapolan medio paso en los extremos")
    void edgesFromCenters_shouldUseMidpoints() {
        double[] edges = BoundsSynthesizer.edgesFromCenters(new double[]{0.0, 10.0, 30.0}, false);

        assertThat(edges).containsExactly(-5.0, 5.0, 20.0, 40.0);
    }

    @Test
    @DisplayName("Las aristas de latitud se recortan a ±90")
    void edgesFromCenters_shouldClampLatitudes() {
        double[] edges = BoundsSynthesizer.edgesFromCenters(new double[]{-80.0, 0.0, 80.0}, true);

        assertThat(edges).containsExactly(-90.0, -40.0, 40.0, 90.0);
    }

    @Test
    @DisplayName("Un único centro no basta para sintetizar límites")
    void edgesFromCenters_shouldRejectSingleCenter() {
        assertThrows(MissingConnectivityError.class,
                () -> BoundsSynthesizer.edgesFromCenters(new double[]{5.0}, true));
        assertThrows(MissingConnectivityError.class,
                () -> BoundsSynthesizer.cornersFromCenters(new double[]{0, 1}, new double[]{0, 1}, 1, 2));
    }

    @Test
    @DisplayName("Las esquinas curvilíneas de una malla regular coinciden con sus aristas")
    void cornersFromCenters_shouldReproduceRegularGrid() {
        // --- 1. ARRANGE --- centros 2x2 de una malla de 1° en [0,2]x[0,2]
        double[] lat = {0.5, 0.5, 1.5, 1.5};
        double[] lon = {0.5, 1.5, 0.5, 1.5};

        // --- 2. ACT ---
        double[][] corners = BoundsSynthesizer.cornersFromCenters(lat, lon, 2, 2);

        // --- 3. ASSERT ---
        assertThat(corners[0]).hasSize(9);
        for (int j = 0; j <= 2; j++) {
            for (int i = 0; i <= 2; i++) {
                assertThat(corners[0][j * 3 + i]).isCloseTo(j, within(1e-12));
                assertThat(corners[1][j * 3 + i]).isCloseTo(i, within(1e-12));
            }
        }
    }

    @Test
    @DisplayName("Las esquinas no se rompen cuando la malla cruza el meridiano 0/360")
    void cornersFromCenters_shouldUnwrapLongitudes() {
        double[] lat = {0.5, 0.5, 1.5, 1.5};
        double[] lon = {359.5, 0.5, 359.5, 0.5};

        double[][] corners = BoundsSynthesizer.cornersFromCenters(lat, lon, 2, 2);

        // La esquina central queda en el meridiano, no a mitad de camino (180°)
        assertThat(corners[1][4]).isCloseTo(360.0, within(1e-12));
    }
}
