package xregrid.cache;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import xregrid.TestGrids;
import xregrid.domain.grid.CanonicalGrid;
import xregrid.domain.operator.ExtrapMethod;
import xregrid.domain.operator.Extrapolation;
import xregrid.domain.operator.RegridMethod;

import static org.assertj.core.api.Assertions.assertThat;

class GridFingerprinterTest {

    private final CanonicalGrid source = TestGrids.rectilinear(-90, 90, 0, 360, 30);
    private final CanonicalGrid target = TestGrids.rectilinear(-90, 90, 0, 360, 45);

    @Test
    @DisplayName("La huella es estable para las mismas entradas y es un SHA-256 hexadecimal")
    void fingerprint_shouldBeDeterministic() {
        String first = GridFingerprinter.fingerprint(source, target, RegridMethod.BILINEAR, true);
        String second = GridFingerprinter.fingerprint(
                TestGrids.rectilinear(-90, 90, 0, 360, 30), TestGrids.rectilinear(-90, 90, 0, 360, 45),
                RegridMethod.BILINEAR, true);

        assertThat(first).isEqualTo(second).hasSize(64).matches("[0-9a-f]+");
    }

    @Test
    @DisplayName("Cambiar el método, la periodicidad, las coordenadas o la máscara cambia la huella")
    void fingerprint_shouldChangeWithAnyInput() {
        String base = GridFingerprinter.fingerprint(source, target, RegridMethod.BILINEAR, true);

        double[] shifted = source.getCenterLat();
        shifted[0] += 1e-9;
        CanonicalGrid moved = source.toBuilder().centerLat(shifted).build();
        boolean[] mask = new boolean[source.cellCount()];
        mask[3] = true;

        assertThat(GridFingerprinter.fingerprint(source, target, RegridMethod.PATCH, true)).isNotEqualTo(base);
        assertThat(GridFingerprinter.fingerprint(source, target, RegridMethod.BILINEAR, false)).isNotEqualTo(base);
        assertThat(GridFingerprinter.fingerprint(moved, target, RegridMethod.BILINEAR, true)).isNotEqualTo(base);
        assertThat(GridFingerprinter.fingerprint(source.withMask(mask), target, RegridMethod.BILINEAR, true))
                .isNotEqualTo(base);
        assertThat(GridFingerprinter.fingerprint(target, source, RegridMethod.BILINEAR, true)).isNotEqualTo(base);
    }

    @Test
    @DisplayName("La extrapolación forma parte de la huella")
    void fingerprint_shouldChangeWithExtrapolation() {
        String base = GridFingerprinter.fingerprint(source, target, RegridMethod.BILINEAR, true);

        String nearest = GridFingerprinter.fingerprint(source, target, RegridMethod.BILINEAR, true,
                Extrapolation.of(ExtrapMethod.NEAREST_S2D));
        String idw2 = GridFingerprinter.fingerprint(source, target, RegridMethod.BILINEAR, true,
                new Extrapolation(ExtrapMethod.NEAREST_IDW, 2.0));
        String idw3 = GridFingerprinter.fingerprint(source, target, RegridMethod.BILINEAR, true,
                new Extrapolation(ExtrapMethod.NEAREST_IDW, 3.0));

        assertThat(GridFingerprinter.fingerprint(source, target, RegridMethod.BILINEAR, true, Extrapolation.DISABLED))
                .isEqualTo(base);
        assertThat(nearest).isNotEqualTo(base);
        assertThat(idw2).isNotEqualTo(base).isNotEqualTo(nearest).isNotEqualTo(idw3);
    }
}
