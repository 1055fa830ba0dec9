package xregrid.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import xregrid.domain.exception.UnsupportedMethodError;
import xregrid.domain.operator.ExtrapMethod;
import xregrid.domain.operator.Extrapolation;
import xregrid.domain.operator.RegridMethod;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RegridConfigTest {

    @Test
    @DisplayName("La configuración por defecto es bilinear, secuencial y con periodicidad automática")
    void getDefault_shouldBeSequentialBilinear() {
        RegridConfig config = RegridConfig.getDefault();

        assertThat(config.method()).isEqualTo(RegridMethod.BILINEAR);
        assertThat(config.periodic()).isNull();
        assertThat(config.isParallel()).isFalse();
        assertThat(config.effectivePatchNeighbours()).isEqualTo(8);
    }

    @Test
    @DisplayName("Los valores efectivos sustituyen a los no configurados")
    void effectiveValues_shouldFallBackWhenUnset() {
        RegridConfig config = RegridConfig.builder().workerCount(4).build();

        assertThat(config.method()).isEqualTo(RegridMethod.BILINEAR);
        assertThat(config.isParallel()).isTrue();
        assertThat(config.effectiveChunkSize()).isEqualTo(16);
        assertThat(config.effectivePartitionCount()).isEqualTo(4);
        assertThat(config.withPatchNeighbours(2).effectivePatchNeighbours()).isEqualTo(8);
    }

    @Test
    @DisplayName("Los parámetros de ejecución negativos se rechazan")
    void constructor_shouldRejectNegativeValues() {
        assertThrows(IllegalArgumentException.class, () -> RegridConfig.builder().chunkSize(-1).build());
    }

    @Test
    @DisplayName("Sin extrapolación configurada el exponente toma el valor por defecto")
    void extrapolation_shouldDefaultToDisabled() {
        RegridConfig config = RegridConfig.builder().build();

        assertThat(config.extrapMethod()).isEqualTo(ExtrapMethod.NONE);
        assertThat(config.extrapolation()).isEqualTo(Extrapolation.DISABLED);
        assertThat(RegridConfig.getDefault().extrapolation().isEnabled()).isFalse();
        assertThat(config.withExtrapMethod(ExtrapMethod.NEAREST_IDW).withExtrapDistExponent(3.0).extrapolation())
                .isEqualTo(new Extrapolation(ExtrapMethod.NEAREST_IDW, 3.0));
    }

    @Test
    @DisplayName("Un método de extrapolación desconocido o un exponente negativo se rechazan")
    void extrapolation_shouldRejectInvalidSettings() {
        UnsupportedMethodError error = assertThrows(UnsupportedMethodError.class,
                () -> ExtrapMethod.fromName("creep_fill"));

        assertThat(error.getMessage()).contains("creep_fill", "nearest_idw");
        assertThat(ExtrapMethod.fromName("NEAREST_S2D")).isEqualTo(ExtrapMethod.NEAREST_S2D);
        assertThat(ExtrapMethod.fromName(null)).isEqualTo(ExtrapMethod.NONE);
        assertThrows(IllegalArgumentException.class, () -> RegridConfig.builder().extrapDistExponent(-1.0).build());
    }
}
