package xregrid.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import xregrid.domain.operator.RegridMethod;
import xregrid.domain.operator.RegridOperator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class QualityReportTest {

    @Test
    @DisplayName("El informe cuenta las filas sin pesos y resume las sumas de las filas con pesos")
    void of_shouldSummariseCoverageAndWeightSums() {
        // --- 1. ARRANGE ---
        RegridOperator operator = RegridOperator.builder()
                .rows(new int[]{0, 0, 1})
                .cols(new int[]{0, 1, 1})
                .weights(new double[]{0.5, 0.5, 0.8})
                .nTarget(3).nSource(2)
                .method(RegridMethod.CONSERVATIVE)
                .periodic(true)
                .build();

        // --- 2. ACT ---
        QualityReport report = QualityReport.of(operator);

        // --- 3. ASSERT ---
        assertThat(report.unmappedCount()).isEqualTo(1);
        assertThat(report.unmappedFraction()).isCloseTo(1.0 / 3.0, within(1e-12));
        assertThat(report.weightSumMin()).isCloseTo(0.8, within(1e-12));
        assertThat(report.weightSumMax()).isCloseTo(1.0, within(1e-12));
        assertThat(report.weightSumMean()).isCloseTo(0.9, within(1e-12));
        assertThat(report.nWeights()).isEqualTo(3);
        assertThat(report.method()).isEqualTo(RegridMethod.CONSERVATIVE);
        assertThat(report.periodic()).isTrue();
        assertThat(report.toString()).contains("unmapped=1", "method=conservative");
    }

    @Test
    @DisplayName("Un operador sin pesos da sumas NaN y cobertura nula")
    void of_emptyOperator_shouldReportNaNSums() {
        RegridOperator operator = RegridOperator.builder()
                .rows(new int[0]).cols(new int[0]).weights(new double[0])
                .nTarget(4).nSource(2)
                .method(RegridMethod.BILINEAR)
                .build();

        QualityReport report = QualityReport.of(operator);

        assertThat(report.unmappedCount()).isEqualTo(4);
        assertThat(report.unmappedFraction()).isEqualTo(1.0);
        assertThat(report.weightSumMin()).isNaN();
        assertThat(report.weightSumMean()).isNaN();
    }
}
