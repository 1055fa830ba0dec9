package xregrid.service;

import lombok.Builder;
import xregrid.domain.operator.RegridMethod;
import xregrid.domain.operator.RegridOperator;

/**
 * Diagnóstico de un operador: cobertura de la malla destino y distribución de la suma de pesos.
 *
 * @param unmappedCount    Celdas destino sin ningún peso.
 * @param unmappedFraction Fracción de celdas destino sin pesos.
 * @param weightSumMin     Suma de pesos mínima entre las filas con pesos (NaN si no hay ninguna).
 * @param weightSumMax     Suma de pesos máxima entre las filas con pesos.
 * @param weightSumMean    Suma de pesos media entre las filas con pesos.
 * @param nSource          Celdas fuente.
 * @param nTarget          Celdas destino.
 * @param nWeights         Entradas no nulas del operador.
 * @param method           Método de interpolación.
 * @param periodic         Periodicidad usada.
 */
@Builder
public record QualityReport(int unmappedCount,
                            double unmappedFraction,
                            double weightSumMin,
                            double weightSumMax,
                            double weightSumMean,
                            int nSource,
                            int nTarget,
                            int nWeights,
                            RegridMethod method,
                            boolean periodic) {

    public static QualityReport of(RegridOperator operator) {
        double[] sums = operator.rowSums();
        boolean[] mapped = operator.mappedRows();
        int unmapped = 0;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        double total = 0;
        for (int t = 0; t < sums.length; t++) {
            if (!mapped[t]) {
                unmapped++;
                continue;
            }
            min = Math.min(min, sums[t]);
            max = Math.max(max, sums[t]);
            total += sums[t];
        }
        int mappedCount = sums.length - unmapped;
        return QualityReport.builder()
                .unmappedCount(unmapped)
                .unmappedFraction((double) unmapped / sums.length)
                .weightSumMin(mappedCount == 0 ? Double.NaN : min)
                .weightSumMax(mappedCount == 0 ? Double.NaN : max)
                .weightSumMean(mappedCount == 0 ? Double.NaN : total / mappedCount)
                .nSource(operator.getNSource())
                .nTarget(operator.getNTarget())
                .nWeights(operator.nnz())
                .method(operator.getMethod())
                .periodic(operator.isPeriodic())
                .build();
    }

    @Override
    public String toString() {
        return String.format("QualityReport[method=%s, periodic=%s, n_src=%d, n_dst=%d, n_weights=%d, "
                        + "unmapped=%d (%.2f%%), weight_sum=[%.6f, %.6f], mean=%.6f]",
                method, periodic, nSource, nTarget, nWeights, unmappedCount, unmappedFraction * 100.0,
                weightSumMin, weightSumMax, weightSumMean);
    }
}
