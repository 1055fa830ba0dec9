package xregrid.cache;

import lombok.Builder;
import xregrid.domain.operator.ExtrapMethod;
import xregrid.domain.operator.Extrapolation;
import xregrid.domain.operator.RegridMethod;
import xregrid.domain.operator.RegridOperator;

/**
 * Documento JSON de un operador persistido.
 *
 * @param schemaVersion Versión del formato. Una versión distinta de {@link #SCHEMA_VERSION} no se carga.
 * @param fingerprint   Huella de las mallas y el método que produjeron el operador.
 * @param method        Método de interpolación.
 * @param periodic      Periodicidad usada al generar.
 * @param nSource       Celdas fuente (columnas).
 * @param nTarget       Celdas destino (filas).
 * @param sourceShape   Forma espacial fuente.
 * @param targetShape   Forma espacial destino.
 * @param rows          Índices de fila de los tripletes.
 * @param cols          Índices de columna de los tripletes.
 * @param weights       Pesos.
 * @param extrapMethod       Extrapolación usada al generar. Ausente en documentos antiguos = {@code none}.
 * @param extrapDistExponent Exponente de distancia de {@code nearest_idw}.
 */
@Builder
public record PersistedOperator(int schemaVersion,
                                String fingerprint,
                                RegridMethod method,
                                boolean periodic,
                                int nSource,
                                int nTarget,
                                int[] sourceShape,
                                int[] targetShape,
                                int[] rows,
                                int[] cols,
                                double[] weights,
                                ExtrapMethod extrapMethod,
                                double extrapDistExponent) {

    public static final int SCHEMA_VERSION = 1;

    public static PersistedOperator from(RegridOperator operator) {
        return PersistedOperator.builder()
                .schemaVersion(SCHEMA_VERSION)
                .fingerprint(operator.getFingerprint())
                .method(operator.getMethod())
                .periodic(operator.isPeriodic())
                .nSource(operator.getNSource())
                .nTarget(operator.getNTarget())
                .sourceShape(operator.getSourceShape())
                .targetShape(operator.getTargetShape())
                .rows(operator.getRows())
                .cols(operator.getCols())
                .weights(operator.getWeights())
                .extrapMethod(operator.getExtrapolation().method())
                .extrapDistExponent(operator.getExtrapolation().distExponent())
                .build();
    }

    public RegridOperator toOperator() {
        return RegridOperator.builder()
                .rows(rows)
                .cols(cols)
                .weights(weights)
                .nSource(nSource)
                .nTarget(nTarget)
                .sourceShape(sourceShape)
                .targetShape(targetShape)
                .method(method)
                .periodic(periodic)
                .fingerprint(fingerprint)
                .extrapolation(extrapolation())
                .build();
    }

    private Extrapolation extrapolation() {
        if (extrapMethod == null || extrapMethod == ExtrapMethod.NONE) {
            return Extrapolation.DISABLED;
        }
        return extrapDistExponent > 0
                ? new Extrapolation(extrapMethod, extrapDistExponent)
                : Extrapolation.of(extrapMethod);
    }
}
