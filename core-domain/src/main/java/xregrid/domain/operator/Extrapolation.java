package xregrid.domain.operator;

/**
 * Configuración de extrapolación que acompaña a un operador.
 *
 * @param method       Método de relleno. {@code null} equivale a {@link ExtrapMethod#NONE}.
 * @param distExponent Exponente de la distancia en {@link ExtrapMethod#NEAREST_IDW}. Debe ser positivo.
 */
public record Extrapolation(ExtrapMethod method, double distExponent) {

    public static final double DEFAULT_DIST_EXPONENT = 2.0;

    public static final Extrapolation DISABLED = new Extrapolation(ExtrapMethod.NONE, DEFAULT_DIST_EXPONENT);

    public Extrapolation {
        if (method == null) {
            method = ExtrapMethod.NONE;
        }
        if (!(distExponent > 0) || Double.isInfinite(distExponent)) {
            throw new IllegalArgumentException(String.format(
                    "El exponente de distancia de la extrapolación debe ser positivo y finito: %s", distExponent));
        }
    }

    public static Extrapolation of(ExtrapMethod method) {
        return new Extrapolation(method, DEFAULT_DIST_EXPONENT);
    }

    public boolean isEnabled() {
        return method != ExtrapMethod.NONE;
    }

    /**
     * Texto estable para huellas e historial, ej: {@code extrap_method=nearest_idw, extrap_dist_exponent=3.0}.
     */
    public String describe() {
        if (method != ExtrapMethod.NEAREST_IDW) {
            return "extrap_method=" + method.getExternalName();
        }
        return "extrap_method=" + method.getExternalName() + ", extrap_dist_exponent=" + distExponent;
    }
}
