package xregrid.domain.operator;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import xregrid.domain.exception.UnsupportedMethodError;

import java.util.Arrays;
import java.util.Locale;

/**
 * Métodos de interpolación disponibles.
 * <p>
 * El nombre externo coincide con el que usan los ficheros de pesos y la línea de comandos.
 */
public enum RegridMethod {

    BILINEAR("bilinear", false),
    CONSERVATIVE("conservative", true),
    NEAREST_S2D("nearest_s2d", false),
    NEAREST_D2S("nearest_d2s", false),
    PATCH("patch", false);

    private final String externalName;
    private final boolean requiresCorners;

    RegridMethod(String externalName, boolean requiresCorners) {
        this.externalName = externalName;
        this.requiresCorners = requiresCorners;
    }

    @JsonValue
    public String getExternalName() {
        return externalName;
    }

    /**
     * @return true si el método necesita polígonos de celda (esquinas/vértices) en ambas mallas.
     */
    public boolean requiresCorners() {
        return requiresCorners;
    }

    public boolean isNearest() {
        return this == NEAREST_S2D || this == NEAREST_D2S;
    }

    @JsonCreator
    public static RegridMethod fromName(String name) {
        if (name == null) {
            throw new UnsupportedMethodError("El método de regridding no puede ser nulo.");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(m -> m.externalName.equals(normalized) || m.name().equalsIgnoreCase(normalized))
                .findFirst()
                .orElseThrow(() -> new UnsupportedMethodError(String.format(
                        "Método '%s' desconocido. Opciones: %s", name,
                        Arrays.stream(values()).map(RegridMethod::getExternalName).toList())));
    }

    @Override
    public String toString() {
        return externalName;
    }
}
