package xregrid.domain.operator;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import xregrid.domain.exception.UnsupportedMethodError;

import java.util.Arrays;
import java.util.Locale;

/**
 * Relleno de las celdas destino que el método principal deja sin pesos.
 */
public enum ExtrapMethod {

    NONE("none"),
    /** Peso 1 desde la celda fuente más próxima. */
    NEAREST_S2D("nearest_s2d"),
    /** Inverso de la distancia elevado a un exponente sobre las fuentes más próximas. */
    NEAREST_IDW("nearest_idw");

    private final String externalName;

    ExtrapMethod(String externalName) {
        this.externalName = externalName;
    }

    @JsonValue
    public String getExternalName() {
        return externalName;
    }

    /**
     * @param name Nombre externo. {@code null} equivale a {@link #NONE}.
     */
    @JsonCreator
    public static ExtrapMethod fromName(String name) {
        if (name == null) {
            return NONE;
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(m -> m.externalName.equals(normalized) || m.name().equalsIgnoreCase(normalized))
                .findFirst()
                .orElseThrow(() -> new UnsupportedMethodError(String.format(
                        "Método de extrapolación '%s' desconocido. Opciones: %s", name,
                        Arrays.stream(values()).map(ExtrapMethod::getExternalName).toList())));
    }

    @Override
    public String toString() {
        return externalName;
    }
}
