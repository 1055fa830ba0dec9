package xregrid.grid;

import lombok.extern.slf4j.Slf4j;
import xregrid.domain.grid.CanonicalGrid;
import xregrid.domain.grid.GridKind;

/**
 * Decide si la longitud de una malla es periódica cuando el usuario no lo indica.
 * <p>
 * Criterios: atributo {@code boundary = "periodic"} en la longitud o, para mallas rectilíneas,
 * un eje de longitud cuyo recorrido más un paso cubre los 360°. Las mallas curvilíneas y no
 * estructuradas solo se declaran periódicas por metadatos.
 */
@Slf4j
public final class PeriodicityDetector {

    private static final double TOLERANCE = 1e-6;

    private PeriodicityDetector() {
    }

    public static boolean resolve(Boolean requested, CanonicalGrid grid) {
        if (requested != null) {
            return requested;
        }
        boolean detected = detect(grid);
        log.debug("Periodicidad detectada automáticamente: {} ({})", detected, grid.getKind());
        return detected;
    }

    public static boolean detect(CanonicalGrid grid) {
        Object boundary = grid.getDescriptor().lonAttributes().get("boundary");
        if (boundary != null && "periodic".equalsIgnoreCase(boundary.toString().trim())) {
            return true;
        }
        if (grid.getKind() != GridKind.RECTILINEAR) {
            return false;
        }
        double[] lon = grid.getCenterLon();
        if (lon.length < 2) {
            return false;
        }
        double span = Math.abs(lon[lon.length - 1] - lon[0]);
        double step = span / (lon.length - 1);
        return span + step >= 360.0 - TOLERANCE;
    }
}
