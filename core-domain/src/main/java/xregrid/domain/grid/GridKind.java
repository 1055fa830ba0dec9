package xregrid.domain.grid;

/**
 * Familias de discretización espacial soportadas.
 */
public enum GridKind {
    /** Ejes 1-D independientes de latitud y longitud. */
    RECTILINEAR,
    /** Coordenadas 2-D que comparten dimensiones (ej: rejillas oceánicas rotadas). */
    CURVILINEAR,
    /** Malla de polígonos arbitrarios con conectividad celda → vértices. */
    UNSTRUCTURED
}
