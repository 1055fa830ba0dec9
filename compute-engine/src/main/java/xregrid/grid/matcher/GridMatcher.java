package xregrid.grid.matcher;

import xregrid.domain.dataset.GridSource;
import xregrid.domain.grid.CanonicalGrid;
import xregrid.domain.operator.RegridMethod;

/**
 * Par predicado + extractor de una convención de malla.
 * <p>
 * El normalizador prueba los matchers en un orden fijo de prioridad y se queda con el primero
 * cuyo {@link #matches(GridSource)} sea cierto. Ambos métodos son puros.
 */
public interface GridMatcher {

    /**
     * Nombre legible de la convención (para logs).
     */
    String name();

    boolean matches(GridSource source);

    /**
     * Construye la malla canónica. Solo se invoca si {@link #matches(GridSource)} fue cierto.
     *
     * @param method Método solicitado; decide si hay que sintetizar o exigir esquinas.
     */
    CanonicalGrid extract(GridSource source, RegridMethod method);
}
