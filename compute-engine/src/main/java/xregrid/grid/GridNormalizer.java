package xregrid.grid;

import lombok.extern.slf4j.Slf4j;
import xregrid.domain.dataset.GridSource;
import xregrid.domain.exception.UnsupportedGridError;
import xregrid.domain.grid.CanonicalGrid;
import xregrid.domain.operator.RegridMethod;
import xregrid.grid.matcher.CurvilinearMatcher;
import xregrid.grid.matcher.GridMatcher;
import xregrid.grid.matcher.MeshObjectMatcher;
import xregrid.grid.matcher.ModelConventionMatcher;
import xregrid.grid.matcher.RectilinearMatcher;
import xregrid.grid.matcher.UgridMatcher;

import java.util.List;
import java.util.Objects;

/**
 * Convierte cualquier fuente de malla reconocida en una {@link CanonicalGrid}.
 * <p>
 * Prueba una cadena de {@link GridMatcher} en orden fijo de prioridad (objeto de malla, UGRID,
 * convenciones de modelo, rectilínea, curvilínea) y usa el primero que encaja. Sin efectos
 * secundarios: la entrada nunca se modifica.
 */
@Slf4j
public class GridNormalizer {

    private final List<GridMatcher> matchers;

    public GridNormalizer() {
        this(List.of(
                new MeshObjectMatcher(),
                new UgridMatcher(),
                new ModelConventionMatcher(),
                new RectilinearMatcher(),
                new CurvilinearMatcher()));
    }

    public GridNormalizer(List<GridMatcher> matchers) {
        this.matchers = List.copyOf(matchers);
    }

    public CanonicalGrid normalize(GridSource source) {
        return normalize(source, RegridMethod.BILINEAR);
    }

    /**
     * @param method Método previsto: decide si hay que sintetizar o exigir contornos de celda.
     * @throws UnsupportedGridError si ninguna convención encaja.
     */
    public CanonicalGrid normalize(GridSource source, RegridMethod method) {
        Objects.requireNonNull(source, "La fuente de malla no puede ser nula.");
        for (GridMatcher matcher : matchers) {
            if (matcher.matches(source)) {
                CanonicalGrid grid = matcher.extract(source, method);
                log.debug("Malla reconocida por '{}': {}", matcher.name(), grid);
                return grid;
            }
        }
        throw new UnsupportedGridError("No se reconoce ninguna convención de malla.", source.coordinateNames());
    }

    public List<GridMatcher> getMatchers() {
        return matchers;
    }
}
