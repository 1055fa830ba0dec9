package xregrid.weights;

import xregrid.domain.grid.CanonicalGrid;
import xregrid.domain.operator.RowRange;

import java.util.List;

/**
 * Geometrías origen y destino tal y como se entregan al backend.
 *
 * @param source          Malla origen normalizada.
 * @param target          Malla destino normalizada.
 * @param sourceElements  Polígonos convexos de las celdas fuente no enmascaradas (solo conservativo).
 * @param targetElements  Polígonos convexos de las celdas destino del rango (solo conservativo).
 * @param periodic        Longitud periódica en la malla origen.
 * @param targetRows      Rango de celdas destino a calcular.
 */
public record GeometryPair(CanonicalGrid source,
                           CanonicalGrid target,
                           List<CellPolygon> sourceElements,
                           List<CellPolygon> targetElements,
                           boolean periodic,
                           RowRange targetRows) {

    public GeometryPair {
        sourceElements = sourceElements == null ? List.of() : List.copyOf(sourceElements);
        targetElements = targetElements == null ? List.of() : List.copyOf(targetElements);
        targetRows = targetRows == null ? RowRange.all(target.cellCount()) : targetRows;
    }
}
