package xregrid.weights;

import xregrid.domain.grid.CanonicalGrid;
import xregrid.domain.operator.Extrapolation;
import xregrid.domain.operator.RegridMethod;

/**
 * Frontera con el motor geométrico que calcula los pesos.
 * <p>
 * El motor de generación lo trata como una caja negra: recibe las dos geometrías y el método,
 * devuelve tripletes dispersos o lanza una excepción. Esta interfaz permite sustituirlo por
 * un doble de pruebas que devuelva tripletes predefinidos.
 * <p>
 * Convención de índices: para el método conservativo, filas y columnas indexan los elementos
 * poligonales de {@link GeometryPair#targetElements()} y {@link GeometryPair#sourceElements()};
 * para el resto de métodos indexan directamente celdas destino y fuente.
 */
public interface WeightBackend {

    /**
     * @return Tripletes de pesos. Para métodos no conservativos solo se devuelven filas
     * dentro de {@link GeometryPair#targetRows()}.
     * @throws RuntimeException si la geometría o la configuración no son válidas.
     */
    WeightTriplets compute(GeometryPair geometry, RegridMethod method);

    /**
     * Pesos de relleno para celdas destino que el método principal dejó sin entradas.
     *
     * @param unmappedRows Celdas destino (índices planos) no enmascaradas y sin pesos.
     * @return Tripletes cuyas filas son un subconjunto de {@code unmappedRows}, indexando celdas.
     */
    WeightTriplets extrapolate(CanonicalGrid source, CanonicalGrid target, int[] unmappedRows,
                               Extrapolation extrapolation);
}
