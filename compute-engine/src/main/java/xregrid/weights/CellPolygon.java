package xregrid.weights;

/**
 * Elemento poligonal convexo entregado al backend conservativo.
 * Puede ser la celda completa o uno de los triángulos en los que se dividió.
 *
 * @param parent          Índice de la celda de la que procede.
 * @param lon             Longitudes de los vértices (desenrolladas, en grados).
 * @param lat             Latitudes de los vértices (en grados).
 * @param parentFraction  Fracción del área de la celda que cubre este elemento (1 si no se dividió).
 */
public record CellPolygon(int parent, double[] lon, double[] lat, double parentFraction) {

    public CellPolygon {
        if (lon.length != lat.length || lon.length < 3) {
            throw new IllegalArgumentException(String.format(
                    "Polígono de la celda %d inválido: %d longitudes, %d latitudes.", parent, lon.length, lat.length));
        }
        lon = lon.clone();
        lat = lat.clone();
    }

    public int vertexCount() {
        return lon.length;
    }
}
