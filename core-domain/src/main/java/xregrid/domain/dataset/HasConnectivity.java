package xregrid.domain.dataset;

/**
 * Capacidad: la fuente expone directamente su topología de malla no estructurada.
 * <p>
 * Todas las coordenadas en grados. Los índices de {@link #faceNodes()} son base 0.
 */
public interface HasConnectivity extends GridSource {

    double[] nodeLon();

    double[] nodeLat();

    /**
     * Conectividad cara → nodos, en el orden del contorno. Las filas pueden tener longitudes distintas.
     */
    int[][] faceNodes();

    double[] faceLon();

    double[] faceLat();
}
