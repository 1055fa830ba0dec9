package xregrid.domain.dataset;

/**
 * Capacidad: la fuente es directamente un par de ejes 1-D de latitud y longitud (en grados).
 */
public interface Has1DCoords extends GridSource {

    double[] latitudes();

    double[] longitudes();
}
