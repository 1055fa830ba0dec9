package xregrid.domain.dataset;

import java.util.List;

/**
 * Par de ejes 1-D desnudos (sin dataset alrededor), en grados.
 * Útil para describir una malla destino a partir de una resolución.
 */
public record LatLonAxes(double[] latitudes, double[] longitudes) implements Has1DCoords {

    public LatLonAxes {
        latitudes = latitudes.clone();
        longitudes = longitudes.clone();
    }

    @Override
    public double[] latitudes() {
        return latitudes.clone();
    }

    @Override
    public double[] longitudes() {
        return longitudes.clone();
    }

    @Override
    public List<String> coordinateNames() {
        return List.of("lat", "lon");
    }
}
