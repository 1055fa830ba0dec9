package xregrid.factory;

import lombok.extern.slf4j.Slf4j;
import xregrid.domain.dataset.DataVariable;
import xregrid.domain.dataset.GridDataset;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fábrica de datasets rectilíneos regulares (globales o regionales) listos para usarse
 * como malla destino.
 * <p>
 * Los centros se sitúan a media resolución del borde; si se piden límites, se añaden las
 * aristas como coordenadas {@code lat_b}/{@code lon_b} enlazadas con el atributo CF {@code bounds}.
 */
@Slf4j
public final class GridDatasetFactory {

    private static final DateTimeFormatter HISTORY_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private GridDatasetFactory() {
    }

    /**
     * Malla global {@code [-90, 90] × [0, 360]}.
     *
     * @param resLat    Resolución en latitud (grados, > 0).
     * @param resLon    Resolución en longitud (grados, > 0).
     * @param addBounds Añadir aristas de celda.
     */
    public static GridDataset createGlobalGrid(double resLat, double resLon, boolean addBounds) {
        GridDataset ds = buildGrid(-90.0, 90.0, 0.0, 360.0, resLat, resLon, addBounds);
        return withHistory(ds, String.format("Created global grid (%sx%s) using xregrid.", resLat, resLon));
    }

    public static GridDataset createGlobalGrid(double resLat, double resLon) {
        return createGlobalGrid(resLat, resLon, true);
    }

    /**
     * Malla regional.
     *
     * @param latRange {@code {minLat, maxLat}}.
     * @param lonRange {@code {minLon, maxLon}}.
     */
    public static GridDataset createRegionalGrid(double[] latRange, double[] lonRange,
                                                 double resLat, double resLon, boolean addBounds) {
        if (latRange == null || latRange.length != 2 || lonRange == null || lonRange.length != 2) {
            throw new IllegalArgumentException("Los rangos deben tener exactamente {min, max}.");
        }
        if (latRange[1] <= latRange[0] || lonRange[1] <= lonRange[0]) {
            throw new IllegalArgumentException("Los rangos deben ser crecientes (min < max).");
        }
        GridDataset ds = buildGrid(latRange[0], latRange[1], lonRange[0], lonRange[1], resLat, resLon, addBounds);
        return withHistory(ds, String.format("Created regional grid (%sx%s) using xregrid.", resLat, resLon));
    }

    private static GridDataset buildGrid(double minLat, double maxLat, double minLon, double maxLon,
                                         double resLat, double resLon, boolean addBounds) {
        if (resLat <= 0 || resLon <= 0) {
            throw new IllegalArgumentException("La resolución debe ser positiva.");
        }
        double[] lat = centers(minLat, maxLat, resLat);
        double[] lon = centers(minLon, maxLon, resLon);
        log.debug("Creando malla rectilínea {}x{} (res {}x{})", lat.length, lon.length, resLat, resLon);

        Map<String, Object> latAttrs = new LinkedHashMap<>();
        latAttrs.put("units", "degrees_north");
        latAttrs.put("standard_name", "latitude");
        Map<String, Object> lonAttrs = new LinkedHashMap<>();
        lonAttrs.put("units", "degrees_east");
        lonAttrs.put("standard_name", "longitude");

        if (!addBounds) {
            return GridDataset.of(
                    DataVariable.coordinate("lat", "lat", lat, latAttrs),
                    DataVariable.coordinate("lon", "lon", lon, lonAttrs));
        }

        latAttrs.put("bounds", "lat_b");
        lonAttrs.put("bounds", "lon_b");
        double[] latB = edges(minLat, resLat, lat.length);
        double[] lonB = edges(minLon, resLon, lon.length);
        return GridDataset.of(
                DataVariable.coordinate("lat", "lat", lat, latAttrs),
                DataVariable.coordinate("lon", "lon", lon, lonAttrs),
                DataVariable.coordinate("lat_b", "lat_b", latB, Map.of("units", "degrees_north")),
                DataVariable.coordinate("lon_b", "lon_b", lonB, Map.of("units", "degrees_east")));
    }

    private static double[] centers(double min, double max, double res) {
        double first = min + res / 2.0;
        int n = (int) Math.ceil((max - first) / res - 1e-9);
        if (n <= 0) {
            throw new IllegalArgumentException(String.format(
                    "La resolución %s es mayor que el rango [%s, %s].", res, min, max));
        }
        double[] values = new double[n];
        for (int i = 0; i < n; i++) {
            values[i] = first + i * res;
        }
        return values;
    }

    private static double[] edges(double min, double res, int cells) {
        double[] values = new double[cells + 1];
        for (int i = 0; i <= cells; i++) {
            values[i] = min + i * res;
        }
        return values;
    }

    /**
     * Antepone una línea fechada al atributo {@code history} del dataset.
     */
    public static GridDataset withHistory(GridDataset ds, String message) {
        Map<String, Object> attrs = new LinkedHashMap<>(ds.getAttributes());
        attrs.put("history", historyLine(message, ds.stringAttribute("history").orElse(null)));
        return ds.withAttributes(attrs);
    }

    /**
     * Construye el nuevo valor de {@code history}: la entrada más reciente va primero.
     */
    public static String historyLine(String message, String previous) {
        String line = LocalDateTime.now().format(HISTORY_FORMAT) + ": " + message;
        return previous == null || previous.isBlank() ? line : line + "\n" + previous;
    }

    /**
     * Lista de celdas de una malla global para una resolución dada, útil para dimensionar pruebas.
     */
    public static List<Integer> globalShape(double resLat, double resLon) {
        return List.of(centers(-90.0, 90.0, resLat).length, centers(0.0, 360.0, resLon).length);
    }
}
