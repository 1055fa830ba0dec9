package xregrid.domain.grid;

import lombok.Builder;
import lombok.Getter;

import java.util.Arrays;
import java.util.Objects;

/**
 * Representación normalizada de cualquier discretización espacial (origen o destino).
 * <p>
 * Es la fuente única de la verdad sobre la geometría de la malla una vez superada la
 * normalización: coordenadas siempre en grados, máscara con {@code true} = celda excluida,
 * y celdas indexadas en orden fila-mayor sobre {@link #spatialShape()}.
 * <ul>
 *     <li>RECTILINEAR: {@code centerLat} (nLat) y {@code centerLon} (nLon) son ejes 1-D;
 *     las esquinas son aristas 1-D de longitud n+1.</li>
 *     <li>CURVILINEAR: centros aplanados {@code ny*nx}; esquinas aplanadas {@code (ny+1)*(nx+1)}.</li>
 *     <li>UNSTRUCTURED: un centro por celda; las esquinas son los nodos y {@code connectivity}
 *     indica los nodos de cada celda.</li>
 * </ul>
 * Una vez instanciada no puede modificarse, así que se comparte sin riesgo entre workers.
 */
public final class CanonicalGrid {

    @Getter
    private final GridKind kind;
    private final double[] centerLat;
    private final double[] centerLon;
    private final double[] cornerLat;
    private final double[] cornerLon;
    private final int[][] connectivity;
    private final boolean[] mask;
    @Getter
    private final boolean periodic;
    private final int[] spatialShape;
    @Getter
    private final GridDescriptor descriptor;

    @Builder(toBuilder = true)
    public CanonicalGrid(GridKind kind,
                         double[] centerLat,
                         double[] centerLon,
                         double[] cornerLat,
                         double[] cornerLon,
                         int[][] connectivity,
                         boolean[] mask,
                         boolean periodic,
                         int[] spatialShape,
                         GridDescriptor descriptor) {
        Objects.requireNonNull(kind, "El tipo de malla no puede ser nulo.");
        Objects.requireNonNull(centerLat, "Los centros de latitud no pueden ser nulos.");
        Objects.requireNonNull(centerLon, "Los centros de longitud no pueden ser nulos.");
        if ((cornerLat == null) != (cornerLon == null)) {
            throw new IllegalArgumentException("Las esquinas de latitud y longitud deben venir juntas.");
        }

        int[] shape;
        switch (kind) {
            case RECTILINEAR -> {
                requireStrictlyMonotonic(centerLat, "latitud");
                requireStrictlyMonotonic(centerLon, "longitud");
                shape = new int[]{centerLat.length, centerLon.length};
                if (cornerLat != null && (cornerLat.length != centerLat.length + 1
                        || cornerLon.length != centerLon.length + 1)) {
                    throw new IllegalArgumentException(String.format(
                            "Las aristas rectilíneas deben medir n+1: lat %d/%d, lon %d/%d",
                            cornerLat.length, centerLat.length, cornerLon.length, centerLon.length));
                }
                if (connectivity != null) {
                    throw new IllegalArgumentException("Una malla rectilínea no lleva conectividad.");
                }
            }
            case CURVILINEAR -> {
                if (centerLat.length != centerLon.length) {
                    throw new IllegalArgumentException("Los centros curvilíneos deben compartir forma.");
                }
                if (spatialShape == null || spatialShape.length != 2
                        || spatialShape[0] * spatialShape[1] != centerLat.length) {
                    throw new IllegalArgumentException(String.format(
                            "Forma curvilínea %s incompatible con %d centros.",
                            Arrays.toString(spatialShape), centerLat.length));
                }
                shape = spatialShape.clone();
                if (cornerLat != null) {
                    int expected = (shape[0] + 1) * (shape[1] + 1);
                    if (cornerLat.length != expected || cornerLon.length != expected) {
                        throw new IllegalArgumentException(String.format(
                                "Las esquinas curvilíneas deben tener (ny+1)*(nx+1) = %d valores.", expected));
                    }
                }
                if (connectivity != null) {
                    throw new IllegalArgumentException("Una malla curvilínea no lleva conectividad.");
                }
            }
            case UNSTRUCTURED -> {
                if (centerLat.length != centerLon.length) {
                    throw new IllegalArgumentException("Los centros no estructurados deben compartir longitud.");
                }
                shape = new int[]{centerLat.length};
                if (connectivity != null) {
                    if (cornerLat == null) {
                        throw new IllegalArgumentException("La conectividad requiere coordenadas de nodo.");
                    }
                    if (cornerLat.length != cornerLon.length) {
                        throw new IllegalArgumentException("Las coordenadas de nodo deben compartir longitud.");
                    }
                    if (connectivity.length != centerLat.length) {
                        throw new IllegalArgumentException(String.format(
                                "La conectividad tiene %d celdas pero hay %d centros.",
                                connectivity.length, centerLat.length));
                    }
                    for (int c = 0; c < connectivity.length; c++) {
                        if (connectivity[c].length < 3) {
                            throw new IllegalArgumentException(String.format(
                                    "La celda %d tiene %d vértices (mínimo 3).", c, connectivity[c].length));
                        }
                        for (int node : connectivity[c]) {
                            if (node < 0 || node >= cornerLat.length) {
                                throw new IllegalArgumentException(String.format(
                                        "La celda %d referencia el nodo %d fuera de rango [0, %d).",
                                        c, node, cornerLat.length));
                            }
                        }
                    }
                }
            }
            default -> throw new IllegalStateException("Tipo de malla no contemplado: " + kind);
        }

        int cellCount = 1;
        for (int s : shape) {
            cellCount *= s;
        }
        if (mask != null && mask.length != cellCount) {
            throw new IllegalArgumentException(String.format(
                    "La máscara tiene %d valores pero la malla %d celdas.", mask.length, cellCount));
        }

        this.kind = kind;
        this.centerLat = centerLat.clone();
        this.centerLon = centerLon.clone();
        this.cornerLat = cornerLat == null ? null : cornerLat.clone();
        this.cornerLon = cornerLon == null ? null : cornerLon.clone();
        if (connectivity == null) {
            this.connectivity = null;
        } else {
            this.connectivity = new int[connectivity.length][];
            for (int c = 0; c < connectivity.length; c++) {
                this.connectivity[c] = connectivity[c].clone();
            }
        }
        this.mask = mask == null ? null : mask.clone();
        this.periodic = periodic;
        this.spatialShape = shape;
        this.descriptor = descriptor == null ? GridDescriptor.defaults(kind) : descriptor;
    }

    private static void requireStrictlyMonotonic(double[] axis, String name) {
        if (axis.length < 1) {
            throw new IllegalArgumentException("El eje de " + name + " está vacío.");
        }
        if (axis.length == 1) {
            return;
        }
        boolean increasing = axis[1] > axis[0];
        for (int i = 0; i < axis.length - 1; i++) {
            boolean ok = increasing ? axis[i + 1] > axis[i] : axis[i + 1] < axis[i];
            if (!ok) {
                throw new IllegalArgumentException(String.format(
                        "El eje de %s no es estrictamente monótono en el índice %d (%.6f -> %.6f).",
                        name, i, axis[i], axis[i + 1]));
            }
        }
    }

    // --- FORMA ---

    public int[] spatialShape() {
        return spatialShape.clone();
    }

    public int cellCount() {
        int n = 1;
        for (int s : spatialShape) {
            n *= s;
        }
        return n;
    }

    // --- CENTROS ---

    public double[] getCenterLat() {
        return centerLat.clone();
    }

    public double[] getCenterLon() {
        return centerLon.clone();
    }

    public double cellLat(int cell) {
        if (kind == GridKind.RECTILINEAR) {
            return centerLat[cell / centerLon.length];
        }
        return centerLat[cell];
    }

    public double cellLon(int cell) {
        if (kind == GridKind.RECTILINEAR) {
            return centerLon[cell % centerLon.length];
        }
        return centerLon[cell];
    }

    /**
     * Latitud del centro de cada celda en orden de aplanado. En mallas rectilíneas expande el
     * eje 1-D al producto {@code nLat × nLon}.
     */
    public double[] cellLats() {
        double[] out = new double[cellCount()];
        for (int c = 0; c < out.length; c++) {
            out[c] = cellLat(c);
        }
        return out;
    }

    public double[] cellLons() {
        double[] out = new double[cellCount()];
        for (int c = 0; c < out.length; c++) {
            out[c] = cellLon(c);
        }
        return out;
    }

    // --- ESQUINAS Y CONECTIVIDAD ---

    public boolean hasCorners() {
        return cornerLat != null && (kind != GridKind.UNSTRUCTURED || connectivity != null);
    }

    public double[] getCornerLat() {
        return cornerLat == null ? null : cornerLat.clone();
    }

    public double[] getCornerLon() {
        return cornerLon == null ? null : cornerLon.clone();
    }

    public boolean hasConnectivity() {
        return connectivity != null;
    }

    public int[][] getConnectivity() {
        if (connectivity == null) {
            return null;
        }
        int[][] copy = new int[connectivity.length][];
        for (int c = 0; c < connectivity.length; c++) {
            copy[c] = connectivity[c].clone();
        }
        return copy;
    }

    /**
     * Polígono de la celda como {@code {lons[], lats[]}} en el orden del contorno.
     * Las longitudes se desenrollan respecto al primer vértice para que la celda sea
     * continua aunque cruce el meridiano 0/360.
     *
     * @throws IllegalStateException si la malla no tiene esquinas.
     */
    public double[][] cellPolygon(int cell) {
        if (!hasCorners()) {
            throw new IllegalStateException("La malla " + kind + " no tiene esquinas de celda.");
        }
        double[] lons;
        double[] lats;
        switch (kind) {
            case RECTILINEAR -> {
                int nLon = centerLon.length;
                int iy = cell / nLon;
                int ix = cell % nLon;
                lons = new double[]{cornerLon[ix], cornerLon[ix + 1], cornerLon[ix + 1], cornerLon[ix]};
                lats = new double[]{cornerLat[iy], cornerLat[iy], cornerLat[iy + 1], cornerLat[iy + 1]};
            }
            case CURVILINEAR -> {
                int nx = spatialShape[1];
                int j = cell / nx;
                int i = cell % nx;
                int stride = nx + 1;
                int[] idx = {j * stride + i, j * stride + i + 1, (j + 1) * stride + i + 1, (j + 1) * stride + i};
                lons = new double[4];
                lats = new double[4];
                for (int k = 0; k < 4; k++) {
                    lons[k] = cornerLon[idx[k]];
                    lats[k] = cornerLat[idx[k]];
                }
            }
            default -> {
                int[] nodes = connectivity[cell];
                lons = new double[nodes.length];
                lats = new double[nodes.length];
                for (int k = 0; k < nodes.length; k++) {
                    lons[k] = cornerLon[nodes[k]];
                    lats[k] = cornerLat[nodes[k]];
                }
            }
        }
        for (int k = 1; k < lons.length; k++) {
            while (lons[k] - lons[0] > 180.0) lons[k] -= 360.0;
            while (lons[k] - lons[0] < -180.0) lons[k] += 360.0;
        }
        return new double[][]{lons, lats};
    }

    // --- MÁSCARA ---

    public boolean hasMask() {
        return mask != null;
    }

    public boolean isMasked(int cell) {
        return mask != null && mask[cell];
    }

    public boolean[] getMask() {
        return mask == null ? null : mask.clone();
    }

    public int maskedCount() {
        if (mask == null) {
            return 0;
        }
        int count = 0;
        for (boolean m : mask) {
            if (m) count++;
        }
        return count;
    }

    // --- DERIVADAS ---

    public CanonicalGrid withPeriodic(boolean newPeriodic) {
        return toBuilder().periodic(newPeriodic).build();
    }

    public CanonicalGrid withMask(boolean[] newMask) {
        return toBuilder().mask(newMask).build();
    }

    @Override
    public String toString() {
        return String.format("CanonicalGrid[%s, shape=%s, corners=%s, masked=%d, periodic=%s]",
                kind, Arrays.toString(spatialShape), hasCorners(), maskedCount(), periodic);
    }
}
