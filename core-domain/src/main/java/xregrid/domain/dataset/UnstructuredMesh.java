package xregrid.domain.dataset;

import lombok.Builder;

import java.util.List;
import java.util.Objects;

/**
 * Malla no estructurada que expone su topología directamente (sin pasar por convenciones
 * de nombres). Coordenadas en grados, conectividad base 0.
 * <p>
 * Si no se indican centros de cara se usan los centroides de sus nodos.
 */
public final class UnstructuredMesh implements HasConnectivity {

    private final double[] nodeLon;
    private final double[] nodeLat;
    private final int[][] faceNodes;
    private final double[] faceLon;
    private final double[] faceLat;
    private final String faceDimension;

    @Builder
    public UnstructuredMesh(double[] nodeLon, double[] nodeLat, int[][] faceNodes,
                            double[] faceLon, double[] faceLat, String faceDimension) {
        Objects.requireNonNull(nodeLon, "Las longitudes de nodo no pueden ser nulas.");
        Objects.requireNonNull(nodeLat, "Las latitudes de nodo no pueden ser nulas.");
        Objects.requireNonNull(faceNodes, "La conectividad no puede ser nula.");
        if (nodeLon.length != nodeLat.length) {
            throw new IllegalArgumentException("Las coordenadas de nodo deben tener la misma longitud.");
        }
        this.nodeLon = nodeLon.clone();
        this.nodeLat = nodeLat.clone();
        this.faceNodes = new int[faceNodes.length][];
        for (int f = 0; f < faceNodes.length; f++) {
            this.faceNodes[f] = faceNodes[f].clone();
        }
        if (faceLon == null || faceLat == null) {
            this.faceLon = new double[faceNodes.length];
            this.faceLat = new double[faceNodes.length];
            for (int f = 0; f < faceNodes.length; f++) {
                double sumLon = 0;
                double sumLat = 0;
                double refLon = nodeLon[faceNodes[f][0]];
                for (int node : faceNodes[f]) {
                    double lon = nodeLon[node];
                    // Centroide coherente a través del meridiano 0/360
                    while (lon - refLon > 180) lon -= 360;
                    while (lon - refLon < -180) lon += 360;
                    sumLon += lon;
                    sumLat += nodeLat[node];
                }
                this.faceLon[f] = sumLon / faceNodes[f].length;
                this.faceLat[f] = sumLat / faceNodes[f].length;
            }
        } else {
            if (faceLon.length != faceNodes.length || faceLat.length != faceNodes.length) {
                throw new IllegalArgumentException("Los centros de cara deben tener una entrada por cara.");
            }
            this.faceLon = faceLon.clone();
            this.faceLat = faceLat.clone();
        }
        this.faceDimension = faceDimension == null ? "n_face" : faceDimension;
    }

    @Override
    public double[] nodeLon() {
        return nodeLon.clone();
    }

    @Override
    public double[] nodeLat() {
        return nodeLat.clone();
    }

    @Override
    public int[][] faceNodes() {
        int[][] copy = new int[faceNodes.length][];
        for (int f = 0; f < faceNodes.length; f++) {
            copy[f] = faceNodes[f].clone();
        }
        return copy;
    }

    @Override
    public double[] faceLon() {
        return faceLon.clone();
    }

    @Override
    public double[] faceLat() {
        return faceLat.clone();
    }

    public String faceDimension() {
        return faceDimension;
    }

    public int faceCount() {
        return faceNodes.length;
    }

    @Override
    public List<String> coordinateNames() {
        return List.of("nodeLon", "nodeLat", "faceLon", "faceLat");
    }
}
