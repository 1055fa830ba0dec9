package xregrid.weights.impl;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Árbol k-d sobre vectores unitarios 3-D para búsquedas de vecino más próximo por distancia
 * de gran círculo (la cuerda es monótona con el ángulo).
 * <p>
 * Los empates (distancias iguales salvo {@link #TIE_EPSILON}) se resuelven a favor del
 * índice más bajo, de modo que el resultado no depende del orden interno del árbol.
 * Inmutable tras la construcción.
 */
final class UnitSphereIndex {

    static final double TIE_EPSILON = 1e-12;

    private final double[][] points;
    private final int[] indices;
    private final Node root;

    private record Node(int point, int axis, Node left, Node right) {
    }

    private record Candidate(int index, double distance) {
    }

    /**
     * @param lat      Latitudes en grados.
     * @param lon      Longitudes en grados.
     * @param excluded Puntos a omitir (máscara), o {@code null}.
     */
    UnitSphereIndex(double[] lat, double[] lon, boolean[] excluded) {
        List<Integer> kept = new ArrayList<>(lat.length);
        for (int i = 0; i < lat.length; i++) {
            if (excluded == null || !excluded[i]) {
                kept.add(i);
            }
        }
        this.indices = kept.stream().mapToInt(Integer::intValue).toArray();
        this.points = new double[indices.length][];
        for (int k = 0; k < indices.length; k++) {
            points[k] = toUnitVector(lat[indices[k]], lon[indices[k]]);
        }
        Integer[] order = new Integer[indices.length];
        for (int k = 0; k < order.length; k++) {
            order[k] = k;
        }
        this.root = build(order, 0, order.length, 0);
    }

    static double[] toUnitVector(double latDeg, double lonDeg) {
        double lat = Math.toRadians(latDeg);
        double lon = Math.toRadians(lonDeg);
        double cosLat = Math.cos(lat);
        return new double[]{cosLat * Math.cos(lon), cosLat * Math.sin(lon), Math.sin(lat)};
    }

    int size() {
        return indices.length;
    }

    private Node build(Integer[] order, int from, int to, int depth) {
        if (from >= to) {
            return null;
        }
        int axis = depth % 3;
        Arrays.sort(order, from, to, (a, b) -> Double.compare(points[a][axis], points[b][axis]));
        int mid = (from + to) >>> 1;
        return new Node(order[mid], axis,
                build(order, from, mid, depth + 1),
                build(order, mid + 1, to, depth + 1));
    }

    /**
     * @return Índice original del punto más próximo, o -1 si el índice está vacío.
     */
    int nearest(double latDeg, double lonDeg) {
        int[] found = nearest(latDeg, lonDeg, 1);
        return found.length == 0 ? -1 : found[0];
    }

    /**
     * @return Índices originales de los {@code k} puntos más próximos, del más cercano al más lejano.
     */
    int[] nearest(double latDeg, double lonDeg, int k) {
        if (root == null || k <= 0) {
            return new int[0];
        }
        double[] q = toUnitVector(latDeg, lonDeg);
        // Cola con el peor candidato en cabeza
        PriorityQueue<Candidate> best = new PriorityQueue<>((a, b) -> worse(a, b) ? -1 : worse(b, a) ? 1 : 0);
        search(root, q, k, best);
        List<Candidate> sorted = new ArrayList<>(best);
        sorted.sort((a, b) -> worse(a, b) ? 1 : worse(b, a) ? -1 : 0);
        return sorted.stream().mapToInt(c -> indices[c.index()]).toArray();
    }

    /**
     * a es peor que b: más lejos o, en empate, con índice original mayor.
     */
    private boolean worse(Candidate a, Candidate b) {
        if (a.distance() > b.distance() + TIE_EPSILON) {
            return true;
        }
        if (b.distance() > a.distance() + TIE_EPSILON) {
            return false;
        }
        return indices[a.index()] > indices[b.index()];
    }

    private void search(Node node, double[] q, int k, PriorityQueue<Candidate> best) {
        if (node == null) {
            return;
        }
        double[] p = points[node.point()];
        double dx = p[0] - q[0];
        double dy = p[1] - q[1];
        double dz = p[2] - q[2];
        Candidate candidate = new Candidate(node.point(), dx * dx + dy * dy + dz * dz);
        if (best.size() < k) {
            best.add(candidate);
        } else if (worse(best.peek(), candidate)) {
            best.poll();
            best.add(candidate);
        }

        double diff = q[node.axis()] - p[node.axis()];
        Node near = diff < 0 ? node.left() : node.right();
        Node far = diff < 0 ? node.right() : node.left();
        search(near, q, k, best);
        if (best.size() < k || diff * diff <= best.peek().distance() + TIE_EPSILON) {
            search(far, q, k, best);
        }
    }
}
