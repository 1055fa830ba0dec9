package xregrid.cache;

import xregrid.domain.grid.CanonicalGrid;
import xregrid.domain.operator.Extrapolation;
import xregrid.domain.operator.RegridMethod;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Huella SHA-256 que identifica un operador: cualquier cambio en la geometría de las mallas
 * (tipo, forma, centros, esquinas, conectividad, máscara), el método, la periodicidad, la
 * extrapolación o la versión del esquema persistido produce una huella distinta.
 */
public final class GridFingerprinter {

    private GridFingerprinter() {
    }

    public static String fingerprint(CanonicalGrid source, CanonicalGrid target, RegridMethod method, boolean periodic) {
        return fingerprint(source, target, method, periodic, Extrapolation.DISABLED);
    }

    public static String fingerprint(CanonicalGrid source, CanonicalGrid target, RegridMethod method, boolean periodic,
                                     Extrapolation extrapolation) {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 no disponible en esta JVM.", e);
        }
        update(digest, "schema=" + PersistedOperator.SCHEMA_VERSION);
        update(digest, "method=" + method.getExternalName());
        update(digest, "periodic=" + periodic);
        update(digest, (extrapolation == null ? Extrapolation.DISABLED : extrapolation).describe());
        digestGrid(digest, "source", source);
        digestGrid(digest, "target", target);
        return bytesToHex(digest.digest());
    }

    private static void digestGrid(MessageDigest digest, String side, CanonicalGrid grid) {
        update(digest, side + ".kind=" + grid.getKind());
        int[] shape = grid.spatialShape();
        digest.update(intBytes(shape));
        update(digest, side + ".centerLat");
        digest.update(doubleBytes(grid.getCenterLat()));
        update(digest, side + ".centerLon");
        digest.update(doubleBytes(grid.getCenterLon()));
        if (grid.getCornerLat() != null) {
            update(digest, side + ".cornerLat");
            digest.update(doubleBytes(grid.getCornerLat()));
            update(digest, side + ".cornerLon");
            digest.update(doubleBytes(grid.getCornerLon()));
        }
        if (grid.hasConnectivity()) {
            update(digest, side + ".connectivity");
            for (int[] cell : grid.getConnectivity()) {
                digest.update(intBytes(new int[]{cell.length}));
                digest.update(intBytes(cell));
            }
        }
        if (grid.hasMask()) {
            update(digest, side + ".mask");
            boolean[] mask = grid.getMask();
            byte[] bytes = new byte[mask.length];
            for (int i = 0; i < mask.length; i++) {
                bytes[i] = (byte) (mask[i] ? 1 : 0);
            }
            digest.update(bytes);
        }
    }

    private static void update(MessageDigest digest, String token) {
        digest.update(token.getBytes(StandardCharsets.UTF_8));
        digest.update((byte) 0);
    }

    private static byte[] doubleBytes(double[] values) {
        ByteBuffer buffer = ByteBuffer.allocate(values.length * Double.BYTES);
        for (double v : values) {
            buffer.putDouble(v);
        }
        return buffer.array();
    }

    private static byte[] intBytes(int[] values) {
        ByteBuffer buffer = ByteBuffer.allocate(values.length * Integer.BYTES);
        for (int v : values) {
            buffer.putInt(v);
        }
        return buffer.array();
    }

    private static String bytesToHex(byte[] hash) {
        StringBuilder hexString = new StringBuilder(2 * hash.length);
        for (int i = 0; i < hash.length; i++) {
            String hex = Integer.toHexString(0xff & hash[i]);
            if (hex.length() == 1) {
                hexString.append('0');
            }
            hexString.append(hex);
        }
        return hexString.toString();
    }
}
