package de.anton.pv.solver.iv_solver.model;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 helpers for content fingerprints and result hashes.
 */
public final class HashUtils {

    private HashUtils() { throw new IllegalStateException("Utility class"); }

    public static String sha256Hex(byte[] data) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(data));
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public static String sha256Hex(String text) {
        return sha256Hex(text.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Fingerprint of sample arrays, used when a measurement comes without a
     * fingerprint of its raw bytes. Hashes the IEEE-754 bit patterns in order.
     */
    public static String fingerprintOf(double[] voltages, double[] currents) {
        ByteBuffer buffer = ByteBuffer.allocate(Double.BYTES * (voltages.length + currents.length));
        for (double v : voltages) buffer.putDouble(v);
        for (double i : currents) buffer.putDouble(i);
        return sha256Hex(buffer.array());
    }
}
