package com.backend.artscan.util;

import java.util.Random;

/**
 * Vector helpers shared by the embedding gateway, the match engine and the catalog lease.
 */
public final class VectorMath {

    private VectorMath() {
    }

    /**
     * 1 - cosine similarity. Mismatched or zero-length inputs are maximally distant.
     */
    public static double cosineDistance(float[] a, float[] b) {
        if (a == null || b == null || a.length != b.length) {
            return 2.0;
        }
        double dot = 0, na = 0, nb = 0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            na += (double) a[i] * a[i];
            nb += (double) b[i] * b[i];
        }
        if (na == 0 || nb == 0) {
            return 2.0;
        }
        double distance = 1.0 - dot / Math.sqrt(na * nb);
        // rounding can push identical vectors slightly below zero
        return Math.max(0.0, distance);
    }

    public static double l2Norm(float[] v) {
        double sum = 0;
        for (float x : v) {
            sum += (double) x * x;
        }
        return Math.sqrt(sum);
    }

    /**
     * Returns a unit-length copy. Callers must reject zero vectors first.
     */
    public static float[] normalize(float[] v) {
        double norm = l2Norm(v);
        float[] out = new float[v.length];
        for (int i = 0; i < v.length; i++) {
            out[i] = (float) (v[i] / norm);
        }
        return out;
    }

    public static boolean allFinite(float[] v) {
        for (float x : v) {
            if (!Float.isFinite(x)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Sign pattern of the vector against {@code bits} seeded random hyperplanes, as a hex string.
     * Nearby vectors usually share a bucket; identical vectors always do.
     */
    public static String hyperplaneBucket(float[] v, int bits, long seed) {
        Random random = new Random(seed);
        long pattern = 0L;
        StringBuilder hex = new StringBuilder();
        for (int bit = 0; bit < bits; bit++) {
            double dot = 0;
            for (float x : v) {
                dot += x * random.nextGaussian();
            }
            if (dot >= 0) {
                pattern |= 1L << (bit % 64);
            }
            if (bit % 64 == 63 || bit == bits - 1) {
                hex.append(String.format("%016x", pattern));
                pattern = 0L;
            }
        }
        return hex.toString();
    }
}
