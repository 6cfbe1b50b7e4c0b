package com.tlsearch.index;

public final class VectorMath {
    private VectorMath() {
    }

    /**
     * Cosine similarity in [-1, 1], accumulated in double precision. A zero-norm vector scores 0.
     *
     * @throws IllegalArgumentException when the vectors differ in dimension
     */
    public static double cosine(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("dimension mismatch: %d vs %d".formatted(a.length, b.length));
        }
        double dot = 0d;
        double aNorm = 0d;
        double bNorm = 0d;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            aNorm += (double) a[i] * a[i];
            bNorm += (double) b[i] * b[i];
        }
        if (aNorm == 0d || bNorm == 0d) {
            return 0d;
        }
        double cosine = dot / (Math.sqrt(aNorm) * Math.sqrt(bNorm));
        return Math.max(-1d, Math.min(1d, cosine));
    }
}
