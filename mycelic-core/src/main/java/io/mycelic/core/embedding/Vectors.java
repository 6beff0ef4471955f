package io.mycelic.core.embedding;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Vector math and the little-endian float32 BLOB encoding used for stored embeddings.
 */
public final class Vectors {

    private Vectors() {
    }

    public static byte[] encode(float[] vector) {
        ByteBuffer buffer = ByteBuffer.allocate(vector.length * Float.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        for (float value : vector) {
            buffer.putFloat(value);
        }
        return buffer.array();
    }

    public static float[] decode(byte[] blob) {
        if (blob == null || blob.length == 0) {
            return null;
        }
        if (blob.length % Float.BYTES != 0) {
            throw new IllegalArgumentException("embedding blob length " + blob.length + " is not a multiple of 4");
        }
        ByteBuffer buffer = ByteBuffer.wrap(blob).order(ByteOrder.LITTLE_ENDIAN);
        float[] vector = new float[blob.length / Float.BYTES];
        for (int i = 0; i < vector.length; i++) {
            vector[i] = buffer.getFloat();
        }
        return vector;
    }

    /**
     * Cosine similarity clamped to [0, 1]; zero when either vector is empty or the dimensions differ.
     */
    public static double cosine(float[] a, float[] b) {
        if (a == null || b == null || a.length == 0 || a.length != b.length) {
            return 0.0;
        }
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            normA += (double) a[i] * a[i];
            normB += (double) b[i] * b[i];
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        double cosine = dot / (Math.sqrt(normA) * Math.sqrt(normB));
        return Math.min(1.0, Math.max(0.0, cosine));
    }

    public static float[] normalize(float[] vector) {
        double norm = 0.0;
        for (float value : vector) {
            norm += (double) value * value;
        }
        if (norm == 0.0) {
            return vector;
        }
        double length = Math.sqrt(norm);
        float[] out = new float[vector.length];
        for (int i = 0; i < vector.length; i++) {
            out[i] = (float) (vector[i] / length);
        }
        return out;
    }
}
