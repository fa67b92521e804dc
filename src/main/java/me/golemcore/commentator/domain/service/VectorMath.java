package me.golemcore.commentator.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

/**
 * Vector arithmetic for embedding comparison.
 */
public final class VectorMath {

    private VectorMath() {
    }

    /**
     * Cosine similarity {@code dot(a, b) / (|a| |b|)}. Returns 0 when either
     * vector has zero norm.
     *
     * @throws IllegalArgumentException
     *             if the vectors differ in length
     */
    public static double cosineSimilarity(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Vectors must have same length: " + a.length + " != " + b.length);
        }
        double normA = magnitude(a);
        double normB = magnitude(b);
        if (normA == 0 || normB == 0) {
            return 0.0;
        }
        return dotProduct(a, b) / (normA * normB);
    }

    public static double dotProduct(float[] a, float[] b) {
        double dot = 0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
        }
        return dot;
    }

    public static double magnitude(float[] v) {
        double sum = 0;
        for (float x : v) {
            sum += (double) x * x;
        }
        return Math.sqrt(sum);
    }
}
