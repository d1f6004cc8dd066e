/*
 * Copyright 2026 Mark Andrew Ray-Smith
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
 */
package dev.mars.framelog.cas;

import java.security.MessageDigest;
import java.util.Arrays;
import java.util.Base64;
import java.util.HexFormat;

/**
 * Content digest in Subresource-Integrity form: {@code sha256-<base64>}.
 * <p>
 * Equal content always yields an equal {@code Integrity}, which is what makes
 * the content store addressable by it.
 */
public final class Integrity {

    public static final String SHA256 = "sha256";

    private static final int SHA256_LENGTH = 32;

    private final String algorithm;
    private final byte[] digest;

    private Integrity(String algorithm, byte[] digest) {
        this.algorithm = algorithm;
        this.digest = digest;
    }

    /**
     * Wraps a finished SHA-256 digest.
     */
    public static Integrity sha256(byte[] digest) {
        if (digest == null || digest.length != SHA256_LENGTH) {
            throw new IllegalArgumentException("SHA-256 digest must be " + SHA256_LENGTH + " bytes");
        }
        return new Integrity(SHA256, digest.clone());
    }

    /**
     * Computes the integrity of a complete buffer.
     */
    public static Integrity of(byte[] content) {
        return sha256(newDigest().digest(content));
    }

    /**
     * Parses {@code <algorithm>-<base64 digest>}.
     *
     * @throws IllegalArgumentException if the text is malformed or the algorithm unsupported
     */
    public static Integrity parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Integrity must not be null");
        }
        int dash = text.indexOf('-');
        if (dash <= 0) {
            throw new IllegalArgumentException("Malformed integrity: '" + text + "'");
        }
        String algorithm = text.substring(0, dash);
        if (!SHA256.equals(algorithm)) {
            throw new IllegalArgumentException("Unsupported integrity algorithm: " + algorithm);
        }
        byte[] digest;
        try {
            digest = Base64.getDecoder().decode(text.substring(dash + 1));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Malformed integrity: '" + text + "'", e);
        }
        return sha256(digest);
    }

    static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (java.security.NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public String algorithm() {
        return algorithm;
    }

    public byte[] digest() {
        return digest.clone();
    }

    /** Lower-case hex of the digest, used to lay content out on disk. */
    public String hex() {
        return HexFormat.of().formatHex(digest);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Integrity)) {
            return false;
        }
        Integrity other = (Integrity) o;
        return algorithm.equals(other.algorithm) && Arrays.equals(digest, other.digest);
    }

    @Override
    public int hashCode() {
        return 31 * algorithm.hashCode() + Arrays.hashCode(digest);
    }

    @Override
    public String toString() {
        return algorithm + "-" + Base64.getEncoder().encodeToString(digest);
    }
}
