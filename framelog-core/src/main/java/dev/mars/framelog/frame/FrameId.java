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
package dev.mars.framelog.frame;

import java.math.BigInteger;
import java.nio.ByteBuffer;

/**
 * A 128-bit, time-ordered frame identifier.
 * <p>
 * <b>Layout (most significant bit first):</b>
 * <pre>
 *  48 bits  timestamp (Unix epoch millis)
 *  24 bits  counter_hi
 *  24 bits  counter_lo
 *  32 bits  entropy
 * </pre>
 * The canonical text form is 25 base-36 digits ({@code 0-9A-Z}). Text order,
 * byte order and {@link #compareTo} order are all the same, so identifiers
 * sort by creation time.
 * <p>
 * Identifiers are only ever minted by {@link FrameIdGenerator}.
 *
 * @param msb the upper 64 bits
 * @param lsb the lower 64 bits
 */
public record FrameId(long msb, long lsb) implements Comparable<FrameId> {

    /** Length of the canonical text form. */
    public static final int TEXT_LENGTH = 25;

    /** Length of the byte form. */
    public static final int BYTES = 16;

    private static final int RADIX = 36;
    private static final int MAX_BITS = 128;

    /**
     * Assembles an identifier from its fields.
     */
    public static FrameId of(long timestamp, int counterHi, int counterLo, int entropy) {
        long msb = (timestamp << 16) | ((counterHi & 0xFFFFFFL) >>> 8);
        long lsb = ((counterHi & 0xFFL) << 56)
                | ((counterLo & 0xFFFFFFL) << 32)
                | (entropy & 0xFFFFFFFFL);
        return new FrameId(msb, lsb);
    }

    /** Creation time in Unix epoch milliseconds. */
    public long timestamp() {
        return msb >>> 16;
    }

    public int counterHi() {
        return (int) (((msb & 0xFFFFL) << 8) | (lsb >>> 56));
    }

    public int counterLo() {
        return (int) ((lsb >>> 32) & 0xFFFFFFL);
    }

    public int entropy() {
        return (int) lsb;
    }

    /**
     * Returns the 16-byte big-endian representation.
     */
    public byte[] toBytes() {
        return ByteBuffer.allocate(BYTES).putLong(msb).putLong(lsb).array();
    }

    /**
     * Reads an identifier from its 16-byte big-endian representation.
     *
     * @throws IllegalArgumentException if {@code bytes} is not 16 bytes long
     */
    public static FrameId fromBytes(byte[] bytes) {
        if (bytes == null || bytes.length != BYTES) {
            throw new IllegalArgumentException("Frame id must be " + BYTES + " bytes");
        }
        ByteBuffer buf = ByteBuffer.wrap(bytes);
        return new FrameId(buf.getLong(), buf.getLong());
    }

    /**
     * Parses the 25-digit base-36 text form (case-insensitive).
     *
     * @throws IllegalArgumentException if the text is not a valid identifier
     */
    public static FrameId parse(String text) {
        if (text == null || text.length() != TEXT_LENGTH) {
            throw new IllegalArgumentException("Invalid frame id: '" + text + "'");
        }
        for (int i = 0; i < TEXT_LENGTH; i++) {
            if (Character.digit(text.charAt(i), RADIX) < 0) {
                throw new IllegalArgumentException("Invalid frame id: '" + text + "'");
            }
        }
        BigInteger value = new BigInteger(text, RADIX);
        if (value.bitLength() > MAX_BITS) {
            throw new IllegalArgumentException("Frame id out of range: '" + text + "'");
        }
        byte[] raw = value.toByteArray();
        byte[] bytes = new byte[BYTES];
        int copy = Math.min(raw.length, BYTES);
        System.arraycopy(raw, raw.length - copy, bytes, BYTES - copy, copy);
        return fromBytes(bytes);
    }

    @Override
    public int compareTo(FrameId other) {
        int cmp = Long.compareUnsigned(msb, other.msb);
        return cmp != 0 ? cmp : Long.compareUnsigned(lsb, other.lsb);
    }

    @Override
    public String toString() {
        String digits = new BigInteger(1, toBytes()).toString(RADIX).toUpperCase();
        StringBuilder sb = new StringBuilder(TEXT_LENGTH);
        for (int i = digits.length(); i < TEXT_LENGTH; i++) {
            sb.append('0');
        }
        return sb.append(digits).toString();
    }
}
