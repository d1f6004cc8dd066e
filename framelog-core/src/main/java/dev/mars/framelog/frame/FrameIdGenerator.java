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

import java.security.SecureRandom;
import java.util.Random;
import java.util.function.LongSupplier;

/**
 * Mints strictly increasing {@link FrameId}s.
 * <p>
 * Within one millisecond the 48-bit counter (counter_hi:counter_lo) is
 * incremented; when it overflows the timestamp is advanced by one. A clock that
 * moves backwards by less than {@link #ROLLBACK_ALLOWANCE_MS} is ignored and the
 * previous timestamp is reused, so ordering survives small clock adjustments.
 * A larger rollback resets the generator.
 * <p>
 * <b>Thread Safety:</b> {@link #next()} is synchronized.
 */
public final class FrameIdGenerator {

    /** Clock rollback tolerated before the generator resets. */
    static final long ROLLBACK_ALLOWANCE_MS = 10_000;

    private static final int MAX_COUNTER = 0xFFFFFF;

    private final LongSupplier clock;
    private final Random random;

    private long timestamp;
    private int counterHi;
    private int counterLo;

    public FrameIdGenerator() {
        this(System::currentTimeMillis);
    }

    public FrameIdGenerator(LongSupplier clock) {
        this(clock, new SecureRandom());
    }

    FrameIdGenerator(LongSupplier clock, Random random) {
        this.clock = clock;
        this.random = random;
    }

    /**
     * Returns an identifier greater than every identifier previously returned
     * by this generator (unless the clock rolled back past the allowance).
     */
    public synchronized FrameId next() {
        long now = clock.getAsLong();
        if (now > timestamp) {
            timestamp = now;
            counterHi = random.nextInt(MAX_COUNTER + 1);
            // top bit of counter_lo left clear to keep headroom within the millisecond
            counterLo = random.nextInt((MAX_COUNTER + 1) >>> 1);
        } else if (now + ROLLBACK_ALLOWANCE_MS > timestamp) {
            counterLo++;
            if (counterLo > MAX_COUNTER) {
                counterLo = 0;
                counterHi++;
                if (counterHi > MAX_COUNTER) {
                    counterHi = 0;
                    timestamp++;
                }
            }
        } else {
            timestamp = 0;
            return next();
        }
        return FrameId.of(timestamp, counterHi, counterLo, random.nextInt());
    }

    /**
     * Ensures every later identifier sorts after {@code last}, the newest
     * identifier already persisted.
     */
    public synchronized void advancePast(FrameId last) {
        if (FrameId.of(timestamp, counterHi, counterLo, -1).compareTo(last) < 0) {
            timestamp = last.timestamp();
            counterHi = last.counterHi();
            counterLo = last.counterLo();
        }
    }
}
