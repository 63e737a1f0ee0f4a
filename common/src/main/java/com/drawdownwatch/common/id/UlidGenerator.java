package com.drawdownwatch.common.id;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

import java.security.SecureRandom;
import java.time.Clock;

/**
 * ULID identifiers for alerts and recovery rows: 48-bit millisecond timestamp followed by
 * 80 random bits, rendered as 26 Crockford Base32 characters so ids sort by creation time.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class UlidGenerator {

    private static final char[] ALPHABET = "0123456789ABCDEFGHJKMNPQRSTVWXYZ".toCharArray();
    private static final int TIME_CHARS = 10;
    private static final int RANDOM_CHARS = 16;
    private static final SecureRandom RANDOM = new SecureRandom();

    public static String generate() {
        return generate(Clock.systemUTC());
    }

    public static String generate(Clock clock) {
        var random = new byte[10];
        RANDOM.nextBytes(random);
        return encode(clock.millis(), random);
    }

    static String encode(long epochMillis, byte[] random) {
        var out = new StringBuilder(TIME_CHARS + RANDOM_CHARS);
        for (int shift = (TIME_CHARS - 1) * 5; shift >= 0; shift -= 5) {
            out.append(ALPHABET[(int) ((epochMillis >>> shift) & 0x1F)]);
        }

        // 80 random bits consumed five at a time
        int buffer = 0;
        int bits = 0;
        for (byte b : random) {
            buffer = (buffer << 8) | (b & 0xFF);
            bits += 8;
            while (bits >= 5) {
                bits -= 5;
                out.append(ALPHABET[(buffer >>> bits) & 0x1F]);
            }
            buffer &= (1 << bits) - 1;
        }
        return out.toString();
    }
}
