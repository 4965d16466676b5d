package com.demochat.util;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Extracts the creation instant embedded in time-based UUIDs.
 * Message ids are UUIDv7, so the id doubles as the creation timestamp.
 */
public final class UuidTimestamps {

    // 100ns intervals between the Gregorian epoch (1582-10-15) and the Unix epoch
    private static final long GREGORIAN_TO_UNIX_TICKS = 0x01B21DD213814000L;
    private static final long TICKS_PER_SECOND = 10_000_000L;

    private UuidTimestamps() {
        // Utility class - prevent instantiation
    }

    /**
     * Returns the embedded timestamp of a version 1, 6 or 7 UUID.
     *
     * @param id the identifier
     * @return the creation instant, or empty for versions that carry no timestamp
     */
    public static Optional<Instant> creationInstant(UUID id) {
        if (id == null) {
            return Optional.empty();
        }
        long msb = id.getMostSignificantBits();
        return switch (id.version()) {
            case 7 -> Optional.of(Instant.ofEpochMilli(msb >>> 16));
            case 6 -> {
                long ticks = ((msb >>> 32) << 28)
                        | (((msb >>> 16) & 0xFFFFL) << 12)
                        | (msb & 0x0FFFL);
                yield Optional.of(fromGregorianTicks(ticks));
            }
            case 1 -> Optional.of(fromGregorianTicks(id.timestamp()));
            default -> Optional.empty();
        };
    }

    private static Instant fromGregorianTicks(long ticks) {
        long unixTicks = ticks - GREGORIAN_TO_UNIX_TICKS;
        return Instant.ofEpochSecond(
                Math.floorDiv(unixTicks, TICKS_PER_SECOND),
                Math.floorMod(unixTicks, TICKS_PER_SECOND) * 100);
    }
}
