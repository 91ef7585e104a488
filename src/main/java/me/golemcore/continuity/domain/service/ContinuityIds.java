package me.golemcore.continuity.domain.service;

import java.security.SecureRandom;
import java.time.Instant;
import java.util.HexFormat;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Identifier formats shared by the continuity components.
 */
public final class ContinuityIds {

    private static final String BASE36 = "0123456789abcdefghijklmnopqrstuvwxyz";
    private static final int SESSION_SUFFIX_LENGTH = 8;
    private static final int BOUNDARY_SUFFIX_LENGTH = 5;
    private static final int RECORD_ID_BYTES = 16;
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private ContinuityIds() {
    }

    /**
     * {@code session-<epochMillis>-<8 base36 chars>}
     */
    public static String sessionId(Instant now) {
        return "session-" + now.toEpochMilli() + "-" + randomBase36(SESSION_SUFFIX_LENGTH);
    }

    /**
     * {@code boundary-<epochMillis>-<5 base36 chars>}
     */
    public static String boundaryId(Instant now) {
        return "boundary-" + now.toEpochMilli() + "-" + randomBase36(BOUNDARY_SUFFIX_LENGTH);
    }

    public static String fallbackSessionId(Instant now) {
        return "fallback-session-" + now.toEpochMilli();
    }

    /**
     * 16 random bytes, hex encoded. Used for append-log record ids.
     */
    public static String recordId() {
        byte[] bytes = new byte[RECORD_ID_BYTES];
        SECURE_RANDOM.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }

    static String randomBase36(int length) {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(BASE36.charAt(random.nextInt(BASE36.length())));
        }
        return sb.toString();
    }
}
