package com.quickfs.relay.session;

import java.security.SecureRandom;

/**
 * Random hex identifiers. Session ids are short public codes; receiver ids are
 * twice as long so they cannot be guessed from a session code.
 */
public final class Ids {

    public static final int SESSION_ID_BYTES = 4;
    public static final int RECEIVER_ID_BYTES = 8;

    private static final SecureRandom RANDOM = new SecureRandom();
    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private Ids() {}

    /** 8 hex characters. */
    public static String sessionId() {
        return randomHex(SESSION_ID_BYTES);
    }

    /** 16 hex characters. */
    public static String receiverId() {
        return randomHex(RECEIVER_ID_BYTES);
    }

    static String randomHex(int numBytes) {
        byte[] bytes = new byte[numBytes];
        RANDOM.nextBytes(bytes);
        char[] out = new char[numBytes * 2];
        for (int i = 0; i < numBytes; i++) {
            int b = bytes[i] & 0xFF;
            out[i * 2] = HEX[b >>> 4];
            out[i * 2 + 1] = HEX[b & 0x0F];
        }
        return new String(out);
    }
}
