package io.meshbroker.util;

import java.security.SecureRandom;
import java.util.Base64;
import java.util.UUID;

public final class Ids {
    private static final SecureRandom RANDOM = new SecureRandom();
    private static final Base64.Encoder URL_ENCODER = Base64.getUrlEncoder().withoutPadding();

    private Ids() {
    }

    public static String messageId() {
        return UUID.randomUUID().toString();
    }

    public static String taskId() {
        return UUID.randomUUID().toString();
    }

    /**
     * 20-character url-safe token, the shape transport layers hand out for connection ids.
     */
    public static String connectionId() {
        byte[] bytes = new byte[15];
        RANDOM.nextBytes(bytes);
        return URL_ENCODER.encodeToString(bytes);
    }
}
