package io.github.chirino.llmcache.storage;

import java.security.SecureRandom;
import java.util.Random;

/** Generates item ids of the form {@code <namespace>:<epochMillis>:<8 base36 chars>}. */
public final class CacheItemIds {

    private static final String ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";
    private static final Random RANDOM = new SecureRandom();

    private CacheItemIds() {}

    public static String generate(String namespace, long now) {
        StringBuilder id = new StringBuilder(namespace).append(':').append(now).append(':');
        for (int i = 0; i < 8; i++) {
            id.append(ALPHABET.charAt(RANDOM.nextInt(ALPHABET.length())));
        }
        return id.toString();
    }

    public static String resolve(String requested, String namespace, long now) {
        return requested != null && !requested.isBlank() ? requested : generate(namespace, now);
    }
}
