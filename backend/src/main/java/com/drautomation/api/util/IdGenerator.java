package com.drautomation.api.util;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Clock;

/**
 * Generates record identifiers of the form {@code <prefix>_<epochMillis>_<suffix>}.
 * The suffix is 9 random lowercase base-36 characters.
 */
@Component
public class IdGenerator {

    public static final String PREFIX_BACKUP = "backup";
    public static final String PREFIX_JOB = "job";
    public static final String PREFIX_SCHEDULE = "schedule";
    public static final String PREFIX_REPLICATION = "repl";
    public static final String PREFIX_TEST = "test";
    public static final String PREFIX_RESTORE = "restore";
    public static final String PREFIX_ALERT = "alert";
    public static final String PREFIX_RECOVERY = "recovery";
    public static final String PREFIX_DISASTER = "disaster";

    private static final SecureRandom RANDOM = new SecureRandom();
    private static final String BASE36_CHARS = "0123456789abcdefghijklmnopqrstuvwxyz";
    private static final int SUFFIX_LENGTH = 9;

    private final Clock clock;

    public IdGenerator(Clock clock) {
        this.clock = clock;
    }

    public String generate(String prefix) {
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalArgumentException("Id prefix must not be blank");
        }
        return prefix + "_" + clock.millis() + "_" + randomSuffix(SUFFIX_LENGTH);
    }

    /**
     * Generate a random lowercase base-36 string.
     *
     * @param length the desired length
     * @return random string
     */
    public String randomSuffix(int length) {
        if (length <= 0) {
            throw new IllegalArgumentException("Length must be positive");
        }
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(BASE36_CHARS.charAt(RANDOM.nextInt(BASE36_CHARS.length())));
        }
        return sb.toString();
    }
}
