package org.alertingupgrade.migrations.common;

import java.security.SecureRandom;

import lombok.experimental.UtilityClass;

/** Short random identifiers used for rule UIDs, folder UIDs and deduplication suffixes */
@UtilityClass
public class ShortUid {
    public static final int LENGTH = 14;

    private static final String LETTERS = "abcdefghijklmnopqrstuvwxyz";
    private static final String ALPHANUMERIC = LETTERS + "0123456789";
    private static final SecureRandom RANDOM = new SecureRandom();

    /** Lower-case alphanumeric, always starting with a letter so it is never mistaken for a numeric id */
    public static String generate() {
        var sb = new StringBuilder(LENGTH);
        sb.append(LETTERS.charAt(RANDOM.nextInt(LETTERS.length())));
        for (int i = 1; i < LENGTH; i++) {
            sb.append(ALPHANUMERIC.charAt(RANDOM.nextInt(ALPHANUMERIC.length())));
        }
        return sb.toString();
    }
}
