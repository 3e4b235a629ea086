package org.alertingupgrade.migrations.rules;

import java.util.HashSet;
import java.util.Set;

/** Hands out refIds A..Z, AA, AB, ... skipping any already taken */
class RefIdSequence {
    private final Set<String> taken = new HashSet<>();
    private int counter = 0;

    void reserve(String refId) {
        taken.add(refId);
    }

    boolean isTaken(String refId) {
        return taken.contains(refId);
    }

    String next() {
        String candidate;
        do {
            candidate = toLetters(counter++);
        } while (taken.contains(candidate));
        taken.add(candidate);
        return candidate;
    }

    private static String toLetters(int index) {
        var sb = new StringBuilder();
        int n = index;
        do {
            sb.insert(0, (char) ('A' + n % 26));
            n = n / 26 - 1;
        } while (n >= 0);
        return sb.toString();
    }
}
