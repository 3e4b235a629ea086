package org.alertingupgrade.migrations.dedup;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.function.Supplier;

import org.alertingupgrade.migrations.common.ShortUid;

/**
 * Tracks seen identifiers and produces unused variants of colliding ones.
 * <p>
 * When case-insensitive, all uniqueness checks lower-case first, matching storage engines that collate
 * case-insensitively. When {@code maxLen > 0}, candidates are truncated before containment checks and
 * {@link #deduplicate(String)} never returns anything longer than {@code maxLen}.
 * <p>
 * Not thread-safe; one instance belongs to one migration run.
 */
public class Deduplicator {
    private final Set<String> seen = new HashSet<>();
    private final boolean caseInsensitive;
    private final int maxLen;
    private final Supplier<String> uidSupplier;

    public Deduplicator(boolean caseInsensitive, int maxLen) {
        this(caseInsensitive, maxLen, ShortUid::generate);
    }

    public Deduplicator(boolean caseInsensitive, int maxLen, Supplier<String> uidSupplier) {
        this.caseInsensitive = caseInsensitive;
        this.maxLen = maxLen;
        this.uidSupplier = uidSupplier;
    }

    public boolean contains(String candidate) {
        var normalized = caseInsensitive ? candidate.toLowerCase(Locale.ROOT) : candidate;
        if (maxLen > 0 && normalized.length() > maxLen) {
            normalized = normalized.substring(0, maxLen);
        }
        return seen.contains(normalized);
    }

    /** Returns {@code candidate_<shortUid>}. The result is not added; callers add what they keep. */
    public String deduplicate(String candidate) {
        var uid = uidSupplier.get();
        var base = candidate;
        if (maxLen > 0 && base.length() + 1 + uid.length() > maxLen) {
            base = base.substring(0, Math.max(0, maxLen - 1 - uid.length()));
        }
        return base + "_" + uid;
    }

    public void add(String value) {
        seen.add(caseInsensitive ? value.toLowerCase(Locale.ROOT) : value);
    }

    public boolean isCaseInsensitive() {
        return caseInsensitive;
    }

    public int getMaxLen() {
        return maxLen;
    }
}
