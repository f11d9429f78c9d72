package io.github.chirino.llmcache.storage;

/**
 * Computes the timestamps and version of an item write from the previously stored values.
 *
 * <p>{@code updatedAt} of a rewrite is always strictly greater than {@code createdAt}, even when
 * the rewrite happens in the same millisecond.
 */
public final class ItemVersioning {

    private ItemVersioning() {}

    public record Stamp(long createdAt, long updatedAt, long version) {}

    public static Stamp first(long now) {
        return new Stamp(now, now, 1);
    }

    public static Stamp next(Long previousCreatedAt, Long previousVersion, long now) {
        if (previousCreatedAt == null) {
            return first(now);
        }
        long createdAt = previousCreatedAt;
        long updatedAt = now <= createdAt ? createdAt + 1 : now;
        long version = previousVersion == null ? 2 : previousVersion + 1;
        return new Stamp(createdAt, updatedAt, version);
    }

    /** Parses a stored numeric field, treating blank and malformed values as absent. */
    public static Long parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
