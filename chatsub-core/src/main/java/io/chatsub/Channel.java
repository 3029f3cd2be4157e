package io.chatsub;

import java.util.Locale;
import java.util.Objects;

/**
 * A chat channel identified by its normalized name.
 *
 * <p>Names are normalized by trimming surrounding whitespace, stripping leading {@code #}
 * markers and lowercasing, so {@code "#Foo"}, {@code "foo"} and {@code " foo "} denote the
 * same channel:
 * <pre>{@code
 * Channel.of("#Foo").equals(Channel.of("foo")); // true
 * Channel.of(" foo").equals(Channel.of("foo")); // true
 * }</pre>
 *
 * <p>Whitespace is never part of a chat channel name, so trimming only folds names read
 * from configuration or typed with stray spaces onto the channel they refer to.
 */
public final class Channel {

    /** Marker some clients prefix channel names with. */
    public static final char MARKER = '#';

    private final String name;

    private Channel(String name) {
        this.name = name;
    }

    /**
     * Creates a channel from a raw, possibly marked and mixed-case, name.
     *
     * @param rawName the channel name as typed by a user or read from configuration
     * @return the normalized channel
     * @throws NullPointerException if rawName is null
     * @throws IllegalArgumentException if the name is blank after normalization
     */
    public static Channel of(String rawName) {
        return new Channel(normalize(rawName));
    }

    /**
     * Normalizes a raw channel name without creating a {@link Channel}.
     *
     * @param rawName the raw name
     * @return the trimmed, lowercase name without leading markers
     * @throws NullPointerException if rawName is null
     * @throws IllegalArgumentException if the name is blank after normalization
     */
    public static String normalize(String rawName) {
        Objects.requireNonNull(rawName, "rawName");
        String trimmed = rawName.strip();
        int start = 0;
        while (start < trimmed.length() && trimmed.charAt(start) == MARKER) {
            start++;
        }
        String normalized = trimmed.substring(start).toLowerCase(Locale.ROOT);
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("Channel name cannot be blank: '" + rawName + "'");
        }
        return normalized;
    }

    /**
     * Returns the normalized name.
     *
     * @return the lowercase name, never null or empty
     */
    public String name() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Channel)) return false;
        Channel that = (Channel) o;
        return name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return MARKER + name;
    }
}
