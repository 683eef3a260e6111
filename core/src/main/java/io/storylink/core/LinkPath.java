package io.storylink.core;

import java.util.List;
import java.util.Objects;

/**
 * Identity of a link within a story: the path of module names that owns it
 * (last element is the module that created the link) plus the link's name.
 * <p>
 * Value object: equals/hashCode based on contents.
 */
public record LinkPath(List<String> modulePath, String linkName) {

    static final String LINK_KEY_PREFIX = "Link/";
    static final char MODULE_SEPARATOR = ':';
    static final char KEY_SEPARATOR = '/';
    static final char ESCAPE = '\\';

    public LinkPath {
        Objects.requireNonNull(modulePath, "modulePath");
        Objects.requireNonNull(linkName, "linkName");
        if (linkName.isBlank()) throw new IllegalArgumentException("linkName must not be blank");
        modulePath = List.copyOf(modulePath);
    }

    public static LinkPath of(String linkName, String... modulePath) {
        return new LinkPath(List.of(modulePath), linkName);
    }

    /**
     * Storage key of this link: {@code Link/<module:path>/<linkName>}, with
     * separator and escape characters inside segments escaped.
     */
    public String linkKey() {
        var sb = new StringBuilder(LINK_KEY_PREFIX);
        for (int i = 0; i < modulePath.size(); i++) {
            if (i > 0) sb.append(MODULE_SEPARATOR);
            escapeInto(sb, modulePath.get(i));
        }
        sb.append(KEY_SEPARATOR);
        escapeInto(sb, linkName);
        return sb.toString();
    }

    /** Prefix under which every change record of this link is stored. */
    public String changeLogPrefix() {
        return linkKey() + KEY_SEPARATOR;
    }

    /** Storage key of a single change record. */
    public String changeKey(String key) {
        return changeLogPrefix() + Objects.requireNonNull(key, "key");
    }

    /**
     * Extract the change key from a storage key under {@link #changeLogPrefix()},
     * or null if the storage key does not belong to this link.
     */
    public String changeKeyOf(String storageKey) {
        String prefix = changeLogPrefix();
        if (storageKey == null || !storageKey.startsWith(prefix)) {
            return null;
        }
        String rest = storageKey.substring(prefix.length());
        // Change keys never contain the separator; anything else is a nested link namespace.
        return rest.isEmpty() || rest.indexOf(KEY_SEPARATOR) >= 0 ? null : rest;
    }

    /** Module path joined with ':' (unescaped), for logs and URLs. */
    public String encodedModulePath() {
        return String.join(String.valueOf(MODULE_SEPARATOR), modulePath);
    }

    private static void escapeInto(StringBuilder sb, String segment) {
        for (int i = 0; i < segment.length(); i++) {
            char c = segment.charAt(i);
            if (c == MODULE_SEPARATOR || c == KEY_SEPARATOR || c == ESCAPE) {
                sb.append(ESCAPE);
            }
            sb.append(c);
        }
    }

    @Override
    public String toString() {
        return encodedModulePath() + "/" + linkName;
    }
}
