package com.qualitygate.core.cache;

import com.qualitygate.core.util.FileUtils;

import java.util.Objects;

/**
 * Cache key built from an analysis category and a project-relative file path.
 *
 * @param category category identifier (e.g. "architecture")
 * @param path normalized project-relative path
 */
public record CacheKey(String category, String path) {

    private static final String SEPARATOR = "__";

    public CacheKey {
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(path, "path must not be null");
        path = FileUtils.normalizePath(path);
    }

    public static CacheKey of(String category, String path) {
        return new CacheKey(category, path);
    }

    /**
     * Returns the flat, file-system safe form of the key, e.g.
     * {@code architecture__src__app.ts}.
     *
     * <p>A literal {@code _} is written as {@code _5f} and {@code :} as {@code _3a}, so
     * {@code __} only ever stands for a separator and distinct keys never share a form.
     *
     * @return normalized key
     */
    public String normalized() {
        return encode(category) + SEPARATOR + encode(path);
    }

    private static String encode(String value) {
        StringBuilder encoded = new StringBuilder(value.length() + 8);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '_' -> encoded.append("_5f");
                case ':' -> encoded.append("_3a");
                case '/' -> encoded.append(SEPARATOR);
                default -> encoded.append(c);
            }
        }
        return encoded.toString();
    }

    /**
     * @return name of the file holding this entry on disk
     */
    public String fileName() {
        return normalized() + ".json";
    }
}
