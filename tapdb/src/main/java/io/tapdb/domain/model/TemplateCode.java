package io.tapdb.domain.model;

/**
 * Composite template key {@code category/type/subtype/version}.
 */
public record TemplateCode(String category, String type, String subtype, String version) {

    public TemplateCode {
        if (isBlank(category) || isBlank(type) || isBlank(subtype) || isBlank(version)) {
            throw new IllegalArgumentException("template code requires category, type, subtype and version");
        }
    }

    /**
     * Parse {@code category/type/subtype/version}, with or without a trailing slash.
     *
     * @throws IllegalArgumentException when the code has the wrong shape
     */
    public static TemplateCode parse(String code) {
        String normalized = normalize(code);
        String[] parts = normalized.split("/", -1);
        if (parts.length != 4) {
            throw new IllegalArgumentException("malformed template code: " + code);
        }
        for (String part : parts) {
            if (isBlank(part) || !part.equals(part.trim())) {
                throw new IllegalArgumentException("malformed template code: " + code);
            }
        }
        return new TemplateCode(parts[0], parts[1], parts[2], parts[3]);
    }

    public static boolean isValid(String code) {
        try {
            parse(code);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /** Trim and drop a single trailing slash. */
    public static String normalize(String code) {
        if (code == null) {
            return "";
        }
        String trimmed = code.trim();
        return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }

    /** Canonical rendering with a trailing slash. */
    public String toCanonicalString() {
        return toString() + "/";
    }

    @Override
    public String toString() {
        return category + "/" + type + "/" + subtype + "/" + version;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
