package com.dcruver.docgrade.domain.scoring;

import java.util.List;
import java.util.Map;

/**
 * Typed reads from a parsed frontmatter or manifest map.
 * A value of the wrong type reads as absent.
 */
public final class FrontmatterValues {

    private FrontmatterValues() {
    }

    /**
     * String value, or "" when missing or not a string
     */
    public static String string(Map<String, Object> frontmatter, String key) {
        if (frontmatter == null) {
            return "";
        }
        Object value = frontmatter.get(key);
        return value instanceof String ? (String) value : "";
    }

    public static boolean hasNonEmptyString(Map<String, Object> frontmatter, String key) {
        return !string(frontmatter, key).isEmpty();
    }

    /**
     * String value one level down, e.g. author.name
     */
    @SuppressWarnings("unchecked")
    public static String nestedString(Map<String, Object> frontmatter, String parent, String key) {
        if (frontmatter == null) {
            return "";
        }
        Object value = frontmatter.get(parent);
        if (value instanceof Map) {
            return string((Map<String, Object>) value, key);
        }
        return "";
    }

    public static boolean hasNonEmptyList(Map<String, Object> frontmatter, String key) {
        if (frontmatter == null) {
            return false;
        }
        Object value = frontmatter.get(key);
        return value instanceof List && !((List<?>) value).isEmpty();
    }
}
