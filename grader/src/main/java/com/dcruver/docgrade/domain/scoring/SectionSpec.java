package com.dcruver.docgrade.domain.scoring;

import lombok.Value;

import java.util.regex.Pattern;

/**
 * A required body pattern, its display name and the points it is worth.
 * Patterns are matched case-insensitively anywhere in the body.
 */
@Value
public class SectionSpec {
    Pattern pattern;
    String name;
    int points;

    public static SectionSpec of(String regex, String name, int points) {
        return new SectionSpec(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), name, points);
    }

    public boolean matches(String body) {
        return pattern.matcher(body).find();
    }
}
