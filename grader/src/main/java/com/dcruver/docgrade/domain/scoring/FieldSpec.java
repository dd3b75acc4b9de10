package com.dcruver.docgrade.domain.scoring;

import lombok.Value;

/**
 * A required frontmatter key and the points it is worth.
 */
@Value(staticConstructor = "of")
public class FieldSpec {
    String name;
    int points;
}
