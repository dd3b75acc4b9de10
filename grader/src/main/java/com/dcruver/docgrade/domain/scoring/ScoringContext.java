package com.dcruver.docgrade.domain.scoring;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Inputs visible to a scorer's category methods for one scoring call.
 */
@Value
@Builder
public class ScoringContext {
    String content;                   // Raw document, used for size
    Map<String, Object> frontmatter;  // Decoded metadata block (or JSON manifest)
    String body;                      // Content with the metadata block stripped
    int lineCount;

    public String description() {
        return FrontmatterValues.string(frontmatter, "description");
    }
}
