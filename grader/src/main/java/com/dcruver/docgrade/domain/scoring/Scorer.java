package com.dcruver.docgrade.domain.scoring;

import java.util.Map;

/**
 * Grades one parsed component document.
 */
public interface Scorer {

    /**
     * @param content     raw document, used for line and byte counts
     * @param frontmatter decoded metadata (YAML frontmatter, or the whole JSON manifest for plugins)
     * @param body        document text with the metadata block removed
     */
    QualityScore score(String content, Map<String, Object> frontmatter, String body);
}
