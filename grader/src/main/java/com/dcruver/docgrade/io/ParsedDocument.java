package com.dcruver.docgrade.io;

import com.dcruver.docgrade.domain.ComponentType;
import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;
import java.util.Map;

/**
 * A component document split into its metadata and body.
 */
@Data
@Builder
public class ParsedDocument {
    private final Path filePath;
    private final ComponentType type;
    private final String rawContent;  // Whole file, used for line counting

    // YAML frontmatter for markdown, the whole manifest for plugin.json
    private final Map<String, Object> frontmatter;

    private final String body;  // Empty for JSON manifests
    private final boolean hasFrontmatter;
}
