package com.dcruver.docgrade.io;

import com.dcruver.docgrade.domain.ComponentType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads component documents and separates frontmatter from body.
 * Markdown files carry YAML between two "---" lines; plugin manifests are JSON.
 */
@Component
@Slf4j
public class DocumentReader {

    private static final Pattern FRONTMATTER = Pattern.compile(
        "\\A---[ \\t]*\\r?\\n(.*?)^---[ \\t]*$\\r?\\n?",
        Pattern.MULTILINE | Pattern.DOTALL);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final ObjectMapper jsonMapper = new ObjectMapper();

    /**
     * Read and parse a component file
     */
    public ParsedDocument read(Path filePath, ComponentType type) throws IOException, DocumentParseException {
        String content = Files.readString(filePath, StandardCharsets.UTF_8);
        return parse(filePath, type, content);
    }

    /**
     * Parse already-loaded content
     */
    public ParsedDocument parse(Path filePath, ComponentType type, String content) throws DocumentParseException {
        if (type.isJsonManifest()) {
            return parseManifest(filePath, type, content);
        }
        return parseMarkdown(filePath, type, content);
    }

    private ParsedDocument parseManifest(Path filePath, ComponentType type, String content)
        throws DocumentParseException {
        Map<String, Object> manifest;
        try {
            manifest = jsonMapper.readValue(content, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new DocumentParseException(filePath, "Invalid JSON manifest", e);
        }

        return ParsedDocument.builder()
            .filePath(filePath)
            .type(type)
            .rawContent(content)
            .frontmatter(manifest != null ? manifest : Map.of())
            .body("")
            .hasFrontmatter(manifest != null)
            .build();
    }

    private ParsedDocument parseMarkdown(Path filePath, ComponentType type, String content)
        throws DocumentParseException {
        Matcher matcher = FRONTMATTER.matcher(content);
        if (!matcher.find()) {
            log.debug("No frontmatter in {}", filePath);
            return ParsedDocument.builder()
                .filePath(filePath)
                .type(type)
                .rawContent(content)
                .frontmatter(Map.of())
                .body(content)
                .hasFrontmatter(false)
                .build();
        }

        String yaml = matcher.group(1);
        Map<String, Object> frontmatter = null;
        if (!yaml.isBlank()) {
            try {
                frontmatter = yamlMapper.readValue(yaml, MAP_TYPE);
            } catch (JsonProcessingException e) {
                throw new DocumentParseException(filePath, "Invalid YAML frontmatter", e);
            }
        }

        return ParsedDocument.builder()
            .filePath(filePath)
            .type(type)
            .rawContent(content)
            .frontmatter(frontmatter != null ? frontmatter : Map.of())
            .body(content.substring(matcher.end()))
            .hasFrontmatter(true)
            .build();
    }
}
