package com.dcruver.docgrade.io;

import com.dcruver.docgrade.domain.ComponentType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DocumentReaderTest {

    private DocumentReader reader;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        reader = new DocumentReader();
    }

    @Test
    void testReadsFrontmatterAndBody() throws Exception {
        String content = """
            ---
            name: code-reviewer
            description: Reviews code changes
            tools: Read, Grep
            ---
            # Code Reviewer

            ## Foundation
            """;
        Path file = tempDir.resolve("code-reviewer.md");
        Files.writeString(file, content);

        ParsedDocument document = reader.read(file, ComponentType.AGENT);

        assertTrue(document.isHasFrontmatter());
        assertEquals("code-reviewer", document.getFrontmatter().get("name"));
        assertEquals("Read, Grep", document.getFrontmatter().get("tools"));
        assertTrue(document.getBody().startsWith("# Code Reviewer"));
        assertFalse(document.getBody().contains("description:"));
        assertEquals(content, document.getRawContent());
        assertEquals(ComponentType.AGENT, document.getType());
    }

    @Test
    void testMissingFrontmatterKeepsWholeContentAsBody() throws Exception {
        String content = "# Just markdown\n\nNo metadata here.\n";

        ParsedDocument document = reader.parse(Path.of("x.md"), ComponentType.COMMAND, content);

        assertFalse(document.isHasFrontmatter());
        assertTrue(document.getFrontmatter().isEmpty());
        assertEquals(content, document.getBody());
    }

    @Test
    void testEmptyFrontmatterBlock() throws Exception {
        ParsedDocument document = reader.parse(Path.of("x.md"), ComponentType.COMMAND, "---\n---\nBody\n");

        assertTrue(document.isHasFrontmatter());
        assertTrue(document.getFrontmatter().isEmpty());
        assertEquals("Body\n", document.getBody());
    }

    @Test
    void testHorizontalRuleInBodyIsNotFrontmatterEnd() throws Exception {
        String content = "---\nname: a\n---\nIntro\n\n---\n\nMore\n";

        ParsedDocument document = reader.parse(Path.of("x.md"), ComponentType.SKILL, content);

        assertEquals("a", document.getFrontmatter().get("name"));
        assertEquals("Intro\n\n---\n\nMore\n", document.getBody());
    }

    @Test
    void testYamlTypesArePreserved() throws Exception {
        String content = "---\ndescription: 42\nkeep-coding-instructions: true\nkeywords:\n  - a\n  - b\n---\n";

        ParsedDocument document = reader.parse(Path.of("x.md"), ComponentType.OUTPUT_STYLE, content);

        Map<String, Object> frontmatter = document.getFrontmatter();
        assertEquals(42, frontmatter.get("description"));
        assertEquals(Boolean.TRUE, frontmatter.get("keep-coding-instructions"));
        assertEquals(List.of("a", "b"), frontmatter.get("keywords"));
    }

    @Test
    void testWindowsLineEndings() throws Exception {
        String content = "---\r\nname: win\r\n---\r\nBody\r\n";

        ParsedDocument document = reader.parse(Path.of("x.md"), ComponentType.AGENT, content);

        assertEquals("win", document.getFrontmatter().get("name"));
        assertEquals("Body\r\n", document.getBody());
    }

    @Test
    void testInvalidYamlRaisesParseException() {
        String content = "---\nname: [unclosed\n---\nBody\n";

        DocumentParseException e = assertThrows(DocumentParseException.class,
            () -> reader.parse(Path.of("broken.md"), ComponentType.AGENT, content));
        assertEquals(Path.of("broken.md"), e.getFilePath());
        assertTrue(e.getMessage().contains("broken.md"));
    }

    @Test
    void testNonMappingFrontmatterRaisesParseException() {
        String content = "---\n- a\n- b\n---\nBody\n";

        assertThrows(DocumentParseException.class,
            () -> reader.parse(Path.of("list.md"), ComponentType.AGENT, content));
    }

    @Test
    void testReadsPluginManifestAsJson() throws Exception {
        Path manifest = tempDir.resolve("plugin.json");
        Files.writeString(manifest, """
            {
              "name": "demo",
              "version": "0.1.0",
              "author": {"name": "Sam"},
              "keywords": ["a"]
            }
            """);

        ParsedDocument document = reader.read(manifest, ComponentType.PLUGIN);

        assertEquals("demo", document.getFrontmatter().get("name"));
        assertEquals(Map.of("name", "Sam"), document.getFrontmatter().get("author"));
        assertEquals(List.of("a"), document.getFrontmatter().get("keywords"));
        assertEquals("", document.getBody());
    }

    @Test
    void testInvalidJsonRaisesParseException() {
        assertThrows(DocumentParseException.class,
            () -> reader.parse(Path.of("plugin.json"), ComponentType.PLUGIN, "{ not json"));
    }
}
