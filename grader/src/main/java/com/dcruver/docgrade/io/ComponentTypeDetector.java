package com.dcruver.docgrade.io;

import com.dcruver.docgrade.domain.ComponentType;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Works out a component's type from where it lives.
 * Markdown files take the type of their nearest agents/, commands/ or output-styles/ ancestor,
 * so both project (.claude/agents/x.md) and plugin (my-plugin/agents/x.md) layouts are recognised.
 */
@Component
public class ComponentTypeDetector {

    private static final Map<String, ComponentType> MARKDOWN_DIRECTORIES = Map.of(
        "agents", ComponentType.AGENT,
        "commands", ComponentType.COMMAND,
        "output-styles", ComponentType.OUTPUT_STYLE
    );

    public Optional<ComponentType> detect(Path path) {
        Path fileNamePath = path.getFileName();
        if (fileNamePath == null) {
            return Optional.empty();
        }
        String fileName = fileNamePath.toString();
        Path parent = path.getParent();

        if (fileName.equalsIgnoreCase("SKILL.md")) {
            return Optional.of(ComponentType.SKILL);
        }

        if (fileName.equals("plugin.json")) {
            if (parent != null && parent.getFileName() != null
                && parent.getFileName().toString().equals(".claude-plugin")) {
                return Optional.of(ComponentType.PLUGIN);
            }
            return Optional.empty();
        }

        if (!fileName.toLowerCase(Locale.ROOT).endsWith(".md")) {
            return Optional.empty();
        }

        // Nearest matching ancestor wins
        for (Path dir = parent; dir != null; dir = dir.getParent()) {
            if (dir.getFileName() == null) {
                break;
            }
            ComponentType type = MARKDOWN_DIRECTORIES.get(dir.getFileName().toString());
            if (type != null) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
