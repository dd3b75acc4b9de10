package com.dcruver.docgrade.domain;

import com.dcruver.docgrade.domain.scoring.AgentScorer;
import com.dcruver.docgrade.domain.scoring.CommandScorer;
import com.dcruver.docgrade.domain.scoring.OutputStyleScorer;
import com.dcruver.docgrade.domain.scoring.PluginScorer;
import com.dcruver.docgrade.domain.scoring.Scorer;
import com.dcruver.docgrade.domain.scoring.SkillScorer;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Kinds of gradable component documents.
 */
public enum ComponentType {
    /**
     * Sub-agent definition: agents/*.md
     */
    AGENT("agent", new AgentScorer()),

    /**
     * Slash command: commands/*.md
     */
    COMMAND("command", new CommandScorer()),

    /**
     * Skill entry point: skills/<name>/SKILL.md
     */
    SKILL("skill", new SkillScorer()),

    /**
     * Plugin manifest: .claude-plugin/plugin.json
     */
    PLUGIN("plugin", new PluginScorer()),

    /**
     * Output style: output-styles/*.md
     */
    OUTPUT_STYLE("output-style", new OutputStyleScorer());

    private final String label;
    private final Scorer scorer;

    ComponentType(String label, Scorer scorer) {
        this.label = label;
        this.scorer = scorer;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    /**
     * Shared scorer; scorers are stateless
     */
    public Scorer getScorer() {
        return scorer;
    }

    /**
     * Whether the whole file is a JSON manifest rather than markdown with frontmatter
     */
    public boolean isJsonManifest() {
        return this == PLUGIN;
    }

    /**
     * Look up by label ("output-style") or constant name ("OUTPUT_STYLE"), ignoring case
     */
    public static Optional<ComponentType> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        return Arrays.stream(values())
            .filter(type -> type.label.equals(normalized))
            .findFirst();
    }
}
