package com.dcruver.docgrade.domain.scoring;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Aggregation shared by every scorer: run the four category methods in order
 * (structural, practices, composition, documentation) and sum them into a {@link QualityScore}.
 */
public final class ScoreCombiner {

    private ScoreCombiner() {
    }

    public static QualityScore computeCombinedScore(String content, Map<String, Object> frontmatter, String body,
                                                    ScorerComponent component) {
        ScoringContext context = ScoringContext.builder()
            .content(content != null ? content : "")
            .frontmatter(frontmatter != null ? frontmatter : Map.of())
            .body(body != null ? body : "")
            .lineCount(ScoringRules.countLines(content))
            .build();

        CategoryScore structural = component.scoreStructural(context);
        CategoryScore practices = component.scorePractices(context);
        CategoryScore composition = component.scoreComposition(context);
        CategoryScore documentation = component.scoreDocumentation(context);

        List<Metric> details = new ArrayList<>();
        details.addAll(structural.getDetails());
        details.addAll(practices.getDetails());
        details.addAll(composition.getDetails());
        details.addAll(documentation.getDetails());

        return QualityScore.of(structural.getPoints(), practices.getPoints(), composition.getPoints(),
            documentation.getPoints(), details);
    }
}
