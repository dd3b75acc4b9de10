package com.dcruver.docgrade.domain.scoring;

/**
 * The four category methods every document type supplies.
 * Implementations hold no state; {@link ScoreCombiner} drives them.
 */
public interface ScorerComponent {

    CategoryScore scoreStructural(ScoringContext context);

    CategoryScore scorePractices(ScoringContext context);

    CategoryScore scoreComposition(ScoringContext context);

    CategoryScore scoreDocumentation(ScoringContext context);
}
