package com.dcruver.docgrade.domain.scoring;

/**
 * Description-length ladders shared by several document types.
 */
final class DescriptionLadders {

    static final String DESCRIPTION_QUALITY = "Description quality";

    /**
     * Agents and skills: long descriptions drive auto-invocation
     */
    static final GradedLadder LONG_FORM = GradedLadder.builder()
        .atLeast(200, 5, "Comprehensive")
        .atLeast(100, 3, "Adequate")
        .atLeast(1, 1, "Brief")
        .otherwise("Missing")
        .passAt(100)
        .build();

    static final GradedLadder COMMAND = GradedLadder.builder()
        .atLeast(50, 5, "Clear")
        .atLeast(20, 3, "Brief")
        .atLeast(1, 1, "Minimal")
        .otherwise("Missing")
        .passAt(20)
        .build();

    static final GradedLadder PLUGIN = GradedLadder.builder()
        .atLeast(100, 5, "Comprehensive")
        .atLeast(50, 3, "Adequate")
        .atLeast(20, 1, "Brief")
        .otherwise("Too short")
        .passAt(50)
        .build();

    static final GradedLadder OUTPUT_STYLE = GradedLadder.builder()
        .atLeast(100, 5, "Comprehensive")
        .atLeast(50, 3, "Adequate")
        .atLeast(1, 1, "Brief")
        .otherwise("Missing")
        .passAt(50)
        .build();

    private DescriptionLadders() {
    }
}
