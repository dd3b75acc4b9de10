package com.dcruver.docgrade.domain.scoring;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Decides whether a skill is a thin router: a dispatch table into references/ files
 * rather than inline methodology.
 *
 * A body with any methodology marker is never a thin router. Otherwise at least
 * {@value #QUORUM} of the four routing indicators must hold; a single indicator is not enough.
 */
@Slf4j
public final class ThinRouterClassifier {

    static final int QUORUM = 2;
    static final int SHORT_SKILL_LINES = 150;

    private static final List<Pattern> METHODOLOGY_MARKERS = List.of(
        Pattern.compile("## Workflow", Pattern.CASE_INSENSITIVE),
        Pattern.compile("### Phase \\d", Pattern.CASE_INSENSITIVE),
        Pattern.compile("## Algorithm", Pattern.CASE_INSENSITIVE),
        Pattern.compile("## Process", Pattern.CASE_INSENSITIVE),
        Pattern.compile("### Step \\d", Pattern.CASE_INSENSITIVE)
    );

    // | Intent | Read(references/foo.md) |
    private static final Pattern TABLE_ROUTE = Pattern.compile("\\|.*\\|\\s*Read\\(references/");

    private ThinRouterClassifier() {
    }

    /**
     * True when the body carries workflow, phase, algorithm, process or step markers
     */
    public static boolean isMethodology(String body) {
        return METHODOLOGY_MARKERS.stream().anyMatch(p -> p.matcher(body).find());
    }

    public static boolean isThinRouter(String body, int lineCount) {
        if (isMethodology(body)) {
            return false;
        }
        int indicators = countIndicators(body, lineCount);
        boolean thinRouter = indicators >= QUORUM;
        log.debug("Skill routing indicators: {} of 4 (thin router: {})", indicators, thinRouter);
        return thinRouter;
    }

    /**
     * Number of routing indicators present, ignoring methodology markers
     */
    public static int countIndicators(String body, int lineCount) {
        int count = 0;
        if (body.contains("references/")) {
            count++;
        }
        if (body.contains("degeneralized") || body.contains("Degeneralization")) {
            count++;
        }
        if (lineCount < SHORT_SKILL_LINES && body.contains("Read(references/")) {
            count++;
        }
        if (TABLE_ROUTE.matcher(body).find()) {
            count++;
        }
        return count;
    }
}
