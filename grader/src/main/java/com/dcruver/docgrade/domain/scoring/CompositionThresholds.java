package com.dcruver.docgrade.domain.scoring;

import lombok.Builder;
import lombok.Value;

/**
 * Size breakpoints for the composition ladder (10/8/6/3/0 points).
 * Each breakpoint is inclusive; anything above overLimit gets the fat note and no points.
 */
@Value
@Builder
public class CompositionThresholds {
    int excellent;
    String excellentNote;
    int good;
    String goodNote;
    int ok;
    String okNote;
    int overLimit;
    String overLimitNote;
    String fatNote;
}
