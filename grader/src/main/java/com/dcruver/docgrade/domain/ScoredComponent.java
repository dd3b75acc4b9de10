package com.dcruver.docgrade.domain;

import com.dcruver.docgrade.domain.scoring.QualityScore;
import lombok.Builder;
import lombok.Data;

/**
 * A graded component file.
 */
@Data
@Builder
public class ScoredComponent {
    private final String path;  // Relative to the scanned root, forward slashes
    private final ComponentType type;
    private final QualityScore score;
}
