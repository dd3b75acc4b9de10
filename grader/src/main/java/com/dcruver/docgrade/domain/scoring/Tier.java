package com.dcruver.docgrade.domain.scoring;

/**
 * Letter grade derived from the overall score.
 */
public enum Tier {
    A(85),
    B(70),
    C(50),
    D(30),
    F(0);

    private final int minScore;

    Tier(int minScore) {
        this.minScore = minScore;
    }

    public int getMinScore() {
        return minScore;
    }

    /**
     * Map an overall score to its tier: A >= 85, B >= 70, C >= 50, D >= 30, else F.
     */
    public static Tier fromScore(int score) {
        for (Tier tier : values()) {
            if (score >= tier.minScore) {
                return tier;
            }
        }
        return F;
    }
}
