package com.epcid.clinical;

/**
 * Clinical quick-reference age buckets. Lower bound inclusive, upper bound
 * exclusive, so a child exactly on a boundary lands in the older bucket.
 */
public enum AgeGroup {
    INFANT(0, 12),
    TODDLER(12, 36),
    PRESCHOOL(36, 72),
    SCHOOL(72, 144),
    ADOLESCENT(144, Integer.MAX_VALUE);

    private final int minMonths;
    private final int maxMonths;

    AgeGroup(int minMonths, int maxMonths) {
        this.minMonths = minMonths;
        this.maxMonths = maxMonths;
    }

    public int getMinMonths() {
        return minMonths;
    }

    public int getMaxMonths() {
        return maxMonths;
    }

    public boolean contains(int ageMonths) {
        return ageMonths >= minMonths && ageMonths < maxMonths;
    }

    public static AgeGroup forAgeMonths(int ageMonths) {
        if (ageMonths < 0) {
            throw new IllegalArgumentException("ageMonths must be >= 0, got " + ageMonths);
        }
        for (AgeGroup group : values()) {
            if (group.contains(ageMonths)) {
                return group;
            }
        }
        return ADOLESCENT;
    }
}
