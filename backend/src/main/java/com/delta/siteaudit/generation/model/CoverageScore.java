package com.delta.siteaudit.generation.model;

import java.util.List;

/**
 * Breakdown of the decision readiness audit by status. Always derived from the item list.
 */
public record CoverageScore(int present, int weak, int missing, int total) {

    public static CoverageScore of(List<ReadinessItem> items) {
        int present = 0;
        int weak = 0;
        int missing = 0;
        for (ReadinessItem item : items) {
            switch (item.status()) {
                case PRESENT -> present++;
                case WEAK -> weak++;
                case MISSING -> missing++;
            }
        }
        return new CoverageScore(present, weak, missing, items.size());
    }
}
