package com.dcruver.marginnote.domain;

/**
 * Counters collected while deduplicating.
 */
public record DeduplicationReport(
    int totalGroupsProcessed,
    int mergedContentFound,
    int originalContentPreserved,
    int duplicatesRemoved,
    int contentCombined,
    int groupsDropped,
    ValidationReport validation
) {
    public double duplicateRemovalRate() {
        return validation.originalCount() == 0 ? 0 : (double) duplicatesRemoved / validation.originalCount();
    }

    public double contentCombinationRate() {
        return totalGroupsProcessed == 0 ? 0 : (double) contentCombined / totalGroupsProcessed;
    }
}
