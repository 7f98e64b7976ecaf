package com.dcruver.marginnote.domain;

import java.util.List;

/**
 * Sanity check of a deduplication run. Issues are advisory only.
 *
 * @param originalCount     members across all input groups
 * @param deduplicatedCount records in the output
 * @param reductionRatio    share of input members that did not survive as output records
 * @param emptyOutputs      output records without any content
 */
public record ValidationReport(
    int originalCount,
    int deduplicatedCount,
    double reductionRatio,
    int emptyOutputs,
    List<String> issues
) {
    public boolean contentPreserved() {
        return issues.isEmpty();
    }
}
