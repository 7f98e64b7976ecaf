package com.dcruver.marginnote.domain;

import java.util.List;

/**
 * One single-record group per surviving annotation, plus the run's report.
 */
public record DeduplicationResult(List<ContentGroup> groups, DeduplicationReport report) {

    public List<NoteRecord> records() {
        return groups.stream().map(ContentGroup::getMaster).toList();
    }
}
