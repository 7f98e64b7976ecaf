package com.dcruver.marginnote.domain;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * A notebook or document topic. The classification is computed once, at mapping time.
 */
@Data
@Builder
public class TopicRecord {
    private final String topicId;
    private final String title;
    private final TopicType type;
    private final String parentTopicId;
    private final Instant createDate;
    private final Instant modifyDate;
}
