package com.dcruver.marginnote.domain;

/**
 * Classification of a topic derived from its ownership blob.
 * Declaration order is the master-selection priority.
 */
public enum TopicType {
    PROJECT,
    BOOK,
    REVIEW_TOPIC,
    GENERAL,
    UNKNOWN
}
