package com.dcruver.marginnote.domain;

public enum GroupingState {
    UNASSIGNED,
    GROUPED,
    MASTER_SELECTED
}
