package com.dcruver.marginnote.domain;

import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Note records that describe the same annotation, with the record chosen to represent them.
 */
@Data
public class ContentGroup {
    private String masterNoteId;
    private final Set<String> memberIds = new LinkedHashSet<>();
    private final List<NoteRecord> members = new ArrayList<>();
    private NoteRecord master;
    private TopicType groupType = TopicType.UNKNOWN;
    private GroupingState state = GroupingState.UNASSIGNED;

    public void addMember(NoteRecord record) {
        if (memberIds.add(record.getNoteId())) {
            members.add(record);
        }
        state = GroupingState.GROUPED;
    }

    public void selectMaster(NoteRecord record, TopicType type) {
        if (!memberIds.contains(record.getNoteId())) {
            throw new GroupingInvariantException("Master " + record.getNoteId() + " is not a member of its group");
        }
        this.master = record;
        this.masterNoteId = record.getNoteId();
        this.groupType = type;
        this.state = GroupingState.MASTER_SELECTED;
    }

    public int size() {
        return members.size();
    }

    public boolean isSingleton() {
        return members.size() == 1;
    }
}
