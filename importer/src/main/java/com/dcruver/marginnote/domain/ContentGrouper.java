package com.dcruver.marginnote.domain;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups note records that refer to each other through merge ids, external ids or links,
 * then picks each group's master record.
 */
@Slf4j
public class ContentGrouper {

    private static final List<TopicType> MASTER_PRIORITY = List.of(TopicType.PROJECT, TopicType.BOOK,
        TopicType.REVIEW_TOPIC);

    /**
     * Build groups in first-appearance order of the records
     */
    public List<ContentGroup> group(List<NoteRecord> records, Map<String, TopicRecord> topics) {
        Map<String, NoteRecord> byId = new LinkedHashMap<>();
        for (NoteRecord record : records) {
            if (byId.putIfAbsent(record.getNoteId(), record) != null) {
                log.warn("Duplicate note id {}, keeping the first record", record.getNoteId());
            }
        }

        UnionFind unionFind = new UnionFind();
        byId.keySet().forEach(unionFind::add);

        for (NoteRecord record : byId.values()) {
            String id = record.getNoteId();
            if (record.isMerged()) {
                unionFind.union(id, record.getGroupNoteId());
            }
            if (!NoteRecord.isBlank(record.getExternalId())) {
                unionFind.union(id, record.getExternalId());
            }
            for (String linkId : record.getLinkIds()) {
                if (byId.containsKey(linkId)) {
                    unionFind.union(id, linkId);
                }
            }
        }

        List<ContentGroup> groups = new ArrayList<>();
        for (List<String> partition : unionFind.partitions()) {
            ContentGroup group = new ContentGroup();
            for (String id : partition) {
                // merge and external ids need not name a record
                NoteRecord record = byId.get(id);
                if (record != null) {
                    group.addMember(record);
                }
            }
            if (group.getMembers().isEmpty()) {
                continue;
            }
            selectMaster(group, byId, topics);
            groups.add(group);
        }

        log.info("Grouped {} notes into {} groups", byId.size(), groups.size());
        return groups;
    }

    /**
     * Highest-priority topic bucket wins; within it an original record, else the first member.
     */
    void selectMaster(ContentGroup group, Map<String, NoteRecord> byId, Map<String, TopicRecord> topics) {
        Map<TopicType, List<NoteRecord>> buckets = new EnumMap<>(TopicType.class);
        for (String id : group.getMemberIds()) {
            NoteRecord member = byId.get(id);
            if (member == null) {
                throw new GroupingInvariantException("Group member " + id + " has no record");
            }
            buckets.computeIfAbsent(topicType(member, topics), t -> new ArrayList<>()).add(member);
        }

        // members of any other classification compete in member order
        List<NoteRecord> candidates = group.getMembers();
        for (TopicType type : MASTER_PRIORITY) {
            if (buckets.containsKey(type)) {
                candidates = buckets.get(type);
                break;
            }
        }

        NoteRecord master = candidates.stream()
            .filter(NoteRecord::isOriginal)
            .findFirst()
            .orElse(candidates.get(0));
        group.selectMaster(master, topicType(master, topics));
    }

    private static TopicType topicType(NoteRecord record, Map<String, TopicRecord> topics) {
        if (record.getTopicId() == null) {
            return TopicType.UNKNOWN;
        }
        TopicRecord topic = topics.get(record.getTopicId());
        return topic != null && topic.getType() != null ? topic.getType() : TopicType.UNKNOWN;
    }

    /**
     * Summary counts over a grouping result
     */
    public GroupingStatistics statistics(List<ContentGroup> groups) {
        int single = 0;
        int largest = 0;
        int notes = 0;
        int withTags = 0;
        int withLinks = 0;
        int withMedia = 0;
        int withContent = 0;

        for (ContentGroup group : groups) {
            if (group.isSingleton()) {
                single++;
            }
            largest = Math.max(largest, group.size());
            notes += group.size();
            for (NoteRecord record : group.getMembers()) {
                if (!record.getHashtags().isEmpty()) {
                    withTags++;
                }
                if (!record.getLinkIds().isEmpty()) {
                    withLinks++;
                }
                if (!record.getMediaHashes().isEmpty()) {
                    withMedia++;
                }
                if (record.hasContent()) {
                    withContent++;
                }
            }
        }
        double average = groups.isEmpty() ? 0 : (double) notes / groups.size();
        return new GroupingStatistics(groups.size(), single, groups.size() - single, largest, average,
            withTags, withLinks, withMedia, withContent);
    }
}
