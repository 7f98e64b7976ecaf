package com.dcruver.marginnote.domain;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Reduces each content group to one record. Merged variants win over originals and are
 * back-filled from them; several originals are folded into the first one.
 * Input records are never modified; output records are copies.
 */
@Slf4j
public class Deduplicator {

    private final double reductionWarningThreshold;

    public Deduplicator(double reductionWarningThreshold) {
        this.reductionWarningThreshold = reductionWarningThreshold;
    }

    public DeduplicationResult deduplicate(List<ContentGroup> groups) {
        List<ContentGroup> output = new ArrayList<>();
        int processed = 0;
        int mergedFound = 0;
        int originalsPreserved = 0;
        int duplicatesRemoved = 0;
        int combined = 0;
        int dropped = 0;

        for (ContentGroup group : groups) {
            processed++;
            List<NoteRecord> merged = new ArrayList<>();
            List<NoteRecord> originals = new ArrayList<>();
            for (NoteRecord member : group.getMembers()) {
                (member.isMerged() ? merged : originals).add(member);
            }

            NoteRecord result;
            if (!merged.isEmpty() && !originals.isEmpty()) {
                mergedFound++;
                combined++;
                result = richest(merged).copy();
                supplement(result, originals);
            } else if (!merged.isEmpty()) {
                result = richest(merged).copy();
            } else if (!originals.isEmpty()) {
                originalsPreserved++;
                result = originals.get(0).copy();
                supplement(result, originals.subList(1, originals.size()));
            } else {
                dropped++;
                continue;
            }

            removeDuplicates(result);
            duplicatesRemoved += group.size() - 1;

            ContentGroup single = new ContentGroup();
            single.addMember(result);
            single.selectMaster(result, group.getGroupType());
            output.add(single);
        }

        ValidationReport validation = validate(groups, output);
        DeduplicationReport report = new DeduplicationReport(processed, mergedFound, originalsPreserved,
            duplicatesRemoved, combined, dropped, validation);
        log.info("Deduplicated {} groups into {} records ({} duplicates removed, {} dropped)",
            processed, output.size(), duplicatesRemoved, dropped);
        return new DeduplicationResult(output, report);
    }

    /**
     * Content richness. Text lengths are measured after trimming.
     */
    public int score(NoteRecord note) {
        int score = 0;
        score += trimmedLength(note.getExcerptText());
        score += trimmedLength(note.getNotesText()) * 2;
        score += trimmedLength(note.getNoteTitle()) * 3;
        score += note.getHashtags().size() * 10;
        score += note.getLinkIds().size() * 5;
        score += note.getFormattedText().size() * 2;
        score += note.getMediaHashes().size() * 15;
        if (note.getVisualExcerpt() != null) {
            score += 20;
        }
        return score;
    }

    /**
     * Highest score, first one on ties
     */
    NoteRecord richest(List<NoteRecord> candidates) {
        NoteRecord best = candidates.get(0);
        int bestScore = score(best);
        for (int i = 1; i < candidates.size(); i++) {
            int s = score(candidates.get(i));
            if (s > bestScore) {
                best = candidates.get(i);
                bestScore = s;
            }
        }
        return best;
    }

    /**
     * Fill what the master lacks from the donors. Lists are unioned with the master's entries first.
     */
    void supplement(NoteRecord master, List<NoteRecord> donors) {
        for (NoteRecord donor : donors) {
            if (NoteRecord.isBlank(master.getExcerptText()) && !NoteRecord.isBlank(donor.getExcerptText())) {
                master.setExcerptText(donor.getExcerptText());
            }
            if (NoteRecord.isBlank(master.getNotesText()) && !NoteRecord.isBlank(donor.getNotesText())) {
                master.setNotesText(donor.getNotesText());
            }
            if (NoteRecord.isBlank(master.getNoteTitle()) && !NoteRecord.isBlank(donor.getNoteTitle())) {
                master.setNoteTitle(donor.getNoteTitle());
            }
            if (master.getVisualExcerpt() == null && donor.getVisualExcerpt() != null) {
                master.setVisualExcerpt(donor.getVisualExcerpt());
            }
            union(master.getHashtags(), donor.getHashtags());
            union(master.getLinkIds(), donor.getLinkIds());
            union(master.getLinkedNotes(), donor.getLinkedNotes());
            union(master.getChildNoteIds(), donor.getChildNoteIds());
            union(master.getFormattedText(), donor.getFormattedText());
            union(master.getMediaHashes(), donor.getMediaHashes());
            union(master.getHighlights(), donor.getHighlights());
        }
    }

    /**
     * First occurrence wins. Free text compares trimmed and drops blanks.
     */
    void removeDuplicates(NoteRecord note) {
        note.setHashtags(new ArrayList<>(new LinkedHashSet<>(note.getHashtags())));
        note.setLinkIds(new ArrayList<>(new LinkedHashSet<>(note.getLinkIds())));
        note.setLinkedNotes(new ArrayList<>(new LinkedHashSet<>(note.getLinkedNotes())));
        note.setChildNoteIds(new ArrayList<>(new LinkedHashSet<>(note.getChildNoteIds())));
        note.setMediaHashes(new ArrayList<>(new LinkedHashSet<>(note.getMediaHashes())));

        Set<String> seen = new LinkedHashSet<>();
        List<String> text = new ArrayList<>();
        for (String fragment : note.getFormattedText()) {
            String trimmed = fragment == null ? "" : fragment.trim();
            if (!trimmed.isEmpty() && seen.add(trimmed)) {
                text.add(fragment);
            }
        }
        note.setFormattedText(text);
    }

    ValidationReport validate(List<ContentGroup> input, List<ContentGroup> output) {
        int originalCount = input.stream().mapToInt(ContentGroup::size).sum();
        int finalCount = output.size();
        double reduction = originalCount > 0 ? (double) (originalCount - finalCount) / originalCount : 0;

        List<String> issues = new ArrayList<>();
        if (reduction > reductionWarningThreshold) {
            issues.add(String.format("High reduction ratio: %.1f%%", reduction * 100));
        }
        int empty = (int) output.stream().filter(g -> !g.getMaster().hasContent()).count();
        if (empty > 0) {
            issues.add(String.format("%d records without content", empty));
        }
        if (!issues.isEmpty()) {
            log.warn("Deduplication check: {}", String.join("; ", issues));
        }
        return new ValidationReport(originalCount, finalCount, reduction, empty, issues);
    }

    private static <T> void union(List<T> target, List<T> extra) {
        for (T item : extra) {
            if (!target.contains(item)) {
                target.add(item);
            }
        }
    }

    private static int trimmedLength(String s) {
        return s == null ? 0 : s.trim().length();
    }
}
