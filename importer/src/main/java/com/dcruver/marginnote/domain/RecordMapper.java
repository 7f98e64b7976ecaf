package com.dcruver.marginnote.domain;

import com.dcruver.marginnote.plist.ArchivedBlobDecoder;
import com.dcruver.marginnote.plist.BinaryPlistParser;
import com.dcruver.marginnote.plist.DecodedBlob;
import com.dcruver.marginnote.plist.PlistDecodeException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Maps raw database rows and their archived blob columns onto the record model.
 */
@Slf4j
public class RecordMapper {

    static final List<String> NOTE_ID = List.of("ZNOTEID");
    static final List<String> TOPIC_ID = List.of("ZTOPICID");
    static final List<String> GROUP_NOTE_ID = List.of("ZGROUPNOTEID");
    static final List<String> EXTERNAL_ID = List.of("ZEVERNOTEID", "ZEVERNOTE_ID");
    static final List<String> EXCERPT_TEXT = List.of("ZHIGHLIGHT_TEXT");
    static final List<String> NOTES_TEXT = List.of("ZNOTES_TEXT");
    static final List<String> NOTE_TITLE = List.of("ZNOTETITLE", "ZNOTE_TITLE");
    static final List<String> NOTE_DATE = List.of("ZNOTE_DATE");
    static final List<String> HIGHLIGHT_DATE = List.of("ZHIGHLIGHT_DATE");
    static final List<String> START_PAGE = List.of("ZSTARTPAGE", "ZSTART_PAGE");
    static final List<String> END_PAGE = List.of("ZENDPAGE", "ZEND_PAGE");
    static final List<String> BOOK_MD5 = List.of("ZBOOKMD5");
    static final List<String> NOTES_BLOB = List.of("ZNOTES");
    static final List<String> HIGHLIGHTS_BLOB = List.of("ZHIGHLIGHTS");
    static final List<String> EXCERPT_PIC_BLOB = List.of("ZHIGHLIGHT_PIC", "ZEXCERPT_PIC");
    static final List<String> MEDIA_LIST = List.of("ZMEDIA_LIST");

    static final List<String> TOPIC_TITLE = List.of("ZTITLE");
    static final List<String> FORUM_OWNER = List.of("ZFORUMOWNER");
    static final List<String> PARENT_TOPIC = List.of("ZPARENT_TOPIC", "ZPARENTTOPIC");
    static final List<String> CREATE_DATE = List.of("ZCREATE_DATE");
    static final List<String> MODIFY_DATE = List.of("ZMODIFY_DATE");

    static final List<String> MEDIA_HASH = List.of("ZMD5");
    static final List<String> MEDIA_DATA = List.of("ZDATA");

    static final String LINK_NOTE_TYPE = "LinkNote";
    static final String DEFAULT_LINK_TEXT = "Linked Note";

    private final ArchivedBlobDecoder blobDecoder;
    private final TextFeatureExtractor textFeatures;
    private final MediaClassifier mediaClassifier;
    private final ObjectMapper objectMapper;

    public RecordMapper(ArchivedBlobDecoder blobDecoder, TextFeatureExtractor textFeatures,
                        MediaClassifier mediaClassifier, ObjectMapper objectMapper) {
        this.blobDecoder = blobDecoder;
        this.textFeatures = textFeatures;
        this.mediaClassifier = mediaClassifier;
        this.objectMapper = objectMapper;
    }

    /**
     * Map a note row, decoding its notes and highlights blobs.
     * A decode error only escapes in strict mode.
     */
    public NoteRecord mapNote(Map<String, Object> row) throws RowMappingException, PlistDecodeException {
        DecodedBlob notes;
        DecodedBlob highlights;
        try {
            notes = blobDecoder.decode(blob(row, NOTES_BLOB));
            highlights = blobDecoder.decode(blob(row, HIGHLIGHTS_BLOB));
        } catch (RuntimeException e) {
            throw new RowMappingException("Note " + string(row, NOTE_ID) + ": " + e.getMessage(), e);
        }
        return mapNote(row, notes, highlights);
    }

    /**
     * Map a note row whose two blob columns have already been decoded
     */
    public NoteRecord mapNote(Map<String, Object> row, DecodedBlob notes, DecodedBlob highlights)
        throws RowMappingException, PlistDecodeException {
        String noteId = string(row, NOTE_ID);
        if (NoteRecord.isBlank(noteId)) {
            throw new RowMappingException("Note row has no ZNOTEID");
        }

        try {
            NoteRecord record = NoteRecord.builder()
                .noteId(noteId)
                .topicId(string(row, TOPIC_ID))
                .groupNoteId(string(row, GROUP_NOTE_ID))
                .externalId(string(row, EXTERNAL_ID))
                .excerptText(string(row, EXCERPT_TEXT))
                .notesText(string(row, NOTES_TEXT))
                .noteTitle(string(row, NOTE_TITLE))
                .noteDate(timestamp(row, NOTE_DATE))
                .highlightDate(timestamp(row, HIGHLIGHT_DATE))
                .startPage(integer(row, START_PAGE))
                .endPage(integer(row, END_PAGE))
                .bookMd5(string(row, BOOK_MD5))
                .build();

            List<String> comments = applyNotesBlob(record, notes);
            applyExcerptPic(record, blob(row, EXCERPT_PIC_BLOB));
            applyHighlightsBlob(record, highlights);
            for (String hash : parseMediaList(string(row, MEDIA_LIST))) {
                addUnique(record.getMediaHashes(), hash);
            }
            applyTextFeatures(record, comments);
            return record;
        } catch (RuntimeException e) {
            throw new RowMappingException("Note " + noteId + ": " + e.getMessage(), e);
        }
    }

    /**
     * Map a topic row and classify it from its ownership blob
     */
    public TopicRecord mapTopic(Map<String, Object> row) throws RowMappingException, PlistDecodeException {
        String topicId = string(row, TOPIC_ID);
        if (NoteRecord.isBlank(topicId)) {
            throw new RowMappingException("Topic row has no ZTOPICID");
        }
        try {
            return TopicRecord.builder()
                .topicId(topicId)
                .title(Optional.ofNullable(string(row, TOPIC_TITLE)).orElse(""))
                .type(classifyTopic(value(row, FORUM_OWNER)))
                .parentTopicId(string(row, PARENT_TOPIC))
                .createDate(timestamp(row, CREATE_DATE))
                .modifyDate(timestamp(row, MODIFY_DATE))
                .build();
        } catch (RuntimeException e) {
            throw new RowMappingException("Topic " + topicId + ": " + e.getMessage(), e);
        }
    }

    /**
     * Map a media row and sniff its kind
     */
    public MediaRecord mapMedia(Map<String, Object> row) throws RowMappingException {
        String hash = string(row, MEDIA_HASH);
        if (NoteRecord.isBlank(hash)) {
            throw new RowMappingException("Media row has no ZMD5");
        }
        try {
            return mediaClassifier.classify(hash, blob(row, MEDIA_DATA));
        } catch (RuntimeException e) {
            throw new RowMappingException("Media " + hash + ": " + e.getMessage(), e);
        }
    }

    /**
     * Ownership markers are checked in the order project, review, book.
     */
    TopicType classifyTopic(Object forumOwner) throws PlistDecodeException {
        if (forumOwner == null) {
            return TopicType.UNKNOWN;
        }
        Set<String> keys = new LinkedHashSet<>();
        if (forumOwner instanceof byte[] && isBinaryPlist((byte[]) forumOwner)) {
            DecodedBlob decoded = blobDecoder.decode((byte[]) forumOwner);
            for (Map<String, Object> entry : decoded.entries()) {
                entry.forEach((k, v) -> {
                    if (isTruthy(v)) {
                        keys.add(k);
                    }
                });
            }
            keys.addAll(decoded.recoveredStrings());
        } else {
            String text = forumOwner instanceof byte[]
                ? new String((byte[]) forumOwner, StandardCharsets.UTF_8)
                : String.valueOf(forumOwner);
            try {
                JsonNode node = objectMapper.readTree(text);
                node.fieldNames().forEachRemaining(name -> {
                    if (isTruthy(node.get(name))) {
                        keys.add(name);
                    }
                });
            } catch (JsonProcessingException e) {
                log.debug("Ownership value is not JSON: {}", e.getOriginalMessage());
            }
        }

        if (keys.contains("projectTopic")) {
            return TopicType.PROJECT;
        }
        if (keys.contains("reviewTopic")) {
            return TopicType.REVIEW_TOPIC;
        }
        if (keys.contains("bookTopic")) {
            return TopicType.BOOK;
        }
        return TopicType.GENERAL;
    }

    private List<String> applyNotesBlob(NoteRecord record, DecodedBlob notes) {
        List<String> comments = new ArrayList<>();
        for (Map<String, Object> entry : notes.entries()) {
            String linkedId = stringField(entry, "noteid");
            if (!NoteRecord.isBlank(linkedId)) {
                addUnique(record.getChildNoteIds(), linkedId);
                if (LINK_NOTE_TYPE.equals(stringField(entry, "type"))) {
                    String display = stringField(entry, "q_htext");
                    record.getLinkedNotes().add(new LinkedNote(linkedId,
                        NoteRecord.isBlank(display) ? DEFAULT_LINK_TEXT : display));
                    addUnique(record.getLinkIds(), linkedId);
                }
            }
            String text = stringField(entry, "text");
            if (!NoteRecord.isBlank(text)) {
                comments.add(text);
            }
            String paint = stringField(entry, "paint");
            if (!NoteRecord.isBlank(paint)) {
                addUnique(record.getMediaHashes(), paint);
            }
        }

        for (String s : notes.recoveredStrings()) {
            String trimmed = s.trim();
            if (textFeatures.isHashtagLine(trimmed)) {
                textFeatures.extractHashtags(trimmed).forEach(tag -> addUnique(record.getHashtags(), tag));
            } else if (trimmed.startsWith(textFeatures.getLinkPrefix())) {
                textFeatures.extractLinks(trimmed).forEach(id -> addUnique(record.getLinkIds(), id));
            } else if (trimmed.length() > 1 && !trimmed.startsWith("NS") && !trimmed.startsWith("$")) {
                addUnique(record.getFormattedText(), trimmed);
            }
        }
        return comments;
    }

    private void applyHighlightsBlob(NoteRecord record, DecodedBlob highlights) {
        VisualExcerpt firstRegion = null;
        for (Map<String, Object> entry : highlights.entries()) {
            List<TextSelection> selections = new ArrayList<>();
            for (Object item : listField(entry, "textSelLst")) {
                if (item instanceof Map) {
                    selections.add(toSelection(castMap(item)));
                }
            }

            String text = stringField(entry, "highlight_text");
            String coordsHash = stringField(entry, "coords_hash");
            Optional<Rect> ownRect = Rect.parse(stringField(entry, "rect"));
            if (text != null || coordsHash != null || !selections.isEmpty() || ownRect.isPresent()) {
                record.getHighlights().add(new HighlightFragment(text, coordsHash, selections));
            }

            if (firstRegion == null) {
                if (ownRect.isPresent()) {
                    firstRegion = new VisualExcerpt(pageNo(entry), ownRect.get());
                } else {
                    firstRegion = selections.stream()
                        .filter(s -> s.rect() != null)
                        .findFirst()
                        .map(s -> new VisualExcerpt(s.pageNo(), s.rect()))
                        .orElse(null);
                }
            }
        }
        if (record.getVisualExcerpt() == null && firstRegion != null) {
            record.setVisualExcerpt(firstRegion);
        }
    }

    /**
     * The excerpt picture blob is the row's own clip region, when present
     */
    private void applyExcerptPic(NoteRecord record, byte[] blob) throws PlistDecodeException {
        if (blob == null || blob.length == 0) {
            return;
        }
        for (Map<String, Object> pic : blobDecoder.decode(blob).entries()) {
            String paint = stringField(pic, "paint");
            if (!NoteRecord.isBlank(paint)) {
                addUnique(record.getMediaHashes(), paint);
            }
            List<Map<String, Object>> candidates = new ArrayList<>();
            candidates.add(pic);
            for (Object sel : listField(pic, "selLst")) {
                if (sel instanceof Map) {
                    candidates.add(castMap(sel));
                }
            }
            for (Map<String, Object> candidate : candidates) {
                Optional<Rect> rect = Rect.parse(stringField(candidate, "rect"));
                if (rect.isPresent()) {
                    record.setVisualExcerpt(new VisualExcerpt(pageNo(candidate), rect.get()));
                    return;
                }
            }
        }
    }

    private void applyTextFeatures(NoteRecord record, List<String> comments) {
        List<String> sources = new ArrayList<>();
        sources.add(record.getExcerptText());
        sources.add(record.getNotesText());
        sources.add(record.getNoteTitle());
        sources.addAll(comments);

        StringBuilder all = new StringBuilder();
        for (String source : sources) {
            if (NoteRecord.isBlank(source)) {
                continue;
            }
            all.append(source).append('\n');
        }

        TextFeatureExtractor.TextFeatures features = textFeatures.extract(all.toString());
        features.hashtags().forEach(tag -> addUnique(record.getHashtags(), tag));
        features.links().forEach(id -> addUnique(record.getLinkIds(), id));

        features.otherText().forEach(line -> addUnique(record.getFormattedText(), line));
        record.setFormattedStyle(textFeatures.isList(record.getFormattedText()) ? TextStyle.LIST : TextStyle.PROSE);
        record.setWordCount(features.wordCount());
        record.setLanguage(features.language());
    }

    /**
     * JSON array of hashes (or of objects carrying one), otherwise a dash-separated list
     */
    List<String> parseMediaList(String value) {
        List<String> hashes = new ArrayList<>();
        if (NoteRecord.isBlank(value)) {
            return hashes;
        }
        String trimmed = value.trim();
        if (trimmed.startsWith("[")) {
            try {
                for (JsonNode item : objectMapper.readTree(trimmed)) {
                    String hash = item.isTextual() ? item.asText()
                        : item.path("hash").asText(item.path("mediaHash").asText(""));
                    if (!hash.isBlank()) {
                        hashes.add(hash);
                    }
                }
                return hashes;
            } catch (JsonProcessingException e) {
                log.debug("Media list is not JSON, splitting on dashes: {}", e.getOriginalMessage());
            }
        }
        for (String part : trimmed.split("-")) {
            if (!part.isBlank()) {
                hashes.add(part.trim());
            }
        }
        return hashes;
    }

    private TextSelection toSelection(Map<String, Object> sel) {
        Rect rect = Rect.parse(stringField(sel, "rect")).orElse(null);
        return new TextSelection(pageNo(sel), rect, stringField(sel, "text"));
    }

    private static int pageNo(Map<String, Object> entry) {
        Object page = entry.containsKey("pageNo") ? entry.get("pageNo") : entry.get("page_no");
        if (page instanceof Number && ((Number) page).intValue() > 0) {
            return ((Number) page).intValue();
        }
        return 1;
    }

    private static boolean isBinaryPlist(byte[] data) {
        return data.length >= 6 && new String(data, 0, 6, StandardCharsets.US_ASCII).equals("bplist");
    }

    private static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof JsonNode) {
            JsonNode node = (JsonNode) value;
            return !node.isNull() && !(node.isBoolean() && !node.asBoolean()) && !(node.isNumber() && node.asDouble() == 0)
                && !(node.isTextual() && node.asText().isEmpty());
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue() != 0;
        }
        return !(value instanceof String) || !((String) value).isEmpty();
    }

    static void addUnique(List<String> list, String value) {
        if (value != null && !list.contains(value)) {
            list.add(value);
        }
    }

    // Row access

    static Object value(Map<String, Object> row, List<String> aliases) {
        for (String alias : aliases) {
            Object v = row.get(alias);
            if (v != null) {
                return v;
            }
        }
        return null;
    }

    static String string(Map<String, Object> row, List<String> aliases) {
        Object v = value(row, aliases);
        if (v == null) {
            return null;
        }
        if (v instanceof byte[]) {
            return new String((byte[]) v, StandardCharsets.UTF_8);
        }
        if (v instanceof Double || v instanceof Float) {
            double d = ((Number) v).doubleValue();
            if (d == Math.rint(d)) {
                return Long.toString((long) d);
            }
        }
        return v.toString();
    }

    static byte[] blob(Map<String, Object> row, List<String> aliases) {
        Object v = value(row, aliases);
        if (v instanceof byte[]) {
            return (byte[]) v;
        }
        return v == null ? null : v.toString().getBytes(StandardCharsets.UTF_8);
    }

    static Integer integer(Map<String, Object> row, List<String> aliases) {
        Object v = value(row, aliases);
        if (v instanceof Number) {
            return ((Number) v).intValue();
        }
        if (v instanceof String && !((String) v).isBlank()) {
            return (int) Double.parseDouble(((String) v).trim());
        }
        return null;
    }

    /**
     * Seconds since 2001-01-01, as stored by Core Data
     */
    static Instant timestamp(Map<String, Object> row, List<String> aliases) {
        Object v = value(row, aliases);
        double seconds;
        if (v instanceof Number) {
            seconds = ((Number) v).doubleValue();
        } else if (v instanceof String && !((String) v).isBlank()) {
            seconds = Double.parseDouble(((String) v).trim());
        } else {
            return null;
        }
        return Instant.ofEpochMilli(Math.round((seconds + BinaryPlistParser.APPLE_EPOCH_OFFSET) * 1000));
    }

    private static String stringField(Map<String, Object> entry, String key) {
        Object v = entry.get(key);
        if (v == null || v instanceof Map || v instanceof List) {
            return null;
        }
        if (v instanceof byte[]) {
            return new String((byte[]) v, StandardCharsets.UTF_8);
        }
        return v.toString();
    }

    @SuppressWarnings("unchecked")
    private static List<Object> listField(Map<String, Object> entry, String key) {
        Object v = entry.get(key);
        return v instanceof List ? (List<Object>) v : List.of();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> castMap(Object value) {
        return (Map<String, Object>) value;
    }
}
