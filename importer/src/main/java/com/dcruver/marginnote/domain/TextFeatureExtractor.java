package com.dcruver.marginnote.domain;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls hashtags, cross-note links and remaining free text out of note text.
 * Word counting treats every CJK ideograph, kana and Hangul syllable as a word.
 */
public class TextFeatureExtractor {

    private static final Pattern HASHTAG = Pattern.compile("[#＃]([^\\s#＃]+)");
    private static final Pattern LEADING_MARKERS = Pattern.compile("^[#＃]+");

    private static final List<Pattern> LIST_PATTERNS = List.of(
        Pattern.compile("^\\s*[(\\[{]?\\d+[)\\]}.: -]+\\s*"),
        Pattern.compile("^\\s*[(\\[{]?[A-Z][)\\]}.: -]+\\s*"),
        Pattern.compile("^\\s*[(\\[{]?[a-z][)\\]}.: -]+\\s*"),
        Pattern.compile("^\\s*[(\\[{]?[IVXLCDM]+[)\\]}.: -]+\\s*"),
        Pattern.compile("^\\s*[(\\[{]?[ivxlcdm]+[)\\]}.: -]+\\s*"),
        Pattern.compile("^\\s*[-*•]\\s+")
    );

    private static final Pattern CJK = Pattern.compile("[\\u4e00-\\u9fff\\u3400-\\u4dbf\\uf900-\\ufaff]");
    private static final Pattern KANA = Pattern.compile("[\\u3040-\\u309f\\u30a0-\\u30ff]");
    private static final Pattern HANGUL = Pattern.compile("[\\uac00-\\ud7af]");
    private static final Pattern LATIN_LETTER = Pattern.compile("[a-zA-Z]");
    private static final Pattern LATIN_WORD = Pattern.compile("\\b[a-zA-Z]+\\b");

    private final String linkPrefix;
    private final Pattern linkPattern;

    public TextFeatureExtractor(String linkScheme) {
        this.linkPrefix = linkScheme + "://note/";
        this.linkPattern = Pattern.compile(Pattern.quote(linkPrefix) + "([A-Za-z0-9\\-]+)");
    }

    public String getLinkPrefix() {
        return linkPrefix;
    }

    /**
     * All features of a piece of text
     */
    public TextFeatures extract(String text) {
        if (text == null || text.isBlank()) {
            return TextFeatures.EMPTY;
        }
        List<String> otherText = extractOtherText(text);
        return new TextFeatures(
            extractHashtags(text),
            extractLinks(text),
            otherText,
            isList(otherText) ? TextStyle.LIST : TextStyle.PROSE,
            detectLanguage(text),
            countWords(text));
    }

    /**
     * Hashtags in first-seen order. A line starting with a marker is one tag unless it holds several markers.
     */
    public List<String> extractHashtags(String text) {
        Set<String> tags = new LinkedHashSet<>();
        if (text == null) {
            return new ArrayList<>();
        }
        for (String line : text.split("\\R")) {
            String trimmed = line.trim();
            if (isHashtagLine(trimmed)) {
                String rest = LEADING_MARKERS.matcher(trimmed).replaceFirst("").trim();
                if (!rest.isEmpty() && !HASHTAG.matcher(rest).find()) {
                    tags.add(rest);
                    continue;
                }
            }
            Matcher m = HASHTAG.matcher(trimmed);
            while (m.find()) {
                tags.add(m.group(1));
            }
        }
        return new ArrayList<>(tags);
    }

    /**
     * Ids of notes referenced through the link scheme, in first-seen order
     */
    public List<String> extractLinks(String text) {
        Set<String> links = new LinkedHashSet<>();
        if (text == null) {
            return new ArrayList<>();
        }
        Matcher m = linkPattern.matcher(text);
        while (m.find()) {
            links.add(m.group(1));
        }
        return new ArrayList<>(links);
    }

    /**
     * Non-empty lines that are neither hashtag lines nor link lines
     */
    public List<String> extractOtherText(String text) {
        List<String> lines = new ArrayList<>();
        if (text == null) {
            return lines;
        }
        for (String line : text.split("\\R")) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || isHashtagLine(trimmed) || trimmed.startsWith(linkPrefix)) {
                continue;
            }
            lines.add(trimmed);
        }
        return lines;
    }

    public boolean isHashtagLine(String trimmed) {
        return trimmed.startsWith("#") || trimmed.startsWith("＃");
    }

    /**
     * At least two lines, at least half of them starting with a list marker
     */
    public boolean isList(List<String> lines) {
        if (lines.size() < 2) {
            return false;
        }
        int matching = 0;
        for (String line : lines) {
            String trimmed = line.trim();
            if (LIST_PATTERNS.stream().anyMatch(p -> p.matcher(trimmed).find())) {
                matching++;
            }
        }
        return matching * 2 >= lines.size();
    }

    public int countWords(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return count(CJK, text) + count(KANA, text) + count(HANGUL, text) + count(LATIN_WORD, text);
    }

    /**
     * Dominant script: chinese, japanese, korean, latin, mixed or unknown
     */
    public String detectLanguage(String text) {
        if (text == null || text.isBlank()) {
            return "unknown";
        }
        double total = text.trim().length();
        double[] ratios = {
            count(CJK, text) / total,
            count(KANA, text) / total,
            count(HANGUL, text) / total,
            count(LATIN_LETTER, text) / total
        };
        String[] names = {"chinese", "japanese", "korean", "latin"};

        int best = 0;
        for (int i = 1; i < ratios.length; i++) {
            if (ratios[i] > ratios[best]) {
                best = i;
            }
        }
        if (ratios[best] < 0.1) {
            return "unknown";
        }
        return ratios[best] < 0.5 ? "mixed" : names[best];
    }

    private static int count(Pattern pattern, String text) {
        Matcher m = pattern.matcher(text);
        int n = 0;
        while (m.find()) {
            n++;
        }
        return n;
    }

    /**
     * Features of one text block.
     */
    public record TextFeatures(
        List<String> hashtags,
        List<String> links,
        List<String> otherText,
        TextStyle style,
        String language,
        int wordCount
    ) {
        public static final TextFeatures EMPTY =
            new TextFeatures(List.of(), List.of(), List.of(), TextStyle.PROSE, "unknown", 0);
    }
}
