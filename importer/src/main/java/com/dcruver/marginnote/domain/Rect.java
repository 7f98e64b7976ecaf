package com.dcruver.marginnote.domain;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A page-space rectangle.
 */
public record Rect(double x, double y, double width, double height) {

    private static final String NUMBER = "(-?[0-9]+(?:\\.[0-9]+)?(?:[eE][-+]?[0-9]+)?)";
    private static final Pattern CG_RECT = Pattern.compile(
        "\\{\\{\\s*" + NUMBER + "\\s*,\\s*" + NUMBER + "\\s*}\\s*,\\s*\\{\\s*" + NUMBER + "\\s*,\\s*" + NUMBER + "\\s*}}");
    private static final Pattern FLAT = Pattern.compile(
        "^\\s*" + NUMBER + "\\s*,\\s*" + NUMBER + "\\s*,\\s*" + NUMBER + "\\s*,\\s*" + NUMBER + "\\s*$");

    /**
     * Parse {@code {{x, y}, {w, h}}} or {@code x,y,w,h}
     */
    public static Optional<Rect> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        Matcher m = CG_RECT.matcher(text);
        if (!m.find()) {
            m = FLAT.matcher(text);
            if (!m.find()) {
                return Optional.empty();
            }
        }
        return Optional.of(new Rect(
            Double.parseDouble(m.group(1)),
            Double.parseDouble(m.group(2)),
            Double.parseDouble(m.group(3)),
            Double.parseDouble(m.group(4))));
    }
}
