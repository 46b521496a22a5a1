package com.podscope.filter.support;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Matches {@code key}, {@code key=} and {@code key=value} label filters. Every filter must match
 * for the labels to match. Keys may use the glob wildcards {@code *} and {@code ?}, which do not
 * cross a {@code /}.
 */
public final class LabelFilters {

    private LabelFilters() {
    }

    public static boolean matches(List<String> filters, Map<String, String> labels) {
        for (String filter : filters) {
            if (!matchesOne(filter, labels)) {
                return false;
            }
        }
        return true;
    }

    static boolean matchesOne(String filter, Map<String, String> labels) {
        int separator = filter.indexOf('=');
        String key = separator < 0 ? filter : filter.substring(0, separator);
        String value = separator < 0 ? "" : filter.substring(separator + 1);
        if (key.isEmpty() || labels == null) {
            return false;
        }
        Pattern keyPattern = globToPattern(key);
        for (Map.Entry<String, String> label : labels.entrySet()) {
            if (!value.isEmpty() && !value.equals(label.getValue())) {
                continue;
            }
            if (key.equals(label.getKey()) || keyPattern.matcher(label.getKey()).matches()) {
                return true;
            }
        }
        return false;
    }

    static Pattern globToPattern(String glob) {
        StringBuilder regex = new StringBuilder(glob.length() + 8);
        StringBuilder literal = new StringBuilder();
        for (char c : glob.toCharArray()) {
            if (c == '*' || c == '?') {
                if (literal.length() > 0) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append(c == '*' ? "[^/]*" : "[^/]");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
        }
        return Pattern.compile(regex.toString());
    }
}
