package com.example.pdfrenamer.service.settings;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-oriented view of an INI file. Lookups follow the usual INI reading
 * rules (case-sensitive section names, case-insensitive keys, {@code =} or
 * {@code :} as delimiter, full-line {@code #} and {@code ;} comments, indented
 * continuation lines). Values keep any inline {@code #} or {@code ;}.
 * Updates touch only the line of the updated key, so rendering gives back the
 * original text everywhere else.
 */
final class IniDocument {

    private static final Pattern SECTION = Pattern.compile("\\[(.+)]");

    private final List<String> lines;
    private final String separator;
    private final boolean trailingSeparator;

    private IniDocument(List<String> lines, String separator, boolean trailingSeparator) {
        this.lines = lines;
        this.separator = separator;
        this.trailingSeparator = trailingSeparator;
    }

    static IniDocument empty() {
        return new IniDocument(new ArrayList<>(), System.lineSeparator(), true);
    }

    static IniDocument parse(String text) {
        if (text.startsWith("\uFEFF")) {
            text = text.substring(1);
        }
        if (text.isEmpty()) {
            return empty();
        }
        String separator = text.contains("\r\n") ? "\r\n" : "\n";
        boolean trailing = text.endsWith("\n");
        List<String> lines = new ArrayList<>(List.of(text.split("\r?\n", -1)));
        if (trailing) {
            lines.remove(lines.size() - 1);
        }
        return new IniDocument(lines, separator, trailing);
    }

    Optional<String> get(String section, String key) {
        String wanted = key.toLowerCase(Locale.ROOT);
        return entries().stream()
                .filter(entry -> entry.section().equals(section) && entry.key().equals(wanted))
                .map(Entry::value)
                .findFirst();
    }

    /**
     * Replaces the entry for {@code key} in place, or adds it after the last
     * entry of {@code section}, creating the section at the end when missing.
     */
    void set(String section, String key, String value) {
        String wanted = key.toLowerCase(Locale.ROOT);
        String line = key + " = " + value;
        int insertAt = -1;
        for (Entry entry : entries()) {
            if (!entry.section().equals(section)) {
                continue;
            }
            if (entry.key().equals(wanted)) {
                lines.subList(entry.line() + 1, entry.end()).clear();
                lines.set(entry.line(), line);
                return;
            }
            insertAt = entry.end();
        }
        if (insertAt < 0) {
            int header = headerLine(section);
            if (header >= 0) {
                insertAt = header + 1;
            }
        }
        if (insertAt >= 0) {
            lines.add(insertAt, line);
            return;
        }
        if (!lines.isEmpty() && !lines.get(lines.size() - 1).isBlank()) {
            lines.add("");
        }
        lines.add("[" + section + "]");
        lines.add(line);
    }

    String render() {
        String body = String.join(separator, lines);
        return trailingSeparator && !lines.isEmpty() ? body + separator : body;
    }

    private int headerLine(String section) {
        for (int i = 0; i < lines.size(); i++) {
            if (section.equals(sectionName(lines.get(i)))) {
                return i;
            }
        }
        return -1;
    }

    private List<Entry> entries() {
        List<Entry> entries = new ArrayList<>();
        String section = null;
        int i = 0;
        while (i < lines.size()) {
            String line = lines.get(i);
            String header = sectionName(line);
            if (header != null) {
                section = header;
                i++;
                continue;
            }
            int delimiter = delimiterIndex(line);
            if (section == null || isBlankOrComment(line) || delimiter < 0) {
                i++;
                continue;
            }
            StringBuilder value = new StringBuilder(line.substring(delimiter + 1).trim());
            int end = i + 1;
            while (end < lines.size() && isContinuation(lines.get(end))) {
                value.append('\n').append(lines.get(end).trim());
                end++;
            }
            String key = line.substring(0, delimiter).trim().toLowerCase(Locale.ROOT);
            entries.add(new Entry(section, key, i, end, value.toString()));
            i = end;
        }
        return entries;
    }

    private static String sectionName(String line) {
        String stripped = line.strip();
        if (isBlankOrComment(stripped)) {
            return null;
        }
        Matcher matcher = SECTION.matcher(stripped);
        return matcher.lookingAt() ? matcher.group(1) : null;
    }

    private static boolean isBlankOrComment(String line) {
        String stripped = line.strip();
        return stripped.isEmpty() || stripped.startsWith("#") || stripped.startsWith(";");
    }

    private static boolean isContinuation(String line) {
        return !line.isBlank() && Character.isWhitespace(line.charAt(0)) && !isBlankOrComment(line);
    }

    private static int delimiterIndex(String line) {
        int equals = line.indexOf('=');
        int colon = line.indexOf(':');
        if (equals < 0) {
            return colon;
        }
        return colon < 0 ? equals : Math.min(equals, colon);
    }

    private record Entry(String section, String key, int line, int end, String value) {
    }
}
