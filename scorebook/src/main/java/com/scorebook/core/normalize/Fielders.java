package com.scorebook.core.normalize;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Números de posición (1-9) nombrados en la descripción. */
final class Fielders {
    private Fielders(){}

    private static final String POSITIONS =
            "pitcher|catcher|first baseman|second baseman|third baseman|shortstop|short stop"
            + "|left fielder|center fielder|centre fielder|right fielder";
    private static final Pattern NAMED = Pattern.compile(
            "(?i:\\b(" + POSITIONS + ")\\b)|\\b(P|C|1B|2B|3B|SS|LF|CF|RF)\\b(?=\\s+\\p{Lu})");
    private static final Pattern ERROR_BY = Pattern.compile(
            "(?i)error by (?:the )?(" + POSITIONS + ")\\b|\\bE([1-9])\\b");
    private static final Pattern ERROR_WORD = Pattern.compile("(?i)\\berror\\b");

    /** Fielders en orden de mención, sin repetidos consecutivos. */
    static List<Integer> parse(String text) {
        List<Integer> out = new ArrayList<>();
        Matcher m = NAMED.matcher(text);
        while (m.find()) {
            String term = m.group(1) != null ? m.group(1) : m.group(2);
            int pos = position(term);
            if (out.isEmpty() || out.get(out.size() - 1) != pos) out.add(pos);
        }
        return out;
    }

    static Integer errorFielder(String text) {
        Matcher m = ERROR_BY.matcher(text);
        if (!m.find()) return null;
        return m.group(1) != null ? position(m.group(1)) : Integer.valueOf(m.group(2));
    }

    static int errorCount(String text) {
        int n = 0;
        Matcher m = ERROR_WORD.matcher(text);
        while (m.find()) n++;
        return n;
    }

    static int position(String term) {
        return switch (term.toLowerCase(Locale.ROOT)) {
            case "pitcher", "p" -> 1;
            case "catcher", "c" -> 2;
            case "first baseman", "1b" -> 3;
            case "second baseman", "2b" -> 4;
            case "third baseman", "3b" -> 5;
            case "shortstop", "short stop", "ss" -> 6;
            case "left fielder", "lf" -> 7;
            case "center fielder", "centre fielder", "cf" -> 8;
            case "right fielder", "rf" -> 9;
            default -> throw new IllegalArgumentException("Unknown position: " + term);
        };
    }
}
