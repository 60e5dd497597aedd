package com.example.legalrag.service;

import java.util.regex.Pattern;

public final class TextNormalizer {

    private static final Pattern HORIZONTAL_SPACE = Pattern.compile("[ \\t]+");
    private static final Pattern LINE_BREAKS = Pattern.compile("[\\r\\f]+");
    private static final Pattern BLANK_LINES = Pattern.compile("\\n{3,}");
    private static final Pattern ANY_WHITESPACE = Pattern.compile("\\s+");

    private TextNormalizer() {}

    /** Replaces NBSP, collapses runs of spaces and blank lines, trims. */
    public static String clean(String s) {
        if (s == null) return "";
        String out = s.replace('\u00A0', ' ');
        out = HORIZONTAL_SPACE.matcher(out).replaceAll(" ");
        out = LINE_BREAKS.matcher(out).replaceAll("\n");
        out = BLANK_LINES.matcher(out).replaceAll("\n\n");
        return out.trim();
    }

    /** Collapses every whitespace run, line breaks included, to a single space. */
    public static String singleLine(String s) {
        if (s == null) return "";
        return ANY_WHITESPACE.matcher(s.replace('\u00A0', ' ')).replaceAll(" ").trim();
    }
}
