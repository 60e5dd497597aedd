package com.example.legalrag.service;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

public final class SentenceSplitter {

    /**
     * End punctuation, whitespace, then an upper-case letter. Requiring the capital keeps most abbreviations
     * ("art. 5", "lit. b)") inside their sentence.
     */
    private static final Pattern BOUNDARY = Pattern.compile("(?<=[.!?])\\s+(?=\\p{Lu})");

    private SentenceSplitter() {}

    public static List<String> split(String paragraph) {
        String text = TextNormalizer.singleLine(paragraph);
        if (text.isEmpty()) return List.of();
        List<String> sentences = new ArrayList<>();
        for (String part : BOUNDARY.split(text)) {
            if (!part.isEmpty()) sentences.add(part);
        }
        return sentences;
    }
}
