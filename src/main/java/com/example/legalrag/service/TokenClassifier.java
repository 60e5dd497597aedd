package com.example.legalrag.service;

import com.example.legalrag.dto.TokenKind;

import java.util.List;
import java.util.Locale;
import java.util.function.BiPredicate;
import java.util.regex.Pattern;

/**
 * Decides whether an extracted block is a structural heading of a legal act or running text.
 * <p>
 * Matchers run in order; the first hit classifies the block as a heading:
 * <ol>
 *   <li>heading element ({@code h1}..{@code h6})</li>
 *   <li>leading keyword: Article, Articolul, Art., Section, Secțiunea, Chapter, Capitolul, Annex, Anexa, Title, Titlul</li>
 *   <li>leading roman numeral followed by whitespace, e.g. "IV. Final provisions"</li>
 * </ol>
 */
public final class TokenClassifier {

    private static final Pattern HEADING_TAG = Pattern.compile("h[1-6]");
    private static final Pattern KEYWORD_PREFIX = Pattern.compile(
        "^(Article|Articolul|Art\\.|Section|Secțiunea|Sectiunea|Capitolul|Chapter|Annex|Anexa|Titlul|Title)",
        Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    private static final Pattern ROMAN_PREFIX = Pattern.compile("^[IVXLC]+\\.?\\s");

    private static final List<BiPredicate<String, String>> HEADING_MATCHERS = List.of(
        (tag, text) -> tag != null && HEADING_TAG.matcher(tag.toLowerCase(Locale.ROOT)).matches(),
        (tag, text) -> KEYWORD_PREFIX.matcher(text).find(),
        (tag, text) -> ROMAN_PREFIX.matcher(text).find()
    );

    private TokenClassifier() {}

    public static TokenKind classify(String tagName, String text) {
        String t = text == null ? "" : text.trim();
        for (BiPredicate<String, String> matcher : HEADING_MATCHERS) {
            if (matcher.test(tagName, t)) return TokenKind.HEADING;
        }
        return TokenKind.BODY;
    }
}
