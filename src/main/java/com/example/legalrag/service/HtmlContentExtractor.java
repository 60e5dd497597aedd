package com.example.legalrag.service;

import com.example.legalrag.dto.ContentToken;
import com.example.legalrag.dto.TokenKind;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns an EUR-Lex HTML page into an ordered list of heading and body tokens.
 */
@Slf4j
@Component
public class HtmlContentExtractor {

    static final String BULLET = "• ";

    private static final String NON_CONTENT = "script, style, link, noscript, iframe, svg";
    private static final String BOILERPLATE = String.join(", ",
        "nav", "header", "footer", "aside",
        ".navbar", ".header", ".footer", ".nav", "#header", "#footer", "#toolbar", ".toolbar",
        ".breadcrumb", ".breadcrumbs", ".menu", ".leftCol", ".rightCol", ".site-header", ".site-footer",
        ".cookie", "#pageheader", "#pagefooter", ".portalnav");

    /** Candidate containers of the legal text, most specific first. */
    private static final List<String> MAIN_SELECTORS = List.of(
        "#text", "#documentContent", "#PP", "main", "article", ".tabContent", "#tc-main", ".content");

    private static final String BLOCKS = "h1, h2, h3, h4, p, li";

    public List<ContentToken> extract(String html) {
        Document doc = Jsoup.parse(html);
        doc.select(NON_CONTENT).remove();
        doc.select(BOILERPLATE).remove();

        Element main = mainRegion(doc);
        List<ContentToken> tokens = new ArrayList<>();
        for (Element el : main.select(BLOCKS)) {
            String tag = el.normalName();
            String text = TextNormalizer.clean(el.text());
            if (text.isEmpty()) continue;
            if ("li".equals(tag)) text = BULLET + text;
            TokenKind kind = TokenClassifier.classify(tag, text);
            tokens.add(new ContentToken(kind, text));
        }
        return mergeHeadings(tokens);
    }

    Element mainRegion(Document doc) {
        for (String selector : MAIN_SELECTORS) {
            Element found = doc.selectFirst(selector);
            if (found != null) {
                log.debug("Main content region matched {}", selector);
                return found;
            }
        }
        return doc.body();
    }

    /** Consecutive headings ("Articolul 5" followed by its title) become one newline-joined token. */
    static List<ContentToken> mergeHeadings(List<ContentToken> tokens) {
        List<ContentToken> merged = new ArrayList<>(tokens.size());
        for (ContentToken token : tokens) {
            int last = merged.size() - 1;
            if (last >= 0 && merged.get(last).isHeading() && token.isHeading()) {
                merged.set(last, ContentToken.heading(merged.get(last).text() + "\n" + token.text()));
            } else {
                merged.add(token);
            }
        }
        return merged;
    }
}
