package com.example.legalrag.service;

import com.example.legalrag.dto.ValidityStatus;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Detects repealed or expired acts from the status banners EUR-Lex prints on the document page.
 */
@Component
public class ValidityStatusDetector {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    private static final List<Pattern> NO_LONGER_IN_FORCE_MARKERS = List.of(
        Pattern.compile("No\\s+longer\\s+in\\s+force", FLAGS),
        Pattern.compile("Ceased\\s+to\\s+be\\s+in\\s+force", FLAGS),
        Pattern.compile("Nu\\s+mai\\s+este\\s+[îi]n\\s+vigoare", FLAGS),
        Pattern.compile("abrogare\\s+implicită", FLAGS),
        Pattern.compile("abrogat(ă)?", FLAGS),
        Pattern.compile("End\\s+of\\s+validity", FLAGS)
    );

    private static final Pattern END_OF_VALIDITY =
        Pattern.compile("Date of end of validity:\\s*([0-9]{2}/[0-9]{2}/[0-9]{4})", FLAGS);

    public ValidityStatus inspect(String documentId, String html) {
        boolean matched = NO_LONGER_IN_FORCE_MARKERS.stream().anyMatch(p -> p.matcher(html).find());
        if (!matched) {
            return new ValidityStatus(documentId, false, null);
        }
        Matcher m = END_OF_VALIDITY.matcher(html);
        return new ValidityStatus(documentId, true, m.find() ? m.group(1) : null);
    }
}
