package com.example.legalrag.service;

import com.example.legalrag.dto.Citation;
import com.example.legalrag.dto.RetrievedPassage;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

@Service
public class CitationService {

    /** Stable citation tag of one passage, e.g. {@code #32016R0679:3}. */
    public static String tag(String documentId, int passageIndex) {
        return "#" + documentId + ":" + passageIndex;
    }

    public List<Citation> createCitations(List<RetrievedPassage> hits) {
        return hits.stream()
            .map(this::toCitation)
            .toList();
    }

    /**
     * Renders the passages as tagged context blocks, in retrieval order:
     * <pre>
     * [#id:i]
     * text
     * </pre>
     * separated by a blank line.
     */
    public String buildContext(List<RetrievedPassage> hits) {
        return hits.stream()
            .map(hit -> "[" + tag(hit.documentId(), hit.passageIndex()) + "]\n" + hit.text())
            .collect(Collectors.joining("\n\n"));
    }

    private Citation toCitation(RetrievedPassage hit) {
        return new Citation(tag(hit.documentId(), hit.passageIndex()), hit.score());
    }
}
