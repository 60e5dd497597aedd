package com.example.legalrag.service;

import com.example.legalrag.client.ChatGenerationClient;
import com.example.legalrag.config.RagProperties;
import com.example.legalrag.dto.AnswerResult;
import com.example.legalrag.dto.RetrievedPassage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Answers a question from retrieved passages only. Weak or missing evidence yields a fixed
 * "don't know" reply with no citations instead of a generated answer.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GroundedAnswerService {

    private static final String SYSTEM_PROMPT = """
        Answer STRICTLY from the provided context.
        If the context is insufficient, say you don't know.
        Cite using the format [#<documentId>:<passageIndex>].
        Answer in %s.""";

    private final RetrievalService retrievalService;
    private final CitationService citationService;
    private final ChatGenerationClient chatClient;
    private final RagProperties ragProperties;

    public AnswerResult answer(String question, Integer k) {
        List<RetrievedPassage> hits = retrievalService.retrieve(question, k);
        AnswerLanguage language = AnswerLanguage.fromCode(ragProperties.getAnswer().getLanguage());

        if (!hasEnoughEvidence(hits)) {
            log.info("Abstaining: top score {} below threshold {}",
                hits.isEmpty() ? "n/a" : hits.get(0).score(), ragProperties.getAnswer().getRelevanceThreshold());
            return AnswerResult.abstention(language.abstention());
        }

        String context = citationService.buildContext(hits);
        String text = chatClient.generate(
            SYSTEM_PROMPT.formatted(language.displayName()),
            userMessage(language, question, context),
            ragProperties.getAnswer().getTemperature());

        return new AnswerResult(text, citationService.createCitations(hits));
    }

    boolean hasEnoughEvidence(List<RetrievedPassage> hits) {
        return !hits.isEmpty() && hits.get(0).score() >= ragProperties.getAnswer().getRelevanceThreshold();
    }

    static String userMessage(AnswerLanguage language, String question, String context) {
        return language.questionLabel() + ":\n" + question + "\n\nContext:\n" + context;
    }
}
