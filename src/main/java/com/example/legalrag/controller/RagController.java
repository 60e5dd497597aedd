package com.example.legalrag.controller;

import com.example.legalrag.dto.AnswerResult;
import com.example.legalrag.dto.AskRequest;
import com.example.legalrag.dto.DocumentIngestionReport;
import com.example.legalrag.dto.RetrievedPassage;
import com.example.legalrag.exception.ValidationException;
import com.example.legalrag.service.DocumentIngestionService;
import com.example.legalrag.service.GroundedAnswerService;
import com.example.legalrag.service.RetrievalService;
import io.micrometer.common.util.StringUtils;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
class RagController {

    private static final int MAX_K = 50;

    private final GroundedAnswerService answerService;
    private final RetrievalService retrievalService;
    private final DocumentIngestionService ingestionService;

    @PostMapping("/ask")
    public AnswerResult ask(@Valid @RequestBody AskRequest req) {
        String question = req.text();
        if (StringUtils.isBlank(question)) {
            throw new ValidationException("question (or query) is required");
        }
        return answerService.answer(question.trim(), req.k());
    }

    @GetMapping("/search")
    public List<RetrievedPassage> search(
            @RequestParam("q") String q,
            @RequestParam(value = "k", required = false) Integer k
    ) {
        if (StringUtils.isBlank(q)) {
            throw new ValidationException("q is required");
        }
        if (k != null && (k < 1 || k > MAX_K)) {
            throw new ValidationException("k must be between 1 and " + MAX_K);
        }
        return retrievalService.retrieve(q.trim(), k);
    }

    @PostMapping("/ingest/{documentId}")
    public DocumentIngestionReport ingest(
            @PathVariable String documentId,
            @RequestParam(value = "dryRun", defaultValue = "false") boolean dryRun
    ) {
        if (StringUtils.isBlank(documentId)) {
            throw new ValidationException("documentId is required");
        }
        return ingestionService.ingestById(documentId, dryRun);
    }
}
