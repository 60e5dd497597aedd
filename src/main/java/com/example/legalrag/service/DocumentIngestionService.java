package com.example.legalrag.service;

import com.example.legalrag.config.IngestionProperties;
import com.example.legalrag.dto.ContentToken;
import com.example.legalrag.dto.DiscoveryRecord;
import com.example.legalrag.dto.DocumentIngestionReport;
import com.example.legalrag.dto.IngestionStatus;
import com.example.legalrag.dto.Passage;
import com.example.legalrag.dto.ValidityStatus;
import com.example.legalrag.exception.ExtractionEmptyException;
import com.example.legalrag.exception.StorageException;
import com.example.legalrag.repository.PassageStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Runs one act through fetch, validity check, extraction, chunking, embedding and storage.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentIngestionService {

    private final DocumentFetchService fetchService;
    private final ValidityStatusDetector validityDetector;
    private final HtmlContentExtractor extractor;
    private final PassageChunker chunker;
    private final PassageEmbeddingService embeddingService;
    private final PassageStore store;
    private final IngestionProperties props;

    /**
     * Ingests a single act. Re-ingesting replaces all stored passages of the act.
     *
     * @param record act to ingest
     * @param dryRun parse and chunk only, leaving the store untouched
     * @return timings and passage statistics for the act
     * @throws com.example.legalrag.exception.FetchException     when no language variant could be downloaded
     * @throws ExtractionEmptyException                           when the page holds no usable text
     * @throws com.example.legalrag.exception.EmbeddingException when the embedder fails
     * @throws StorageException                                   when the database write fails
     */
    public DocumentIngestionReport ingest(DiscoveryRecord record, boolean dryRun) {
        long started = System.currentTimeMillis();
        String html = fetchService.fetch(record);
        long fetchMs = System.currentTimeMillis() - started;

        ValidityStatus validity = validityDetector.inspect(record.id(), html);
        if (validity.noLongerValid()) {
            log.info("[Skip] {} is no longer in force (end of validity: {})", record.id(),
                validity.endOfValidity() != null ? validity.endOfValidity() : "unknown");
            return DocumentIngestionReport.noLongerValid(record.id(), fetchMs, validity.endOfValidity());
        }

        started = System.currentTimeMillis();
        List<ContentToken> tokens = extractor.extract(html);
        List<Passage> passages = chunker.chunkDocument(record.id(), tokens);
        long parseMs = System.currentTimeMillis() - started;
        if (passages.isEmpty()) {
            throw new ExtractionEmptyException(record.id());
        }
        int averageLength = (int) Math.round(passages.stream().mapToInt(p -> p.text().length()).average().orElse(0));

        if (dryRun) {
            log.info("[DryRun] {}: {} passages, avg {} chars", record.id(), passages.size(), averageLength);
            return new DocumentIngestionReport(record.id(), IngestionStatus.DRY_RUN, passages.size(), averageLength,
                fetchMs, parseMs, 0, null);
        }

        started = System.currentTimeMillis();
        List<float[]> vectors = embeddingService.embedAll(passages.stream().map(Passage::text).toList());
        try {
            store.replaceDocument(record, passages, vectors);
        } catch (DataAccessException e) {
            throw new StorageException(record.id(), e);
        }
        long dbMs = System.currentTimeMillis() - started;

        log.info("[Ingested] {}: {} passages, avg {} chars (fetch {}ms, parse {}ms, db {}ms)",
            record.id(), passages.size(), averageLength, fetchMs, parseMs, dbMs);
        return new DocumentIngestionReport(record.id(), IngestionStatus.INGESTED, passages.size(), averageLength,
            fetchMs, parseMs, dbMs, null);
    }

    /** Ingests an act by CELEX number, bypassing discovery. */
    public DocumentIngestionReport ingestById(String documentId, boolean dryRun) {
        return ingest(manualRecord(documentId), dryRun);
    }

    DiscoveryRecord manualRecord(String documentId) {
        String id = documentId.trim();
        String lang = props.getPreferredLanguage();
        return DiscoveryRecord.manual(id, lang, props.documentUrl(id, lang));
    }
}
