package com.example.legalrag.service;

import com.example.legalrag.dto.DiscoveryRecord;
import com.example.legalrag.dto.DocumentIngestionReport;
import com.example.legalrag.dto.IngestionStatus;
import com.example.legalrag.dto.SeedRequest;
import com.example.legalrag.dto.SeedSummary;
import com.example.legalrag.exception.EmbeddingQuotaExceededException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Batch ingestion: discovery (or a manual id list) followed by sequential per-act ingestion.
 * A failing act is logged and skipped. Only an exhausted embedding quota stops the batch.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SeedService {

    private final MetadataDiscoveryService discoveryService;
    private final DocumentIngestionService ingestionService;

    public SeedSummary run(SeedRequest request) {
        long started = System.currentTimeMillis();
        List<DiscoveryRecord> records = request.hasManualIds()
            ? request.documentIds().stream().map(ingestionService::manualRecord).toList()
            : discoveryService.discover(request.pageSize(), request.pageCount(), request.sinceYear());
        long discoveryMs = System.currentTimeMillis() - started;
        log.info("[Seed] {} acts to process{}{}", records.size(),
            request.hasManualIds() ? " (manual ids)" : "", request.dryRun() ? " (dry run)" : "");

        List<DocumentIngestionReport> reports = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        String abortReason = null;

        for (DiscoveryRecord record : records) {
            try {
                reports.add(ingestionService.ingest(record, request.dryRun()));
            } catch (EmbeddingQuotaExceededException e) {
                log.error("[Seed] Stopping at {}: {}", record.id(), e.getMessage());
                failed.add(record.id());
                abortReason = e.getMessage();
                break;
            } catch (RuntimeException e) {
                log.error("[Seed] Failed {}: {}", record.id(), e.getMessage(), e);
                failed.add(record.id());
            }
        }

        SeedSummary summary = summarize(records.size(), reports, failed, discoveryMs,
            System.currentTimeMillis() - started, abortReason);
        logSummary(summary);
        return summary;
    }

    static SeedSummary summarize(int documents, List<DocumentIngestionReport> reports, List<String> failed,
                                 long discoveryMs, long totalMs, String abortReason) {
        List<DocumentIngestionReport> chunked = reports.stream()
            .filter(r -> r.status() != IngestionStatus.SKIPPED_NO_LONGER_VALID)
            .toList();
        int totalPassages = chunked.stream().mapToInt(DocumentIngestionReport::passageCount).sum();
        long totalChars = chunked.stream()
            .mapToLong(r -> (long) r.averagePassageLength() * r.passageCount())
            .sum();
        int average = totalPassages == 0 ? 0 : (int) Math.round((double) totalChars / totalPassages);
        return new SeedSummary(documents, List.copyOf(reports), List.copyOf(failed), totalPassages, average,
            discoveryMs, totalMs, abortReason != null, abortReason);
    }

    private void logSummary(SeedSummary summary) {
        log.info("[Seed] Done: {} acts, {} reports, {} failed, {} passages, avg {} chars, discovery {}ms, total {}ms{}",
            summary.documents(), summary.reports().size(), summary.failedDocumentIds().size(),
            summary.totalPassages(), summary.averagePassageLength(), summary.discoveryMs(), summary.totalMs(),
            summary.aborted() ? ", ABORTED" : "");
        for (DocumentIngestionReport r : summary.reports()) {
            log.info("[Seed]   {} {} passages={} avg={} fetch={}ms parse={}ms db={}ms total={}ms",
                r.documentId(), r.status(), r.passageCount(), r.averagePassageLength(),
                r.fetchMs(), r.parseMs(), r.dbMs(), r.totalMs());
        }
        if (!summary.failedDocumentIds().isEmpty()) {
            log.warn("[Seed] Failed acts: {}", String.join(", ", summary.failedDocumentIds()));
        }
    }
}
