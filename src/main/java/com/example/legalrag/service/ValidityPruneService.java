package com.example.legalrag.service;

import com.example.legalrag.config.IngestionProperties;
import com.example.legalrag.dto.PruneSummary;
import com.example.legalrag.dto.ValidityStatus;
import com.example.legalrag.exception.FetchException;
import com.example.legalrag.repository.PassageStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Re-checks stored acts against their EUR-Lex page and removes the ones no longer in force.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ValidityPruneService {

    private final PassageStore store;
    private final DocumentFetchService fetchService;
    private final ValidityStatusDetector validityDetector;
    private final IngestionProperties props;

    /**
     * @param dryRun report flagged acts without deleting them
     * @param limit  maximum number of acts to check, {@code null} or non-positive for all
     */
    public PruneSummary prune(boolean dryRun, Integer limit) {
        List<String> ids = store.listDocumentIds();
        if (limit != null && limit > 0 && ids.size() > limit) {
            ids = ids.subList(0, limit);
        }
        String language = props.getPrune().getLanguage();
        log.info("[Prune] Checking {} acts ({}){}", ids.size(), language, dryRun ? " dry run" : "");

        List<ValidityStatus> flagged = new ArrayList<>();
        int checked = 0;
        int removed = 0;
        for (String id : ids) {
            String html;
            try {
                html = fetchService.fetch(id, language);
            } catch (FetchException e) {
                log.warn("[Prune] Could not fetch {} (status {}), keeping it: {}", id, e.getStatus(), e.getMessage());
                continue;
            }
            checked++;
            ValidityStatus status = validityDetector.inspect(id, html);
            if (!status.noLongerValid()) continue;

            flagged.add(status);
            if (dryRun) {
                log.info("[Prune] Would remove {} (end of validity: {})", id, status.endOfValidity());
            } else {
                int passages = store.deleteDocument(id);
                removed++;
                log.info("[Prune] Removed {} with {} passages (end of validity: {})", id, passages,
                    status.endOfValidity());
            }
        }
        log.info("[Prune] Checked {}, flagged {}, removed {}", checked, flagged.size(), removed);
        return new PruneSummary(checked, List.copyOf(flagged), removed, dryRun);
    }
}
