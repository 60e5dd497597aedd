package com.example.legalrag.service;

import com.example.legalrag.config.IngestionProperties;
import com.example.legalrag.dto.PruneSummary;
import com.example.legalrag.dto.ValidityStatus;
import com.example.legalrag.exception.FetchException;
import com.example.legalrag.repository.PassageStore;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ValidityPruneServiceTest {

    private static final String REPEALED = "<p>No longer in force, Date of end of validity: 24/05/2018</p>";
    private static final String IN_FORCE = "<p>In force</p>";

    private final PassageStore store = mock(PassageStore.class);
    private final DocumentFetchService fetchService = mock(DocumentFetchService.class);
    private final ValidityPruneService service =
        new ValidityPruneService(store, fetchService, new ValidityStatusDetector(), new IngestionProperties());

    @Test
    void deletesActsNoLongerInForce() {
        when(store.listDocumentIds()).thenReturn(List.of("31995L0046", "32016R0679"));
        when(fetchService.fetch("31995L0046", "en")).thenReturn(REPEALED);
        when(fetchService.fetch("32016R0679", "en")).thenReturn(IN_FORCE);
        when(store.deleteDocument("31995L0046")).thenReturn(12);

        PruneSummary summary = service.prune(false, null);

        assertThat(summary.checked()).isEqualTo(2);
        assertThat(summary.flagged()).containsExactly(new ValidityStatus("31995L0046", true, "24/05/2018"));
        assertThat(summary.removed()).isEqualTo(1);
        verify(store).deleteDocument("31995L0046");
        verify(store, never()).deleteDocument("32016R0679");
    }

    @Test
    void dryRunOnlyReports() {
        when(store.listDocumentIds()).thenReturn(List.of("31995L0046"));
        when(fetchService.fetch("31995L0046", "en")).thenReturn(REPEALED);

        PruneSummary summary = service.prune(true, null);

        assertThat(summary.dryRun()).isTrue();
        assertThat(summary.flagged()).hasSize(1);
        assertThat(summary.removed()).isZero();
        verify(store, never()).deleteDocument(anyString());
    }

    @Test
    void limitCapsCheckedActsAndFetchFailuresAreKept() {
        when(store.listDocumentIds()).thenReturn(List.of("A", "B", "C"));
        when(fetchService.fetch("A", "en")).thenThrow(new FetchException("A", 503, "down", null));
        when(fetchService.fetch("B", "en")).thenReturn(REPEALED);

        PruneSummary summary = service.prune(false, 2);

        assertThat(summary.checked()).isEqualTo(1);
        assertThat(summary.removed()).isEqualTo(1);
        verify(fetchService, never()).fetch("C", "en");
        verify(store, never()).deleteDocument("A");
    }
}
