package com.example.legalrag.service;

import com.example.legalrag.client.SparqlClient;
import com.example.legalrag.config.IngestionProperties;
import com.example.legalrag.dto.DiscoveryRecord;
import com.example.legalrag.dto.SparqlResultSet;
import com.example.legalrag.exception.DiscoveryException;
import com.example.legalrag.service.SparqlQueryBuilder.Shape;
import com.example.legalrag.util.Attempt;
import com.example.legalrag.util.FallbackChain;
import com.example.legalrag.util.FallbackChain.Strategy;
import io.micrometer.common.util.StringUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Slf4j
@Service
@RequiredArgsConstructor
public class MetadataDiscoveryService {

    private static final Pattern YEAR_IN_CELEX = Pattern.compile("^3(\\d{4})[A-Z]");

    private final SparqlClient sparqlClient;
    private final IngestionProperties props;

    /**
     * Pages through the metadata endpoints and returns candidate acts, newest first, one per CELEX number.
     *
     * @param pageSize  rows requested per page
     * @param pageCount maximum number of pages
     * @param sinceYear drop acts issued before this year; {@code null} keeps everything
     * @throws DiscoveryException if every endpoint and query shape fails on the first page
     */
    public List<DiscoveryRecord> discover(int pageSize, int pageCount, Integer sinceYear) {
        List<DiscoveryRecord> records = new ArrayList<>();
        for (int page = 0; page < pageCount; page++) {
            int offset = page * pageSize;
            log.info("[Discovery] Querying SPARQL page {}/{}, limit {}, offset {}", page + 1, pageCount, pageSize, offset);

            Attempt<SparqlResultSet> attempt = FallbackChain.firstSuccess(
                strategiesFor(pageSize, offset, sinceYear), rs -> !rs.isEmpty());

            if (attempt instanceof Attempt.Failure<SparqlResultSet> failure) {
                if (page == 0) {
                    throw new DiscoveryException("All SPARQL endpoints failed, last tried " + failure.source(),
                        failure.cause());
                }
                log.warn("[Discovery] Page {} failed on every endpoint, stopping pagination: {}",
                    page + 1, failure.cause().getMessage());
                break;
            }

            Attempt.Success<SparqlResultSet> success = (Attempt.Success<SparqlResultSet>) attempt;
            SparqlResultSet rs = success.value();
            log.info("[Discovery] Page {} answered by {} with {} rows", page + 1, success.source(), rs.rows().size());
            for (Map<String, String> row : rs.rows()) {
                DiscoveryRecord record = toRecord(row, sinceYear);
                if (record != null) records.add(record);
            }
            if (rs.isEmpty()) break;
        }
        return deduplicate(records);
    }

    /**
     * Primary endpoint with each query shape, then the next endpoint; POST before GET for every pair.
     */
    List<Strategy<SparqlResultSet>> strategiesFor(int limit, int offset, Integer sinceYear) {
        List<Strategy<SparqlResultSet>> strategies = new ArrayList<>();
        for (String endpoint : props.getSparql().getEndpoints()) {
            for (Shape shape : Shape.values()) {
                String query = SparqlQueryBuilder.build(shape, limit, offset, sinceYear);
                strategies.add(FallbackChain.strategy(shape + " POST " + endpoint,
                    () -> sparqlClient.post(endpoint, query)));
                strategies.add(FallbackChain.strategy(shape + " GET " + endpoint,
                    () -> sparqlClient.get(endpoint, query)));
            }
        }
        return strategies;
    }

    DiscoveryRecord toRecord(Map<String, String> row, Integer sinceYear) {
        String celex = row.get("celex");
        String title = row.get("title");
        if (StringUtils.isBlank(celex) || StringUtils.isBlank(title)) return null;

        LocalDate issued = parseIssued(row.get("issued"));
        if (sinceYear != null) {
            Integer year = issued != null ? Integer.valueOf(issued.getYear()) : yearFromCelex(celex);
            if (year != null && year < sinceYear) return null;
        }

        String lang = normalizeLanguage(row.get("lang"));
        return new DiscoveryRecord(celex, title, lang, issued, props.documentUrl(celex, lang),
            row.getOrDefault("work", ""), row.getOrDefault("expression", ""));
    }

    String normalizeLanguage(String raw) {
        if (raw == null) return props.getFallbackLanguage();
        String value = raw.trim();
        if (value.equalsIgnoreCase("ro") || value.equalsIgnoreCase("ron") || value.equalsIgnoreCase("rum")
            || value.toUpperCase(Locale.ROOT).contains("/ROU")) {
            return "ro";
        }
        return props.getFallbackLanguage();
    }

    static Integer yearFromCelex(String celex) {
        Matcher m = YEAR_IN_CELEX.matcher(celex);
        return m.find() ? Integer.valueOf(m.group(1)) : null;
    }

    static LocalDate parseIssued(String issued) {
        if (StringUtils.isBlank(issued) || issued.length() < 10) return null;
        try {
            return LocalDate.parse(issued.substring(0, 10));
        } catch (DateTimeParseException e) {
            log.debug("Unparseable issued date {}", issued);
            return null;
        }
    }

    /** Keeps first-seen order; a record in the preferred language replaces an earlier one in another language. */
    List<DiscoveryRecord> deduplicate(List<DiscoveryRecord> records) {
        String preferred = props.getPreferredLanguage();
        Map<String, DiscoveryRecord> byId = new LinkedHashMap<>();
        for (DiscoveryRecord record : records) {
            DiscoveryRecord previous = byId.get(record.id());
            if (previous == null
                || (!preferred.equals(previous.language()) && preferred.equals(record.language()))) {
                byId.put(record.id(), record);
            }
        }
        return new ArrayList<>(byId.values());
    }
}
