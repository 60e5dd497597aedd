package com.example.legalrag.runner;

import com.example.legalrag.dto.PruneSummary;
import com.example.legalrag.dto.SeedRequest;
import com.example.legalrag.dto.SeedSummary;
import com.example.legalrag.exception.ValidationException;
import com.example.legalrag.service.SeedService;
import com.example.legalrag.service.ValidityPruneService;
import io.micrometer.common.util.StringUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * Command-line entry points, active only when their option is present:
 * <ul>
 *   <li>{@code --seed [--limit=N] [--pages=N] [--since-year=YYYY] [--no-embed|--discovery-only]}</li>
 *   <li>{@code --celex=ID,ID [--no-embed]}, which ingests the listed acts and skips discovery</li>
 *   <li>{@code --prune [--dry-run] [--limit=N]}</li>
 * </ul>
 * Combine with {@code --spring.main.web-application-type=none} to exit once the job is done.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SeedCommandLineRunner implements ApplicationRunner {

    static final int DEFAULT_LIMIT = 10;
    static final int DEFAULT_PAGES = 1;

    private final SeedService seedService;
    private final ValidityPruneService pruneService;

    @Override
    public void run(ApplicationArguments args) {
        if (args.containsOption("prune")) {
            PruneSummary summary = pruneService.prune(args.containsOption("dry-run"), intOption(args, "limit", null));
            log.info("Prune finished: checked {}, flagged {}, removed {}",
                summary.checked(), summary.flagged().size(), summary.removed());
        }
        if (args.containsOption("seed") || args.containsOption("celex")) {
            SeedSummary summary = seedService.run(toSeedRequest(args));
            if (summary.aborted()) {
                throw new IllegalStateException("Seeding aborted: " + summary.abortReason());
            }
        }
    }

    static SeedRequest toSeedRequest(ApplicationArguments args) {
        int limit = intOption(args, "limit", DEFAULT_LIMIT);
        int pages = intOption(args, "pages", DEFAULT_PAGES);
        Integer sinceYear = intOption(args, "since-year", null);
        boolean dryRun = args.containsOption("no-embed") || args.containsOption("discovery-only");
        return new SeedRequest(limit, pages, sinceYear, celexIds(args), dryRun);
    }

    static List<String> celexIds(ApplicationArguments args) {
        List<String> values = args.getOptionValues("celex");
        if (values == null) return List.of();
        return values.stream()
            .flatMap(v -> Arrays.stream(v.split(",")))
            .map(String::trim)
            .filter(StringUtils::isNotBlank)
            .distinct()
            .toList();
    }

    static Integer intOption(ApplicationArguments args, String name, Integer fallback) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty() || StringUtils.isBlank(values.get(0))) return fallback;
        try {
            return Integer.valueOf(values.get(0).trim());
        } catch (NumberFormatException e) {
            throw new ValidationException("--" + name + " expects a number, got " + values.get(0));
        }
    }
}
