package com.cardledger.backend.services.reconciliation;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import com.cardledger.backend.config.ExtractionProperties;
import com.cardledger.backend.config.ReconciliationProperties;
import com.cardledger.backend.dto.extraction.BatchConsensus;
import com.cardledger.backend.dto.extraction.DocumentConsensus;
import com.cardledger.backend.dto.extraction.ExtractedTransaction;
import com.cardledger.backend.dto.extraction.PageExtraction;
import com.cardledger.backend.dto.extraction.RenderedPage;
import com.cardledger.backend.dto.reconciliation.CandidateTransaction;
import com.cardledger.backend.dto.reconciliation.DuplicateWarning;
import com.cardledger.backend.dto.reconciliation.FileRejection;
import com.cardledger.backend.dto.reconciliation.Fingerprint;
import com.cardledger.backend.dto.reconciliation.ImportRequest;
import com.cardledger.backend.dto.reconciliation.ImportSession;
import com.cardledger.backend.dto.reconciliation.MatchCandidate;
import com.cardledger.backend.dto.reconciliation.OverlapResult;
import com.cardledger.backend.dto.reconciliation.UploadedFile;
import com.cardledger.backend.entities.Statement;
import com.cardledger.backend.enums.ImportState;
import com.cardledger.backend.enums.WarningType;
import com.cardledger.backend.exceptions.CommitFailureException;
import com.cardledger.backend.exceptions.IllegalImportStateException;
import com.cardledger.backend.services.StatementCommitService;
import com.cardledger.backend.services.classification.CategoryLabelingService;
import com.cardledger.backend.services.extraction.DocumentPageRenderer;
import com.cardledger.backend.services.extraction.ExtractionBoundary;
import com.cardledger.backend.services.extraction.PageExtractor;

import lombok.extern.slf4j.Slf4j;

/**
 * Drives one import from uploaded files to a stored statement.
 *
 * <p>Flow: {@link #stage} fingerprints, extracts and labels the batch; {@link #reconcile} runs the
 * fuzzy checks and either commits or stops at {@link ImportState#AWAITING_CONFIRMATION}; the caller
 * then {@link #confirm}s or {@link #cancel}s. Each step returns a new {@link ImportSession}.
 */
@Service
@Slf4j
public class ReconciliationOrchestrator {

    private final FingerprintIndex fingerprintIndex;
    private final DocumentPageRenderer pageRenderer;
    private final PageExtractor pageExtractor;
    private final ExtractionBoundary extractionBoundary;
    private final CategoryLabelingService labelingService;
    private final ConsensusAggregator consensusAggregator;
    private final StatementMatcher statementMatcher;
    private final TransactionOverlapDetector overlapDetector;
    private final StatementCommitService commitService;
    private final ReconciliationProperties properties;
    private final ExtractionProperties extractionProperties;
    private final Executor executor;
    private final Executor checkExecutor;
    private final Clock clock;

    public ReconciliationOrchestrator(
            FingerprintIndex fingerprintIndex,
            DocumentPageRenderer pageRenderer,
            PageExtractor pageExtractor,
            ExtractionBoundary extractionBoundary,
            CategoryLabelingService labelingService,
            ConsensusAggregator consensusAggregator,
            StatementMatcher statementMatcher,
            TransactionOverlapDetector overlapDetector,
            StatementCommitService commitService,
            ReconciliationProperties properties,
            ExtractionProperties extractionProperties,
            @Qualifier("reconciliationTaskExecutor") Executor executor,
            @Qualifier("duplicateCheckExecutor") Executor checkExecutor,
            Clock clock
    ) {
        this.fingerprintIndex = fingerprintIndex;
        this.pageRenderer = pageRenderer;
        this.pageExtractor = pageExtractor;
        this.extractionBoundary = extractionBoundary;
        this.labelingService = labelingService;
        this.consensusAggregator = consensusAggregator;
        this.statementMatcher = statementMatcher;
        this.overlapDetector = overlapDetector;
        this.commitService = commitService;
        this.properties = properties;
        this.extractionProperties = extractionProperties;
        this.executor = executor;
        this.checkExecutor = checkExecutor;
        this.clock = clock;
    }

    public ImportSession ingest(ImportRequest request) {
        ImportSession staged = stage(request);
        if (staged.getState() != ImportState.CHECKING_FUZZY) {
            return staged;
        }
        return reconcile(staged);
    }

    public ImportSession stage(ImportRequest request) {
        if (request == null || request.files().isEmpty()) {
            throw new IllegalArgumentException("At least one file is required");
        }

        ImportSession.ImportSessionBuilder session = ImportSession.builder()
                .sessionId(UUID.randomUUID())
                .state(ImportState.CHECKING_FINGERPRINT)
                .issuerLabel(trimToNull(request.issuerLabel()));

        List<DocumentConsensus> documents = new ArrayList<>();
        List<ExtractedTransaction> extracted = new ArrayList<>();
        Set<String> seenInBatch = new HashSet<>();
        int accepted = 0;
        int rejected = 0;
        int failedPages = 0;

        for (UploadedFile file : request.files()) {
            Fingerprint fingerprint;
            try {
                fingerprint = fingerprintIndex.fingerprint(file.content());
            } catch (IllegalArgumentException e) {
                session.notice(file.filename() + ": " + e.getMessage());
                continue;
            }

            Optional<Statement> duplicate = fingerprintIndex.findDuplicate(fingerprint);
            if (duplicate.isPresent()) {
                Statement existing = duplicate.get();
                log.info("[Reconciliation] file '{}' already imported as statement id={}",
                        file.filename(), existing.getId());
                session.rejection(new FileRejection(
                        file.filename(),
                        fingerprint.hex(),
                        existing.getId(),
                        existing.getIssuer(),
                        existing.getPeriod(),
                        existing.getImportedAt()));
                rejected++;
                continue;
            }
            if (!seenInBatch.add(fingerprint.hex())) {
                session.notice(file.filename() + ": same file uploaded twice in this batch, ignored");
                continue;
            }

            List<RenderedPage> pages;
            try {
                pages = pageRenderer.render(file, request.password());
            } catch (IllegalArgumentException e) {
                log.warn("[Reconciliation] could not read '{}': {}", file.filename(), e.getMessage());
                session.notice(file.filename() + ": " + e.getMessage());
                continue;
            }

            List<PageExtraction> results = extractPages(pages);
            int failed = (int) results.stream().filter(PageExtraction::failed).count();
            if (failed > 0) {
                session.notice(String.format(Locale.ROOT, "%s: %d of %d pages could not be read",
                        file.filename(), failed, results.size()));
            }
            failedPages += failed;
            documents.add(consensusAggregator.aggregate(results));
            results.forEach(r -> extracted.addAll(r.transactions()));

            session.filename(file.filename()).fingerprint(fingerprint.hex());
            accepted++;
        }
        session.failedPages(failedPages);

        if (accepted == 0) {
            if (rejected > 0) {
                log.info("[Reconciliation] batch rejected, {} file(s) already imported", rejected);
                return session.state(ImportState.REJECTED_DUPLICATE).build();
            }
            return session.state(ImportState.CANCELLED)
                    .notice("None of the uploaded files could be read")
                    .build();
        }

        List<ExtractedTransaction> purchases = extracted.stream().filter(t -> !t.payment()).toList();
        List<ExtractedTransaction> recent = dropStale(purchases);
        int stale = purchases.size() - recent.size();
        if (stale > 0) {
            session.notice(String.format(Locale.ROOT,
                    "%d transaction(s) dated more than %d years ago were ignored", stale, properties.recencyYears()));
        }
        if (recent.isEmpty()) {
            log.info("[Reconciliation] nothing extracted from {} file(s)", accepted);
            return session.state(ImportState.CANCELLED)
                    .notice("No transactions were found in the uploaded files")
                    .build();
        }

        List<CandidateTransaction> labeled = labelingService.label(recent);
        BatchConsensus consensus = consensusAggregator.combine(documents);

        ImportSession staged = session
                .state(ImportState.CHECKING_FUZZY)
                .transactions(labeled)
                .suggestedIssuer(consensus.suggestedIssuer())
                .cutoffDay(consensus.cutoffDay())
                .build();
        log.info("[Reconciliation] staged session={} files={} transactions={} failedPages={}",
                staged.getSessionId(), accepted, labeled.size(), failedPages);
        return staged;
    }

    public ImportSession reconcile(ImportSession session) {
        requireState(session, "reconcile", EnumSet.of(ImportState.CHECKING_FUZZY));

        List<CandidateTransaction> transactions = usableTransactions(session.getTransactions());
        if (transactions.isEmpty()) {
            throw new IllegalArgumentException("There are no transactions to save");
        }
        String issuer = requireIssuer(session);
        String period = BillingPeriods.latestPeriod(transactions).orElse(null);
        BigDecimal total = BillingPeriods.positiveTotal(transactions);

        CompletableFuture<List<MatchCandidate>> similarFuture =
                submitCheck(() -> statementMatcher.findSimilar(issuer, period, total));
        CompletableFuture<OverlapResult> overlapFuture =
                submitCheck(() -> overlapDetector.findOverlap(transactions));

        List<MatchCandidate> similar = await(similarFuture);
        OverlapResult overlap = await(overlapFuture);

        List<DuplicateWarning> warnings = new ArrayList<>();
        for (MatchCandidate candidate : similar) {
            warnings.add(new DuplicateWarning(
                    WarningType.STATEMENT_OVERLAP,
                    String.format(Locale.ROOT,
                            "Similar statement #%d (%s) for period %s, totals differ by %.1f%%",
                            candidate.statementId(), candidate.issuer(), candidate.period(),
                            candidate.diffRatio() * 100),
                    candidate.statementId(),
                    candidate.diffRatio()));
        }
        if (overlap.positiveCount() > 0 && overlap.overlapRatio() >= properties.overlapRatioThreshold()) {
            warnings.add(new DuplicateWarning(
                    WarningType.TRANSACTION_OVERLAP,
                    String.format(Locale.ROOT,
                            "%d of %d transactions match stored date and amount (exact %d/%d), %.0f%%",
                            overlap.softCount(), overlap.positiveCount(),
                            overlap.exactCount(), overlap.positiveCount(),
                            overlap.overlapRatio() * 100),
                    null,
                    overlap.overlapRatio()));
        }

        ImportSession checked = session.toBuilder()
                .clearTransactions()
                .transactions(transactions)
                .clearSimilarStatements()
                .similarStatements(similar)
                .overlap(overlap)
                .clearWarnings()
                .warnings(warnings)
                .build();

        if (checked.hasWarnings()) {
            log.info("[Reconciliation] session={} needs confirmation: {} warning(s)",
                    checked.getSessionId(), warnings.size());
            return checked.toBuilder().state(ImportState.AWAITING_CONFIRMATION).build();
        }
        return commit(checked, issuer);
    }

    public ImportSession confirm(ImportSession session) {
        requireState(session, "confirm", EnumSet.of(ImportState.AWAITING_CONFIRMATION));
        List<CandidateTransaction> transactions = usableTransactions(session.getTransactions());
        if (transactions.isEmpty()) {
            throw new IllegalArgumentException("There are no transactions to save");
        }
        String issuer = requireIssuer(session);
        log.info("[Reconciliation] session={} confirmed despite {} warning(s)",
                session.getSessionId(), session.getWarnings().size());
        return commit(session.toBuilder().clearTransactions().transactions(transactions).build(), issuer);
    }

    public ImportSession cancel(ImportSession session) {
        requireState(session, "cancel", EnumSet.of(ImportState.AWAITING_CONFIRMATION, ImportState.CHECKING_FUZZY));
        log.info("[Reconciliation] session={} cancelled", session.getSessionId());
        return session.toBuilder().state(ImportState.CANCELLED).build();
    }

    private ImportSession commit(ImportSession session, String issuer) {
        Statement saved;
        try {
            saved = commitService.commit(session, issuer);
        } catch (DataAccessException | TransactionException e) {
            log.error("[Reconciliation] commit failed for session={}", session.getSessionId(), e);
            throw new CommitFailureException("Could not save the statement, nothing was written", e);
        }
        log.info("[Reconciliation] session={} committed as statement id={}", session.getSessionId(), saved.getId());
        return session.toBuilder()
                .state(ImportState.COMMITTED)
                .issuerLabel(issuer)
                .statementId(saved.getId())
                .build();
    }

    private List<PageExtraction> extractPages(List<RenderedPage> pages) {
        long timeoutMillis = extractionProperties.pageTimeout().toMillis();
        List<CompletableFuture<PageExtraction>> futures = pages.stream()
                .map(page -> submitPage(page, timeoutMillis))
                .toList();
        return futures.stream().map(CompletableFuture::join).toList();
    }

    // A rejected submission counts as a failed page like any other extraction error.
    private CompletableFuture<PageExtraction> submitPage(RenderedPage page, long timeoutMillis) {
        CompletableFuture<PageExtraction> future;
        try {
            future = CompletableFuture
                    .supplyAsync(() -> extractionBoundary.toPageExtraction(pageExtractor.extract(page)), executor)
                    .orTimeout(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            future = CompletableFuture.failedFuture(e);
        }
        return future.exceptionally(ex -> {
            Throwable cause = unwrap(ex);
            log.warn("[Extraction] page {} of '{}' failed: {}",
                    page.pageIndex() + 1, page.filename(), cause.toString());
            return PageExtraction.failedPage();
        });
    }

    private <T> CompletableFuture<T> submitCheck(Supplier<T> check) {
        CompletableFuture<T> future;
        try {
            future = CompletableFuture.supplyAsync(check, checkExecutor);
        } catch (RejectedExecutionException e) {
            log.warn("[Reconciliation] duplicate check pool is saturated, running the check on the caller thread");
            future = new CompletableFuture<>();
            try {
                future.complete(check.get());
            } catch (RuntimeException ex) {
                future.completeExceptionally(ex);
            }
        }
        return future.orTimeout(properties.checkTimeout().toMillis(), TimeUnit.MILLISECONDS);
    }

    private List<ExtractedTransaction> dropStale(List<ExtractedTransaction> transactions) {
        int minYear = LocalDate.now(clock).getYear() - properties.recencyYears();
        return transactions.stream()
                .filter(t -> t.transactionDate() == null || t.transactionDate().getYear() >= minYear)
                .toList();
    }

    private String requireIssuer(ImportSession session) {
        String issuer = consensusAggregator.resolveIssuer(session.getIssuerLabel(), session.getSuggestedIssuer());
        if (issuer == null) {
            throw new IllegalArgumentException("An issuer label is required to save the statement");
        }
        return issuer;
    }

    private static List<CandidateTransaction> usableTransactions(List<CandidateTransaction> transactions) {
        if (transactions == null) {
            return List.of();
        }
        return transactions.stream()
                .filter(t -> t != null && t.amount() != null && t.description() != null && !t.description().isBlank())
                .toList();
    }

    private static void requireState(ImportSession session, String operation, Set<ImportState> allowed) {
        if (session == null) {
            throw new IllegalArgumentException("Import session is required");
        }
        if (!allowed.contains(session.getState())) {
            throw new IllegalImportStateException(operation, session.getState());
        }
    }

    private static <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = unwrap(e);
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Duplicate check failed: " + cause, cause);
        }
    }

    private static Throwable unwrap(Throwable ex) {
        Throwable current = ex;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String trimToNull(String value) {
        if (value == null) return null;
        String v = value.trim();
        return v.isEmpty() ? null : v;
    }
}
