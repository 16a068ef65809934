package com.cardledger.backend.services.reconciliation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import com.cardledger.backend.config.ExtractionProperties;
import com.cardledger.backend.config.ReconciliationProperties;
import com.cardledger.backend.dto.extraction.RenderedPage;
import com.cardledger.backend.dto.reconciliation.CandidateTransaction;
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
import com.cardledger.backend.repositories.StatementRepository;
import com.cardledger.backend.services.StatementCommitService;
import com.cardledger.backend.services.classification.CategoryLabelingService;
import com.cardledger.backend.services.classification.DefaultCategoryLabeler;
import com.cardledger.backend.services.extraction.DocumentPageRenderer;
import com.cardledger.backend.services.extraction.ExtractionBoundary;
import com.cardledger.backend.services.extraction.PageExtractor;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

@ExtendWith(MockitoExtension.class)
class ReconciliationOrchestratorTest {

    private static final String PAGE_ONE = """
            {"transactions": [
               {"trans_date": "2024-05-03", "description": "Cafe Amazon", "amount": 100.00},
               {"trans_date": "2024-05-10", "description": "Tops Market", "amount": "250.50"},
               {"trans_date": "2024-05-12", "description": "PAYMENT RECEIVED", "amount": -500, "is_payment": true},
               {"trans_date": "2019-01-01", "description": "Sample row", "amount": 10}
             ],
             "cutoff_day": 15, "bank_name": "KBank", "card_name": "Platinum"}
            """;

    private static final String PAGE_TWO = """
            {"transactions": [
               {"trans_date": "2024-05-14", "description": "Grab", "amount": 89}
             ],
             "cutoff_day": 15, "bank_name": "KBank"}
            """;

    private final ObjectMapper mapper = new ObjectMapper();

    @Mock
    StatementRepository statementRepository;

    @Mock
    DocumentPageRenderer pageRenderer;

    @Mock
    PageExtractor pageExtractor;

    @Mock
    StatementMatcher statementMatcher;

    @Mock
    TransactionOverlapDetector overlapDetector;

    @Mock
    StatementCommitService commitService;

    FingerprintIndex fingerprintIndex;
    ReconciliationOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        fingerprintIndex = new FingerprintIndex(statementRepository);
        orchestrator = orchestratorWith(Runnable::run, Runnable::run, ReconciliationProperties.defaults());
    }

    @Test
    void ingest_freshStatement_commitsWithoutWarnings() throws Exception {
        givenTwoReadablePages("may.pdf");
        when(statementMatcher.findSimilar(eq("KBank Platinum"), eq("2024-05"), any())).thenReturn(List.of());
        when(overlapDetector.findOverlap(anyList())).thenReturn(new OverlapResult(0, 0, 0.0, 3, 3));
        when(commitService.commit(any(), eq("KBank Platinum"))).thenReturn(saved(42L));

        ImportSession result = orchestrator.ingest(request(null, "may.pdf"));

        assertThat(result.getState()).isEqualTo(ImportState.COMMITTED);
        assertThat(result.getStatementId()).isEqualTo(42L);
        assertThat(result.getWarnings()).isEmpty();
        assertThat(result.getCutoffDay()).isEqualTo(15);
        assertThat(result.getSuggestedIssuer()).isEqualTo("KBank Platinum");

        ArgumentCaptor<ImportSession> committed = ArgumentCaptor.forClass(ImportSession.class);
        verify(commitService).commit(committed.capture(), eq("KBank Platinum"));
        assertThat(committed.getValue().getTransactions())
                .extracting(CandidateTransaction::description)
                .containsExactly("Cafe Amazon", "Tops Market", "Grab");
        assertThat(committed.getValue().getFingerprints()).hasSize(1);
    }

    @Test
    void stage_dropsPaymentsAndStaleRowsAndReportsThem() throws Exception {
        givenTwoReadablePages("may.pdf");

        ImportSession staged = orchestrator.stage(request("My KBank", "may.pdf"));

        assertThat(staged.getState()).isEqualTo(ImportState.CHECKING_FUZZY);
        assertThat(staged.getIssuerLabel()).isEqualTo("My KBank");
        assertThat(staged.getTransactions()).hasSize(3)
                .noneMatch(t -> t.description().startsWith("PAYMENT"))
                .noneMatch(t -> t.description().equals("Sample row"));
        assertThat(staged.getNotices()).anyMatch(n -> n.startsWith("1 transaction(s) dated more than 3 years ago"));
        verifyNoInteractions(statementMatcher, overlapDetector, commitService);
    }

    @Test
    void ingest_exactReupload_isRejectedBeforeExtraction() {
        byte[] bytes = content("may.pdf");
        String hex = fingerprintIndex.fingerprint(bytes).hex();
        Statement existing = saved(7L);
        existing.setFileHash(hex);
        existing.setIssuer("KBank");
        existing.setPeriod("2024-05");
        existing.setImportedAt(LocalDateTime.of(2024, 6, 1, 9, 0));
        when(statementRepository.findByFileHashContaining(hex)).thenReturn(List.of(existing));

        ImportSession result = orchestrator.ingest(new ImportRequest("KBank", null, List.of(new UploadedFile("may.pdf", bytes))));

        assertThat(result.getState()).isEqualTo(ImportState.REJECTED_DUPLICATE);
        assertThat(result.getRejections()).singleElement().satisfies(r -> {
            assertThat(r.statementId()).isEqualTo(7L);
            assertThat(r.period()).isEqualTo("2024-05");
            assertThat(r.fingerprint()).isEqualTo(hex);
        });
        verifyNoInteractions(pageRenderer, pageExtractor, commitService);
    }

    @Test
    void ingest_similarStatementTotal_awaitsConfirmationThenCommitsOnConfirm() throws Exception {
        givenTwoReadablePages("may.pdf");
        MatchCandidate similar = new MatchCandidate(3L, "KBank", "2024-05", LocalDateTime.of(2024, 6, 1, 9, 0),
                new BigDecimal("440.00"), 0.0011, false);
        when(statementMatcher.findSimilar(anyString(), eq("2024-05"), any())).thenReturn(List.of(similar));
        when(overlapDetector.findOverlap(anyList())).thenReturn(new OverlapResult(0, 0, 0.0, 3, 3));

        ImportSession waiting = orchestrator.ingest(request("KBank", "may.pdf"));

        assertThat(waiting.getState()).isEqualTo(ImportState.AWAITING_CONFIRMATION);
        assertThat(waiting.getSimilarStatements()).containsExactly(similar);
        assertThat(waiting.getWarnings()).singleElement().satisfies(w -> {
            assertThat(w.type()).isEqualTo(WarningType.STATEMENT_OVERLAP);
            assertThat(w.statementId()).isEqualTo(3L);
            assertThat(w.message()).contains("#3").contains("2024-05");
        });
        verify(commitService, never()).commit(any(), any());

        when(commitService.commit(any(), eq("KBank"))).thenReturn(saved(43L));
        ImportSession confirmed = orchestrator.confirm(waiting);

        assertThat(confirmed.getState()).isEqualTo(ImportState.COMMITTED);
        assertThat(confirmed.getStatementId()).isEqualTo(43L);
    }

    @Test
    void ingest_transactionOverlapAboveThreshold_awaitsConfirmationAndCancelWritesNothing() throws Exception {
        givenTwoReadablePages("may.pdf");
        when(statementMatcher.findSimilar(anyString(), any(), any())).thenReturn(List.of());
        when(overlapDetector.findOverlap(anyList())).thenReturn(new OverlapResult(1, 2, 2.0 / 3, 3, 3));

        ImportSession waiting = orchestrator.ingest(request("KBank", "may.pdf"));

        assertThat(waiting.getState()).isEqualTo(ImportState.AWAITING_CONFIRMATION);
        assertThat(waiting.getWarnings()).singleElement().satisfies(w -> {
            assertThat(w.type()).isEqualTo(WarningType.TRANSACTION_OVERLAP);
            assertThat(w.ratio()).isEqualTo(2.0 / 3);
        });

        ImportSession cancelled = orchestrator.cancel(waiting);

        assertThat(cancelled.getState()).isEqualTo(ImportState.CANCELLED);
        verify(commitService, never()).commit(any(), any());
    }

    @Test
    void reconcile_overlapBelowThreshold_commits() throws Exception {
        givenTwoReadablePages("may.pdf");
        when(statementMatcher.findSimilar(anyString(), any(), any())).thenReturn(List.of());
        when(overlapDetector.findOverlap(anyList())).thenReturn(new OverlapResult(1, 1, 1.0 / 3, 3, 3));
        when(commitService.commit(any(), any())).thenReturn(saved(44L));

        ImportSession result = orchestrator.ingest(request("KBank", "may.pdf"));

        assertThat(result.getState()).isEqualTo(ImportState.COMMITTED);
    }

    @Test
    void stage_failedPageIsCountedAndOtherPagesKept() throws Exception {
        RenderedPage first = new RenderedPage("may.pdf", 0, null);
        RenderedPage second = new RenderedPage("may.pdf", 1, null);
        when(pageRenderer.render(any(), any())).thenReturn(List.of(first, second));
        when(pageExtractor.extract(first)).thenThrow(new IllegalStateException("extractor down"));
        when(pageExtractor.extract(second)).thenReturn(json(PAGE_TWO));

        ImportSession staged = orchestrator.stage(request("KBank", "may.pdf"));

        assertThat(staged.getState()).isEqualTo(ImportState.CHECKING_FUZZY);
        assertThat(staged.getFailedPages()).isEqualTo(1);
        assertThat(staged.getTransactions()).extracting(CandidateTransaction::description).containsExactly("Grab");
        assertThat(staged.getNotices()).anyMatch(n -> n.contains("1 of 2 pages"));
    }

    @Test
    void stage_nothingExtracted_isCancelledWithNotice() {
        RenderedPage only = new RenderedPage("blank.png", 0, null);
        when(pageRenderer.render(any(), any())).thenReturn(List.of(only));
        when(pageExtractor.extract(only)).thenReturn(mapper.createObjectNode());

        ImportSession staged = orchestrator.stage(request("KBank", "blank.png"));

        assertThat(staged.getState()).isEqualTo(ImportState.CANCELLED);
        assertThat(staged.getNotices()).contains("No transactions were found in the uploaded files");
    }

    @Test
    void stage_multipleFiles_joinsThemIntoOneBatch() throws Exception {
        RenderedPage a = new RenderedPage("a.pdf", 0, null);
        RenderedPage b = new RenderedPage("b.pdf", 0, null);
        when(pageRenderer.render(any(), any())).thenAnswer(inv -> {
            UploadedFile file = inv.getArgument(0);
            return List.of(file.filename().equals("a.pdf") ? a : b);
        });
        when(pageExtractor.extract(a)).thenReturn(json(PAGE_ONE));
        when(pageExtractor.extract(b)).thenReturn(json(PAGE_TWO));

        ImportSession staged = orchestrator.stage(request(null, "a.pdf", "b.pdf"));

        assertThat(staged.getFilenames()).containsExactly("a.pdf", "b.pdf");
        assertThat(staged.getFingerprints()).hasSize(2).doesNotHaveDuplicates();
        assertThat(staged.getTransactions()).hasSize(3);
        assertThat(staged.getSuggestedIssuer()).isEqualTo("KBank Platinum");
    }

    @Test
    void stage_unreadableFileBecomesNoticeNotRejection() {
        when(pageRenderer.render(any(), any())).thenThrow(new IllegalArgumentException("PDF locked.pdf is password protected"));

        ImportSession staged = orchestrator.stage(request("KBank", "locked.pdf"));

        assertThat(staged.getState()).isEqualTo(ImportState.CANCELLED);
        assertThat(staged.getRejections()).isEmpty();
        assertThat(staged.getNotices()).anyMatch(n -> n.contains("password protected"));
    }

    @Test
    void stage_noFiles_isRejected() {
        assertThatThrownBy(() -> orchestrator.stage(new ImportRequest("KBank", null, List.of())))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void reconcile_withoutAnyIssuer_isRejected() throws Exception {
        givenTwoReadablePages("may.pdf");
        ImportSession staged = orchestrator.stage(request(null, "may.pdf"))
                .toBuilder().suggestedIssuer(null).build();

        assertThatThrownBy(() -> orchestrator.reconcile(staged))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("issuer");
        verifyNoInteractions(statementMatcher, overlapDetector);
    }

    @Test
    void confirm_outsideAwaitingConfirmation_isIllegal() {
        ImportSession committed = ImportSession.builder().state(ImportState.COMMITTED).build();

        assertThatThrownBy(() -> orchestrator.confirm(committed))
                .isInstanceOf(IllegalImportStateException.class)
                .satisfies(e -> assertThat(((IllegalImportStateException) e).getState()).isEqualTo(ImportState.COMMITTED));
        assertThatThrownBy(() -> orchestrator.cancel(committed)).isInstanceOf(IllegalImportStateException.class);
        assertThatThrownBy(() -> orchestrator.reconcile(committed)).isInstanceOf(IllegalImportStateException.class);
    }

    @Test
    void commitFailure_isWrappedAndSurfaced() throws Exception {
        givenTwoReadablePages("may.pdf");
        when(statementMatcher.findSimilar(anyString(), any(), any())).thenReturn(List.of());
        when(overlapDetector.findOverlap(anyList())).thenReturn(OverlapResult.none(3));
        when(commitService.commit(any(), any())).thenThrow(new DataIntegrityViolationException("constraint"));

        assertThatThrownBy(() -> orchestrator.ingest(request("KBank", "may.pdf")))
                .isInstanceOf(CommitFailureException.class)
                .hasCauseInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    void duplicateCheckFailure_propagates() throws Exception {
        givenTwoReadablePages("may.pdf");
        when(statementMatcher.findSimilar(anyString(), any(), any())).thenThrow(new IllegalStateException("db down"));
        when(overlapDetector.findOverlap(anyList())).thenReturn(OverlapResult.none(3));

        assertThatThrownBy(() -> orchestrator.ingest(request("KBank", "may.pdf")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("db down");
        verify(commitService, never()).commit(any(), any());
    }

    @Test
    void stage_rejectedPageSubmissionCountsAsFailedPage() {
        RenderedPage first = new RenderedPage("may.pdf", 0, null);
        RenderedPage second = new RenderedPage("may.pdf", 1, null);
        when(pageRenderer.render(any(), any())).thenReturn(List.of(first, second));
        Executor saturated = task -> {
            throw new RejectedExecutionException("queue full");
        };
        ReconciliationOrchestrator busy = orchestratorWith(saturated, Runnable::run, ReconciliationProperties.defaults());

        ImportSession staged = busy.stage(request("KBank", "may.pdf"));

        assertThat(staged.getState()).isEqualTo(ImportState.CANCELLED);
        assertThat(staged.getFailedPages()).isEqualTo(2);
        assertThat(staged.getNotices()).anyMatch(n -> n.contains("2 of 2 pages"));
        verifyNoInteractions(pageExtractor);
    }

    @Test
    void reconcile_saturatedCheckPool_runsChecksOnCallerThread() throws Exception {
        givenTwoReadablePages("may.pdf");
        when(statementMatcher.findSimilar(anyString(), any(), any())).thenReturn(List.of());
        when(overlapDetector.findOverlap(anyList())).thenReturn(OverlapResult.none(3));
        when(commitService.commit(any(), any())).thenReturn(saved(45L));
        Executor saturated = task -> {
            throw new RejectedExecutionException("queue full");
        };
        ReconciliationOrchestrator busy = orchestratorWith(Runnable::run, saturated, ReconciliationProperties.defaults());

        ImportSession result = busy.ingest(request("KBank", "may.pdf"));

        assertThat(result.getState()).isEqualTo(ImportState.COMMITTED);
        assertThat(result.getStatementId()).isEqualTo(45L);
    }

    @Test
    void reconcile_checkThatNeverFinishes_timesOutWithoutCommitting() throws Exception {
        givenTwoReadablePages("may.pdf");
        Executor stuck = task -> { };
        ReconciliationProperties shortTimeout = new ReconciliationProperties(null, null, null, null, Duration.ofMillis(50));
        ReconciliationOrchestrator slow = orchestratorWith(Runnable::run, stuck, shortTimeout);
        ImportSession staged = slow.stage(request("KBank", "may.pdf"));

        assertThatThrownBy(() -> slow.reconcile(staged))
                .isInstanceOf(IllegalStateException.class)
                .hasCauseInstanceOf(TimeoutException.class);
        verifyNoInteractions(statementMatcher, overlapDetector, commitService);
    }

    private ReconciliationOrchestrator orchestratorWith(Executor pageExecutor, Executor checkExecutor,
                                                        ReconciliationProperties properties) {
        Clock clock = Clock.fixed(Instant.parse("2024-06-15T10:00:00Z"), ZoneOffset.UTC);
        return new ReconciliationOrchestrator(
                fingerprintIndex,
                pageRenderer,
                pageExtractor,
                new ExtractionBoundary(),
                new CategoryLabelingService(new DefaultCategoryLabeler()),
                new ConsensusAggregator(),
                statementMatcher,
                overlapDetector,
                commitService,
                properties,
                ExtractionProperties.defaults(),
                pageExecutor,
                checkExecutor,
                clock);
    }

    private void givenTwoReadablePages(String filename) throws Exception {
        RenderedPage first = new RenderedPage(filename, 0, null);
        RenderedPage second = new RenderedPage(filename, 1, null);
        when(pageRenderer.render(any(), any())).thenReturn(List.of(first, second));
        when(pageExtractor.extract(first)).thenReturn(json(PAGE_ONE));
        when(pageExtractor.extract(second)).thenReturn(json(PAGE_TWO));
    }

    private JsonNode json(String raw) throws Exception {
        return mapper.readTree(raw);
    }

    private static ImportRequest request(String issuer, String... filenames) {
        List<UploadedFile> files = java.util.Arrays.stream(filenames)
                .map(name -> new UploadedFile(name, content(name)))
                .toList();
        return new ImportRequest(issuer, null, files);
    }

    private static byte[] content(String filename) {
        return ("%PDF-fake " + filename).getBytes(StandardCharsets.UTF_8);
    }

    private static Statement saved(Long id) {
        Statement s = new Statement();
        s.setId(id);
        return s;
    }
}
