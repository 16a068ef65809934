package com.cardledger.backend.dto.reconciliation;

import java.util.List;
import java.util.UUID;

import com.cardledger.backend.enums.ImportState;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * State of one import attempt. Every orchestrator step returns a new instance; the caller keeps
 * it and hands it back for the next step.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ImportSession {

    UUID sessionId;
    ImportState state;

    String issuerLabel;
    String suggestedIssuer;
    Integer cutoffDay;

    @Singular
    List<String> filenames;
    @Singular
    List<String> fingerprints;
    @Singular
    List<CandidateTransaction> transactions;

    @Singular
    List<FileRejection> rejections;
    @Singular
    List<MatchCandidate> similarStatements;
    OverlapResult overlap;
    @Singular
    List<DuplicateWarning> warnings;

    int failedPages;
    @Singular
    List<String> notices;

    Long statementId;

    public boolean hasWarnings() {
        return warnings != null && !warnings.isEmpty();
    }
}
