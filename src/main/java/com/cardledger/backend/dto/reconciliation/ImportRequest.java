package com.cardledger.backend.dto.reconciliation;

import java.util.List;

/**
 * @param issuerLabel label typed by the user; may be blank, then the extracted suggestion is used
 * @param password    PDF password, applied to every PDF of the batch
 */
public record ImportRequest(String issuerLabel, String password, List<UploadedFile> files) {

    public ImportRequest {
        files = files == null ? List.of() : List.copyOf(files);
    }
}
