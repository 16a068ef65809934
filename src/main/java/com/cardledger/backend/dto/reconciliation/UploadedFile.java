package com.cardledger.backend.dto.reconciliation;

public record UploadedFile(String filename, byte[] content) {

    public UploadedFile {
        if (filename == null || filename.isBlank()) {
            filename = "upload";
        }
    }
}
