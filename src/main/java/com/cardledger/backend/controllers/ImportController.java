package com.cardledger.backend.controllers;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import com.cardledger.backend.dto.ApiResponse;
import com.cardledger.backend.dto.reconciliation.ImportRequest;
import com.cardledger.backend.dto.reconciliation.ImportSession;
import com.cardledger.backend.dto.reconciliation.UploadedFile;
import com.cardledger.backend.exceptions.BadRequestException;
import com.cardledger.backend.services.reconciliation.ReconciliationOrchestrator;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@RestController
@RequestMapping("/api/imports")
@RequiredArgsConstructor
@Slf4j
public class ImportController {

    private final ReconciliationOrchestrator orchestrator;

    /**
     * Uploads one batch of statement files and returns the staged session for review.
     */
    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ApiResponse<ImportSession>> stage(
            @RequestParam("files") List<MultipartFile> files,
            @RequestParam(value = "issuer", required = false) String issuer,
            @RequestParam(value = "password", required = false) String password
    ) {
        if (files == null || files.isEmpty() || files.stream().allMatch(MultipartFile::isEmpty)) {
            throw new BadRequestException("No file uploaded or file is empty");
        }

        List<UploadedFile> uploads = new ArrayList<>();
        for (MultipartFile file : files) {
            if (file.isEmpty()) {
                continue;
            }
            try {
                uploads.add(new UploadedFile(file.getOriginalFilename(), file.getBytes()));
            } catch (IOException e) {
                throw new BadRequestException("Could not read uploaded file " + file.getOriginalFilename());
            }
        }

        ImportSession session = orchestrator.stage(new ImportRequest(issuer, password, uploads));
        return ResponseEntity.ok(ApiResponse.success(session, "Import staged"));
    }

    @PostMapping("/reconcile")
    public ResponseEntity<ApiResponse<ImportSession>> reconcile(@RequestBody ImportSession session) {
        ImportSession result = orchestrator.reconcile(session);
        String message = result.hasWarnings() ? "Possible duplicate, confirmation required" : "Statement saved";
        return ResponseEntity.ok(ApiResponse.success(result, message));
    }

    @PostMapping("/confirm")
    public ResponseEntity<ApiResponse<ImportSession>> confirm(@RequestBody ImportSession session) {
        return ResponseEntity.ok(ApiResponse.success(orchestrator.confirm(session), "Statement saved"));
    }

    @PostMapping("/cancel")
    public ResponseEntity<ApiResponse<ImportSession>> cancel(@RequestBody ImportSession session) {
        return ResponseEntity.ok(ApiResponse.success(orchestrator.cancel(session), "Import cancelled"));
    }
}
