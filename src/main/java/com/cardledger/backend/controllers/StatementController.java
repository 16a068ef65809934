package com.cardledger.backend.controllers;

import java.util.List;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.cardledger.backend.dto.ApiResponse;
import com.cardledger.backend.dto.StatementResponseDTO;
import com.cardledger.backend.services.StatementService;

import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/statements")
@RequiredArgsConstructor
public class StatementController {

    private final StatementService statementService;

    @GetMapping
    public ResponseEntity<ApiResponse<List<StatementResponseDTO>>> list() {
        return ResponseEntity.ok(ApiResponse.success(statementService.listStatements(), "Statements found"));
    }

    @GetMapping("/issuers")
    public ResponseEntity<ApiResponse<List<String>>> previousIssuers() {
        return ResponseEntity.ok(ApiResponse.success(statementService.previousIssuers(), "Issuers found"));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<Void>> delete(@PathVariable Long id) {
        statementService.delete(id);
        return ResponseEntity.ok(ApiResponse.success(null, "Statement deleted"));
    }
}
