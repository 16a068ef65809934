package com.cardledger.backend.controllers;

import java.util.List;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.cardledger.backend.dto.ApiResponse;
import com.cardledger.backend.dto.TransactionResponseDTO;
import com.cardledger.backend.services.StatementService;

import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/transactions")
@RequiredArgsConstructor
public class TransactionController {

    private final StatementService statementService;

    @GetMapping
    public ResponseEntity<ApiResponse<List<TransactionResponseDTO>>> list(
            @RequestParam(value = "period", defaultValue = "all") String period
    ) {
        return ResponseEntity.ok(ApiResponse.success(statementService.listTransactions(period), "Transactions found"));
    }
}
