package com.cardledger.backend.services.reconciliation;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Optional;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.cardledger.backend.dto.reconciliation.Fingerprint;
import com.cardledger.backend.entities.Statement;
import com.cardledger.backend.repositories.StatementRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Exact re-upload detection over whole-file SHA-256 digests.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FingerprintIndex {

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private final StatementRepository statementRepository;

    public Fingerprint fingerprint(byte[] bytes) {
        if (bytes == null) {
            throw new IllegalArgumentException("Cannot fingerprint a missing file");
        }
        return new Fingerprint(computeSha256Hex(bytes));
    }

    /**
     * Returns the first stored statement that lists this exact fingerprint among its file hashes.
     */
    @Transactional(readOnly = true)
    public Optional<Statement> findDuplicate(Fingerprint fingerprint) {
        if (fingerprint == null) {
            return Optional.empty();
        }
        String hex = fingerprint.hex();
        for (Statement statement : statementRepository.findByFileHashContaining(hex)) {
            try {
                if (statement.fileHashes().contains(hex)) {
                    log.info("[Fingerprint] {} already imported as statement id={}", abbreviate(hex), statement.getId());
                    return Optional.of(statement);
                }
            } catch (RuntimeException e) {
                log.warn("[Fingerprint] skipping unreadable hash list on statement id={}: {}",
                        statement.getId(), e.getMessage());
            }
        }
        return Optional.empty();
    }

    private static String computeSha256Hex(byte[] bytes) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return toHexLower(digest.digest(bytes));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String toHexLower(byte[] bytes) {
        char[] hex = new char[bytes.length * 2];
        for (int i = 0; i < bytes.length; i++) {
            int v = bytes[i] & 0xFF;
            hex[i * 2] = HEX[v >>> 4];
            hex[i * 2 + 1] = HEX[v & 0x0F];
        }
        return new String(hex);
    }

    static String abbreviate(String hex) {
        return hex.length() > 12 ? hex.substring(0, 12) + "..." : hex;
    }
}
