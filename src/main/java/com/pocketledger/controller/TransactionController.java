package com.pocketledger.controller;

import com.pocketledger.domain.Transaction;
import com.pocketledger.dto.ApiResponses;
import com.pocketledger.dto.RequestDates;
import com.pocketledger.dto.TransactionRequest;
import com.pocketledger.dto.TransactionUpdateRequest;
import com.pocketledger.receipt.StoredReceipt;
import com.pocketledger.security.CurrentUser;
import com.pocketledger.service.DateRange;
import com.pocketledger.service.TransactionChanges;
import com.pocketledger.service.TransactionDraft;
import com.pocketledger.service.TransactionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.LocalDate;
import java.util.List;

/**
 * REST controller for expenses/income and their receipts.
 *
 * RULES:
 * - No business logic: pure delegation to TransactionService
 * - The type given on create is case-insensitive (default EXPENSE); on update it is ignored
 *
 * HTTP CONTRACT SUMMARY:
 * POST   /expenses                  → 201 | 400
 * GET    /expenses                  → 200 (filters: startDate, endDate, accountId)
 * GET    /expenses/{id}             → 200 | 403 | 404
 * PUT    /expenses/{id}             → 200 | 400 | 403 | 404
 * DELETE /expenses/{id}             → 204 | 403 | 404
 * POST   /expenses/{id}/receipt     → 200 | 403 | 404
 * GET    /expenses/{id}/receipt     → 200 (file) | 403 | 404
 * DELETE /expenses/{id}/receipt     → 204 | 403 | 404
 */
@RestController
@RequestMapping("/expenses")
@Tag(name = "Transactions", description = "Expenses, income and receipts")
public class TransactionController {

    private final TransactionService transactionService;

    public TransactionController(TransactionService transactionService) {
        this.transactionService = transactionService;
    }

    // ─────────────────────────────────────────────────────────────────────────
    // READ
    // ─────────────────────────────────────────────────────────────────────────

    @GetMapping
    @Operation(summary = "List transactions", description = "Newest first; date range is inclusive, in UTC days")
    public ResponseEntity<List<ApiResponses.TransactionResponse>> list(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @RequestParam(required = false) Long accountId,
            Authentication authentication) {
        DateRange range = DateRange.ofDays(startDate, endDate).orElse(null);
        return ResponseEntity.ok(transactionService
                .list(CurrentUser.idOf(authentication), accountId, range).stream()
                .map(ApiResponses.TransactionResponse::new)
                .toList());
    }

    @GetMapping("/{transactionId}")
    @Operation(summary = "Get transaction")
    public ResponseEntity<ApiResponses.TransactionResponse> get(
            @Parameter(description = "Transaction ID") @PathVariable Long transactionId,
            Authentication authentication) {
        return ResponseEntity.ok(new ApiResponses.TransactionResponse(
                transactionService.get(CurrentUser.idOf(authentication), transactionId)));
    }

    // ─────────────────────────────────────────────────────────────────────────
    // MUTATIONS
    // ─────────────────────────────────────────────────────────────────────────

    /**
     * HTTP Contract:
     * - 201 Created     → transaction posted, account balance moved
     * - 400 Bad Request → invalid fields, unknown type, or account/category not owned
     * - 500             → store aborted the unit; nothing was posted
     */
    @PostMapping
    @Operation(summary = "Create transaction")
    @io.swagger.v3.oas.annotations.responses.ApiResponses({
        @ApiResponse(responseCode = "201", description = "Transaction posted"),
        @ApiResponse(responseCode = "400", description = "Invalid input or foreign account/category")
    })
    public ResponseEntity<ApiResponses.TransactionResponse> create(
            @Valid @RequestBody TransactionRequest request,
            Authentication authentication) {
        Transaction.TransactionType type = request.getType() == null || request.getType().isBlank()
                ? Transaction.TransactionType.EXPENSE
                : Transaction.TransactionType.parse(request.getType());

        Transaction tx = transactionService.create(CurrentUser.idOf(authentication), new TransactionDraft(
                request.getDescription(),
                request.getAmount(),
                type,
                RequestDates.parse(request.getDate()),
                request.getAccountId(),
                request.getCategoryId()
        ));
        return ResponseEntity.status(HttpStatus.CREATED).body(new ApiResponses.TransactionResponse(tx));
    }

    @PutMapping("/{transactionId}")
    @Operation(summary = "Update transaction", description = "Type cannot be changed")
    public ResponseEntity<ApiResponses.TransactionResponse> update(
            @Parameter(description = "Transaction ID") @PathVariable Long transactionId,
            @Valid @RequestBody TransactionUpdateRequest request,
            Authentication authentication) {
        Transaction tx = transactionService.update(CurrentUser.idOf(authentication), transactionId,
                new TransactionChanges(
                        request.getDescription(),
                        request.getAmount(),
                        RequestDates.parse(request.getDate()),
                        request.getAccountId(),
                        request.getCategoryId()
                ));
        return ResponseEntity.ok(new ApiResponses.TransactionResponse(tx));
    }

    @DeleteMapping("/{transactionId}")
    @Operation(summary = "Delete transaction", description = "Reverts the balance; the receipt is released best-effort")
    public ResponseEntity<Void> delete(
            @Parameter(description = "Transaction ID") @PathVariable Long transactionId,
            Authentication authentication) {
        transactionService.delete(CurrentUser.idOf(authentication), transactionId);
        return ResponseEntity.noContent().build();
    }

    // ─────────────────────────────────────────────────────────────────────────
    // RECEIPTS
    // ─────────────────────────────────────────────────────────────────────────

    @PostMapping(value = "/{transactionId}/receipt", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Upload receipt")
    public ResponseEntity<ApiResponses.ReceiptUploadResponse> uploadReceipt(
            @Parameter(description = "Transaction ID") @PathVariable Long transactionId,
            @RequestPart("file") MultipartFile file,
            Authentication authentication) {
        String contentType = file.getContentType() != null
                ? file.getContentType()
                : MediaType.APPLICATION_OCTET_STREAM_VALUE;
        String key = transactionService.attachReceipt(
                CurrentUser.idOf(authentication), transactionId, contentType, readBytes(file));
        return ResponseEntity.ok(new ApiResponses.ReceiptUploadResponse("Receipt uploaded", key));
    }

    @GetMapping("/{transactionId}/receipt")
    @Operation(summary = "Download receipt")
    public ResponseEntity<byte[]> downloadReceipt(
            @Parameter(description = "Transaction ID") @PathVariable Long transactionId,
            Authentication authentication) {
        StoredReceipt receipt = transactionService.loadReceipt(CurrentUser.idOf(authentication), transactionId);
        MediaType mediaType = receipt.contentType() != null
                ? MediaType.parseMediaType(receipt.contentType())
                : MediaType.APPLICATION_OCTET_STREAM;
        return ResponseEntity.ok().contentType(mediaType).body(receipt.content());
    }

    @DeleteMapping("/{transactionId}/receipt")
    @Operation(summary = "Delete receipt")
    public ResponseEntity<Void> deleteReceipt(
            @Parameter(description = "Transaction ID") @PathVariable Long transactionId,
            Authentication authentication) {
        transactionService.removeReceipt(CurrentUser.idOf(authentication), transactionId);
        return ResponseEntity.noContent().build();
    }

    private static byte[] readBytes(MultipartFile file) {
        try {
            return file.getBytes();
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read uploaded receipt", e);
        }
    }
}
