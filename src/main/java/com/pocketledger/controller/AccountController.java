package com.pocketledger.controller;

import com.pocketledger.dto.AccountRequest;
import com.pocketledger.dto.ApiResponses;
import com.pocketledger.dto.BalancesRequest;
import com.pocketledger.dto.RequestDates;
import com.pocketledger.dto.TransferRequest;
import com.pocketledger.security.CurrentUser;
import com.pocketledger.service.AccountService;
import com.pocketledger.service.DateRange;
import com.pocketledger.service.TransferService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

/**
 * REST controller for accounts, transfers and balance reports.
 *
 * RULES:
 * - No business logic: pure delegation to AccountService and TransferService
 * - Balances are never written here; they move only through postings
 *
 * HTTP CONTRACT SUMMARY:
 * POST   /accounts                     → 201 | 400
 * GET    /accounts                     → 200
 * GET    /accounts/{id}                → 200 | 403 | 404
 * PUT    /accounts/{id}                → 200 | 403 | 404 | 409 concurrent edit
 * DELETE /accounts/{id}                → 204 | 403 | 404 | 409 has transactions
 * POST   /accounts/transfer            → 200 | 400 InvalidTransfer / InvalidReference
 * GET    /accounts/balance             → 200
 * GET    /accounts/balance/{id}        → 200 | 400 bad range | 403 | 404
 * POST   /accounts/balances            → 200 | 400
 */
@RestController
@RequestMapping("/accounts")
@Tag(name = "Accounts", description = "Accounts, transfers and balance reconstruction")
public class AccountController {

    private final AccountService accountService;
    private final TransferService transferService;

    public AccountController(AccountService accountService, TransferService transferService) {
        this.accountService = accountService;
        this.transferService = transferService;
    }

    // ─────────────────────────────────────────────────────────────────────────
    // CRUD
    // ─────────────────────────────────────────────────────────────────────────

    @PostMapping
    @Operation(summary = "Create account", description = "Type defaults to CHECKING, initial balance to 0")
    public ResponseEntity<ApiResponses.AccountResponse> create(
            @Valid @RequestBody AccountRequest request,
            Authentication authentication) {
        return ResponseEntity
                .status(HttpStatus.CREATED)
                .body(new ApiResponses.AccountResponse(
                        accountService.create(CurrentUser.idOf(authentication), request.toDetails())));
    }

    @GetMapping
    @Operation(summary = "List accounts")
    public ResponseEntity<List<ApiResponses.AccountResponse>> list(Authentication authentication) {
        return ResponseEntity.ok(accountService.list(CurrentUser.idOf(authentication)).stream()
                .map(ApiResponses.AccountResponse::new)
                .toList());
    }

    @GetMapping("/{accountId}")
    @Operation(summary = "Get account")
    public ResponseEntity<ApiResponses.AccountResponse> get(
            @Parameter(description = "Account ID") @PathVariable Long accountId,
            Authentication authentication) {
        return ResponseEntity.ok(new ApiResponses.AccountResponse(
                accountService.get(CurrentUser.idOf(authentication), accountId)));
    }

    @PutMapping("/{accountId}")
    @Operation(summary = "Update account", description = "Changes display attributes only; balances are untouched")
    public ResponseEntity<ApiResponses.AccountResponse> update(
            @Parameter(description = "Account ID") @PathVariable Long accountId,
            @Valid @RequestBody AccountRequest request,
            Authentication authentication) {
        return ResponseEntity.ok(new ApiResponses.AccountResponse(
                accountService.update(CurrentUser.idOf(authentication), accountId, request.toDetails())));
    }

    @DeleteMapping("/{accountId}")
    @Operation(summary = "Delete account", description = "Refused while transactions reference the account")
    public ResponseEntity<Void> delete(
            @Parameter(description = "Account ID") @PathVariable Long accountId,
            Authentication authentication) {
        accountService.delete(CurrentUser.idOf(authentication), accountId);
        return ResponseEntity.noContent().build();
    }

    // ─────────────────────────────────────────────────────────────────────────
    // TRANSFER
    // ─────────────────────────────────────────────────────────────────────────

    /**
     * HTTP Contract:
     * - 200 OK          → both legs posted
     * - 400 Bad Request → same account, non-positive amount, or account not owned
     * - 500             → store aborted the unit; nothing was posted
     */
    @PostMapping("/transfer")
    @Operation(
        summary = "Transfer between accounts",
        description = "Atomically posts TRANSFER_OUT on the source and TRANSFER_IN on the destination"
    )
    @io.swagger.v3.oas.annotations.responses.ApiResponses({
        @ApiResponse(responseCode = "200", description = "Transfer posted"),
        @ApiResponse(responseCode = "400", description = "Invalid transfer or account reference")
    })
    public ResponseEntity<ApiResponses.TransferResponse> transfer(
            @Valid @RequestBody TransferRequest request,
            Authentication authentication) {
        TransferService.TransferResult result = transferService.transfer(
                CurrentUser.idOf(authentication),
                request.getSourceAccountId(),
                request.getDestinationAccountId(),
                request.getAmount(),
                RequestDates.parse(request.getDate()),
                request.getDescription()
        );
        return ResponseEntity.ok(new ApiResponses.TransferResponse(result.debit(), result.credit()));
    }

    // ─────────────────────────────────────────────────────────────────────────
    // BALANCES
    // ─────────────────────────────────────────────────────────────────────────

    @GetMapping("/balance")
    @Operation(summary = "All balances", description = "Reconstructed and cached balance of every account")
    public ResponseEntity<List<ApiResponses.BalanceResponse>> balances(Authentication authentication) {
        return ResponseEntity.ok(accountService.balances(CurrentUser.idOf(authentication)).stream()
                .map(ApiResponses.BalanceResponse::new)
                .toList());
    }

    @GetMapping("/balance/{accountId}")
    @Operation(
        summary = "Account balance",
        description = "Reconstructed balance; with a date range also opening, closing and period net"
    )
    public ResponseEntity<ApiResponses.BalanceResponse> balance(
            @Parameter(description = "Account ID") @PathVariable Long accountId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            Authentication authentication) {
        DateRange range = DateRange.ofDays(startDate, endDate).orElse(null);
        return ResponseEntity.ok(new ApiResponses.BalanceResponse(
                accountService.balance(CurrentUser.idOf(authentication), accountId, range)));
    }

    @PostMapping("/balances")
    @Operation(summary = "Balances of selected accounts")
    public ResponseEntity<List<ApiResponses.BalanceResponse>> balancesOf(
            @Valid @RequestBody BalancesRequest request,
            Authentication authentication) {
        DateRange range = DateRange.ofDays(request.getStartDate(), request.getEndDate()).orElse(null);
        return ResponseEntity.ok(accountService
                .balances(CurrentUser.idOf(authentication), request.getAccountIds(), range).stream()
                .map(ApiResponses.BalanceResponse::new)
                .toList());
    }
}
