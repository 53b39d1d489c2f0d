package com.flagship.token_ledger.api;

import com.flagship.token_ledger.account.Account;
import com.flagship.token_ledger.api.dto.ArchiveInfoResponse;
import com.flagship.token_ledger.api.dto.BalanceResponse;
import com.flagship.token_ledger.api.dto.CreateBurnRequest;
import com.flagship.token_ledger.api.dto.CreateTransferRequest;
import com.flagship.token_ledger.api.dto.LedgerInfoResponse;
import com.flagship.token_ledger.api.dto.TransactionRangeResponse;
import com.flagship.token_ledger.api.dto.TransactionResponse;
import com.flagship.token_ledger.api.dto.TransferResponse;
import com.flagship.token_ledger.api.exception.TransferRejectedException;
import com.flagship.token_ledger.ledger.TransferArgs;
import com.flagship.token_ledger.observability.CorrelationContext;
import com.flagship.token_ledger.ledger.TransferResult;
import com.flagship.token_ledger.service.LedgerService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.HexFormat;
import java.util.List;

/**
 * REST controller for the token ledger.
 *
 * Writes identify the caller through the X-Caller header; the sending account is
 * the caller plus the optional from_subaccount. Rejected writes come back as
 * error bodies carrying the rejection kind and its details.
 */
@RestController
@RequestMapping("/api/ledger")
@RequiredArgsConstructor
public class LedgerController {

    static final String CALLER_HEADER = CorrelationContext.CALLER_HEADER;

    private final LedgerService ledgerService;

    @GetMapping
    public ResponseEntity<LedgerInfoResponse> info() {
        return ResponseEntity.ok(LedgerInfoResponse.from(ledgerService.ledger()));
    }

    @GetMapping("/archive")
    public ResponseEntity<ArchiveInfoResponse> archive() {
        return ResponseEntity.ok(ArchiveInfoResponse.from(ledgerService.archiveInfo()));
    }

    @GetMapping("/balances/{owner}")
    public ResponseEntity<BalanceResponse> balance(
            @PathVariable("owner") String owner,
            @RequestParam(value = "subaccount", required = false) String subaccount) {
        Account account = Account.of(owner, subaccount);
        return ResponseEntity.ok(new BalanceResponse(account.toString(), ledgerService.balanceOf(account)));
    }

    @PostMapping("/transfers")
    public ResponseEntity<TransferResponse> transfer(
            @Valid @RequestBody CreateTransferRequest request,
            @RequestHeader(CALLER_HEADER) String caller) {
        return respond(ledgerService.transfer(toArgs(request), caller));
    }

    @PostMapping("/mints")
    public ResponseEntity<TransferResponse> mint(
            @Valid @RequestBody CreateTransferRequest request,
            @RequestHeader(CALLER_HEADER) String caller) {
        return respond(ledgerService.mint(toArgs(request), caller));
    }

    @PostMapping("/burns")
    public ResponseEntity<TransferResponse> burn(
            @Valid @RequestBody CreateBurnRequest request,
            @RequestHeader(CALLER_HEADER) String caller) {
        TransferArgs args = TransferArgs.builder()
            .fromSubaccount(hex(request.getFromSubaccount()))
            .amount(request.getAmount())
            .memo(hex(request.getMemo()))
            .createdAtTime(request.getCreatedAtTime())
            .build();
        return respond(ledgerService.burn(args, caller));
    }

    @GetMapping("/transactions/{index}")
    public ResponseEntity<TransactionResponse> getTransaction(@PathVariable("index") long index) {
        return ledgerService.getTransaction(index)
            .map(tx -> ResponseEntity.ok(TransactionResponse.from(tx)))
            .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/transactions")
    public ResponseEntity<TransactionRangeResponse> getTransactions(
            @RequestParam("start") long start,
            @RequestParam("length") long length) {
        return ResponseEntity.ok(TransactionRangeResponse.from(ledgerService.getTransactions(start, length)));
    }

    @GetMapping("/transactions/resolved")
    public ResponseEntity<List<TransactionResponse>> getTransactionsResolved(
            @RequestParam("start") long start,
            @RequestParam("length") long length) {
        List<TransactionResponse> transactions = ledgerService.getTransactionsResolved(start, length).stream()
            .map(TransactionResponse::from)
            .toList();
        return ResponseEntity.ok(transactions);
    }

    private ResponseEntity<TransferResponse> respond(TransferResult result) {
        if (!result.isOk()) {
            throw new TransferRejectedException(result.getError());
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(new TransferResponse(result.getIndex()));
    }

    private static TransferArgs toArgs(CreateTransferRequest request) {
        return TransferArgs.builder()
            .fromSubaccount(hex(request.getFromSubaccount()))
            .to(Account.of(request.getToOwner(), request.getToSubaccount()))
            .amount(request.getAmount())
            .fee(request.getFee())
            .memo(hex(request.getMemo()))
            .createdAtTime(request.getCreatedAtTime())
            .build();
    }

    private static byte[] hex(String value) {
        return value == null || value.isEmpty() ? null : HexFormat.of().parseHex(value);
    }
}
