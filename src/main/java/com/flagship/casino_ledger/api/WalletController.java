package com.flagship.casino_ledger.api;

import com.flagship.casino_ledger.api.dto.AdjustBalanceRequest;
import com.flagship.casino_ledger.api.dto.LoanRequest;
import com.flagship.casino_ledger.economy.BegResult;
import com.flagship.casino_ledger.economy.BegService;
import com.flagship.casino_ledger.economy.LoanResult;
import com.flagship.casino_ledger.economy.LoanService;
import com.flagship.casino_ledger.ledger.Account;
import com.flagship.casino_ledger.ledger.GameSource;
import com.flagship.casino_ledger.ledger.LedgerEntry;
import com.flagship.casino_ledger.ledger.UpdateKind;
import com.flagship.casino_ledger.ledger.WalletService;
import com.flagship.casino_ledger.session.CrashRecord;
import com.flagship.casino_ledger.session.GameSessionCoordinator;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/guilds/{guildId}/players/{userId}")
@RequiredArgsConstructor
@Slf4j
public class WalletController {

    private final WalletService walletService;
    private final BegService begService;
    private final LoanService loanService;
    private final GameSessionCoordinator sessions;

    @GetMapping("/wallet")
    public Account getWallet(@PathVariable String guildId, @PathVariable String userId) {
        return walletService.getAccount(userId, guildId);
    }

    /**
     * Resolved entries only, newest first; {@code size} is clamped to the configured bounds.
     */
    @GetMapping("/wallet/history")
    public List<LedgerEntry> getHistory(@PathVariable String guildId, @PathVariable String userId,
                                        @RequestParam(required = false) Integer size) {
        return walletService.getBalanceHistory(userId, guildId, size);
    }

    @GetMapping("/wallet/transactions")
    public List<LedgerEntry> getTransactions(@PathVariable String guildId, @PathVariable String userId,
                                             @RequestParam(defaultValue = "20") int limit) {
        return walletService.getRecentTransactions(userId, guildId, limit);
    }

    @PostMapping("/wallet/adjustments")
    public ResponseEntity<Account> adjust(@PathVariable String guildId, @PathVariable String userId,
                                          @Valid @RequestBody AdjustBalanceRequest request) {
        if (request.getAmount() == 0) {
            throw new IllegalArgumentException("Adjustment amount must not be zero");
        }
        walletService.adjustBalance(userId, guildId, request.getAmount(), GameSource.ADMIN,
                UpdateKind.ADMIN_ADJUSTMENT, Map.of("reason", request.getReason()));
        log.info("Admin adjustment applied: guildId={}, userId={}, amount={}",
                guildId, userId, request.getAmount());
        return ResponseEntity.status(HttpStatus.CREATED).body(walletService.getAccount(userId, guildId));
    }

    @PostMapping("/beg")
    public BegResult beg(@PathVariable String guildId, @PathVariable String userId) {
        return begService.beg(userId, guildId);
    }

    @PostMapping("/loans")
    public ResponseEntity<LoanResult> loan(@PathVariable String guildId, @PathVariable String userId,
                                           @Valid @RequestBody LoanRequest request) {
        LoanResult result = loanService.loan(userId, request.getReceiverId(), guildId, request.getAmount());
        return ResponseEntity.status(HttpStatus.CREATED).body(result);
    }

    @GetMapping("/crashes")
    public List<CrashRecord> getCrashHistory(@PathVariable String guildId, @PathVariable String userId,
                                             @RequestParam(defaultValue = "10") int limit) {
        return sessions.getCrashHistory(userId, guildId, limit);
    }
}
