package com.flagship.casino_ledger.economy;

import com.flagship.casino_ledger.common.UnitOfWork;
import com.flagship.casino_ledger.config.CasinoProperties;
import com.flagship.casino_ledger.ledger.TransferResult;
import com.flagship.casino_ledger.ledger.WalletService;
import com.flagship.casino_ledger.observability.CasinoMetrics;
import com.flagship.casino_ledger.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;

/**
 * Player-to-player loans, rate limited per sender over a sliding window.
 *
 * Both account rows are locked in id order before counting, so concurrent
 * loans from the same sender are counted one after the other and opposite
 * loans between two players cannot deadlock.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LoanService {

    private final WalletService walletService;
    private final JdbcTemplate jdbcTemplate;
    private final CasinoProperties properties;
    private final UnitOfWork unitOfWork;
    private final Clock clock;
    private final CasinoMetrics metrics;

    public LoanResult loan(String senderId, String receiverId, String guildId, long amount) {
        return CorrelationContext.withPlayer(senderId, guildId, () -> unitOfWork.execute("economy.loan", () -> {
            CasinoProperties.Loan limits = properties.getLoan();
            walletService.lockAccounts(guildId, senderId, receiverId);

            Instant now = clock.instant();
            int recent = countLoansSince(senderId, guildId, now.minus(limits.getWindow()));
            if (recent >= limits.getMaxPerWindow()) {
                metrics.recordRejected("economy.loan", "rate_limited");
                throw new LoanRateLimitedException(senderId, limits.getMaxPerWindow(), limits.getWindow());
            }

            TransferResult transfer = walletService.transfer(senderId, receiverId, guildId, amount);
            jdbcTemplate.update(
                "INSERT INTO loan_rate_limits (user_id, guild_id, loan_time) VALUES (?, ?, ?)",
                senderId, guildId, Timestamp.from(now)
            );

            int remaining = limits.getMaxPerWindow() - recent - 1;
            log.info("Loan sent: receiver={}, amount={}, loansRemaining={}", receiverId, amount, remaining);
            return new LoanResult(amount, transfer.getFromBalance(), transfer.getToBalance(), remaining);
        }));
    }

    public int loansRemaining(String senderId, String guildId) {
        CasinoProperties.Loan limits = properties.getLoan();
        int recent = countLoansSince(senderId, guildId, clock.instant().minus(limits.getWindow()));
        return Math.max(0, limits.getMaxPerWindow() - recent);
    }

    private int countLoansSince(String senderId, String guildId, Instant since) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM loan_rate_limits WHERE user_id = ? AND guild_id = ? AND loan_time > ?",
            Integer.class,
            senderId, guildId, Timestamp.from(since)
        );
        return count != null ? count : 0;
    }
}
