package com.flagship.casino_ledger.economy;

import com.flagship.casino_ledger.common.InvalidWagerException;
import com.flagship.casino_ledger.common.UnitOfWork;
import com.flagship.casino_ledger.config.CasinoProperties;
import com.flagship.casino_ledger.ledger.Account;
import com.flagship.casino_ledger.ledger.GameSource;
import com.flagship.casino_ledger.ledger.UpdateKind;
import com.flagship.casino_ledger.ledger.WalletService;
import com.flagship.casino_ledger.observability.CasinoMetrics;
import com.flagship.casino_ledger.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.random.RandomGenerator;

/**
 * Hand-outs for players who can no longer afford the minimum bet.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BegService {

    private final WalletService walletService;
    private final CasinoProperties properties;
    private final UnitOfWork unitOfWork;
    private final RandomGenerator random;
    private final CasinoMetrics metrics;

    public BegResult beg(String userId, String guildId) {
        return CorrelationContext.withPlayer(userId, guildId, () -> unitOfWork.execute("economy.beg", () -> {
            Account account = walletService.lockAccount(userId, guildId);
            if (account.getBalance() >= properties.getMinBet()) {
                metrics.recordRejected("economy.beg", "balance_too_high");
                throw new InvalidWagerException(String.format(
                        "Begging is only allowed below %d coins, balance is %d",
                        properties.getMinBet(), account.getBalance()));
            }

            CasinoProperties.Beg beg = properties.getBeg();
            long amount = random.nextLong(beg.getMinAmount(), beg.getMaxAmount() + 1);
            long balance = walletService.adjustBalance(userId, guildId, amount, GameSource.BEG,
                    UpdateKind.BEG_RECEIVED, Map.of("amount", amount));
            walletService.incrementBegCount(userId, guildId);

            log.info("Beg granted: amount={}, balance={}", amount, balance);
            return new BegResult(amount, balance, account.getBegCount() + 1);
        }));
    }
}
