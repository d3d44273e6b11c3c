package com.monadarena.service;

import com.monadarena.config.ArenaProperties;
import com.monadarena.dto.LedgerRequests;
import com.monadarena.dto.LedgerResponses;
import com.monadarena.mapper.ArenaResponseMapper;
import com.monadarena.model.LedgerAccount;
import com.monadarena.model.TournamentStatus;
import com.monadarena.repository.ArenaMatchRepository;
import com.monadarena.repository.LedgerAccountRepository;
import com.monadarena.repository.TournamentRepository;
import com.monadarena.web.ArenaOperationException;
import com.monadarena.web.TransferFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Account balances backing every escrow movement.
 *
 * collect() moves funds from an account into escrow; payout() moves escrowed
 * funds to an account. Both run inside the caller's transaction, so a refused
 * payout rolls back the whole match or tournament operation.
 */
@Service
public class LedgerService {

    private static final Logger log = LoggerFactory.getLogger(LedgerService.class);
    private static final List<TournamentStatus> ESCROW_HOLDING_TOURNAMENT_STATUSES =
            List.of(TournamentStatus.REGISTRATION, TournamentStatus.ACTIVE);

    private final LedgerAccountRepository ledgerAccountRepository;
    private final ArenaMatchRepository arenaMatchRepository;
    private final TournamentRepository tournamentRepository;
    private final ArenaProperties arenaProperties;
    private final ArenaResponseMapper arenaResponseMapper;
    private final ResolverAuthorization resolverAuthorization;

    public LedgerService(
            LedgerAccountRepository ledgerAccountRepository,
            ArenaMatchRepository arenaMatchRepository,
            TournamentRepository tournamentRepository,
            ArenaProperties arenaProperties,
            ArenaResponseMapper arenaResponseMapper,
            ResolverAuthorization resolverAuthorization
    ) {
        this.ledgerAccountRepository = ledgerAccountRepository;
        this.arenaMatchRepository = arenaMatchRepository;
        this.tournamentRepository = tournamentRepository;
        this.arenaProperties = arenaProperties;
        this.arenaResponseMapper = arenaResponseMapper;
        this.resolverAuthorization = resolverAuthorization;
    }

    @Transactional
    public LedgerResponses.AccountBalance creditExternalDeposit(String wallet, LedgerRequests.DepositRequest request) {
        String walletAddress = WalletAddresses.normalize(wallet);
        long amount = request.amount();
        if (amount <= 0) {
            throw ArenaOperationException.invalidAmount("Deposit amount must be positive: " + amount);
        }

        LedgerAccount account = lockOrCreate(walletAddress);
        account.setBalance(Math.addExact(account.getBalance(), amount));
        account.setUpdatedAt(OffsetDateTime.now());
        LedgerAccount saved = ledgerAccountRepository.save(account);

        log.info("Credited deposit of {} to {}; balance now {}", amount, walletAddress, saved.getBalance());
        return arenaResponseMapper.toAccountBalanceResponse(saved);
    }

    @Transactional(readOnly = true)
    public LedgerResponses.AccountBalance getAccount(String wallet) {
        String walletAddress = WalletAddresses.normalize(wallet);
        LedgerAccount account = ledgerAccountRepository.findById(walletAddress)
                .orElseGet(() -> newAccount(walletAddress));
        return arenaResponseMapper.toAccountBalanceResponse(account);
    }

    /**
     * Operator switch that makes every payout to {@code wallet} fail. Restricted to resolvers.
     */
    @Transactional
    public LedgerResponses.AccountBalance setPayoutsBlocked(String wallet, LedgerRequests.PayoutBlockRequest request) {
        resolverAuthorization.requireResolver(request.wallet());
        String walletAddress = WalletAddresses.normalize(wallet);
        LedgerAccount account = lockOrCreate(walletAddress);
        account.setPayoutsBlocked(request.blocked());
        account.setUpdatedAt(OffsetDateTime.now());
        LedgerAccount saved = ledgerAccountRepository.save(account);

        log.info("Payouts to {} are now {}", walletAddress, request.blocked() ? "blocked" : "allowed");
        return arenaResponseMapper.toAccountBalanceResponse(saved);
    }

    @Transactional(readOnly = true)
    public LedgerResponses.EscrowSummary getEscrowSummary() {
        long matchEscrow = arenaMatchRepository.sumEscrowBalance();
        long tournamentEscrow = tournamentRepository.sumPrizePoolByStatusIn(ESCROW_HOLDING_TOURNAMENT_STATUSES);
        return new LedgerResponses.EscrowSummary(
                matchEscrow,
                tournamentEscrow,
                Math.addExact(matchEscrow, tournamentEscrow)
        );
    }

    /**
     * Debits {@code amount} from the wallet into escrow.
     *
     * @throws ArenaOperationException with code {@code insufficient_balance} when the account cannot cover it
     */
    @Transactional
    public void collect(String walletAddress, long amount, String reason) {
        if (amount <= 0) {
            throw ArenaOperationException.invalidAmount("Collected amount must be positive: " + amount);
        }

        LedgerAccount account = ledgerAccountRepository.findByWalletAddressForUpdate(walletAddress)
                .orElseThrow(() -> ArenaOperationException.insufficientBalance(walletAddress, 0L, amount));
        if (account.getBalance() < amount) {
            throw ArenaOperationException.insufficientBalance(walletAddress, account.getBalance(), amount);
        }

        account.setBalance(account.getBalance() - amount);
        account.setUpdatedAt(OffsetDateTime.now());
        ledgerAccountRepository.save(account);
        log.info("Collected {} from {} into escrow ({})", amount, walletAddress, reason);
    }

    /**
     * Credits {@code amount} out of escrow to the wallet. A zero amount is a no-op.
     *
     * @throws TransferFailureException when the receiving account refuses payouts
     */
    @Transactional
    public void payout(String walletAddress, long amount, String reason) {
        if (amount < 0) {
            throw new IllegalArgumentException("Payout amount must be non-negative: " + amount);
        }
        if (amount == 0) {
            return;
        }

        LedgerAccount account = lockOrCreate(walletAddress);
        if (Boolean.TRUE.equals(account.getPayoutsBlocked())) {
            log.warn("Refusing payout of {} to {} ({}): payouts blocked", amount, walletAddress, reason);
            throw new TransferFailureException(
                    walletAddress,
                    amount,
                    "Payout of " + amount + " to " + walletAddress + " was rejected (" + reason + ")"
            );
        }

        account.setBalance(Math.addExact(account.getBalance(), amount));
        account.setUpdatedAt(OffsetDateTime.now());
        ledgerAccountRepository.save(account);
        log.info("Paid out {} to {} ({})", amount, walletAddress, reason);
    }

    @Transactional
    public void payPlatformFee(long fee, String reason) {
        payout(treasuryWallet(), fee, "platform fee: " + reason);
    }

    public String treasuryWallet() {
        return WalletAddresses.normalize(arenaProperties.getTreasuryWallet());
    }

    private LedgerAccount lockOrCreate(String walletAddress) {
        return ledgerAccountRepository.findByWalletAddressForUpdate(walletAddress)
                .orElseGet(() -> newAccount(walletAddress));
    }

    private static LedgerAccount newAccount(String walletAddress) {
        LedgerAccount account = new LedgerAccount();
        account.setWalletAddress(walletAddress);
        return account;
    }
}
