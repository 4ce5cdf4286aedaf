package com.flagship.lending_ledger.account;

import com.flagship.lending_ledger.loan.exception.LendingErrorCode;
import com.flagship.lending_ledger.loan.exception.LendingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.util.UUID;

/**
 * Balance buckets per account, on plain JDBC.
 *
 * Invariants:
 * 1. No bucket ever goes negative (guarded UPDATEs here, CHECK constraints in the schema)
 * 2. Lending mutations run inside the caller's transaction, after {@link #lockBalances(UUID)}
 * 3. Moves between buckets of the same asset are a single UPDATE, so they are atomic
 *
 * Lock order for every lending operation is: account balance row, then loan row.
 */
@Service
@Slf4j
public class AccountLedgerService {

    private static final String SELECT_BALANCES =
        "SELECT account_id, available_crypto, collateral_crypto, available_base, borrowed_base, " +
        "interest_accrued_base, updated_at FROM account_balances WHERE account_id = ?";

    private final JdbcTemplate jdbcTemplate;

    public AccountLedgerService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Transactional
    public UUID createAccount() {
        UUID accountId = UUID.randomUUID();
        jdbcTemplate.update("INSERT INTO account_balances (account_id) VALUES (?)", accountId);
        log.info("Created account balances: accountId={}", accountId);
        return accountId;
    }

    /**
     * Credits an available bucket from outside the lending system (funding, trade settlement).
     */
    @Transactional
    public AccountBalances deposit(UUID accountId, AssetType asset, long amount) {
        requirePositive(amount);
        String column = asset == AssetType.CRYPTO ? "available_crypto" : "available_base";
        int updated = jdbcTemplate.update(
            "UPDATE account_balances SET " + column + " = " + column + " + ?, updated_at = CURRENT_TIMESTAMP " +
            "WHERE account_id = ?",
            amount, accountId);
        if (updated == 0) {
            throw accountNotFound(accountId);
        }
        log.info("Deposited to account: accountId={}, asset={}, amount={}", accountId, asset, amount);
        return getBalances(accountId);
    }

    @Transactional(readOnly = true)
    public AccountBalances getBalances(UUID accountId) {
        try {
            return jdbcTemplate.queryForObject(SELECT_BALANCES, balancesRowMapper(), accountId);
        } catch (EmptyResultDataAccessException e) {
            throw accountNotFound(accountId);
        }
    }

    /**
     * Locks the account's balance row (SELECT ... FOR UPDATE) for the rest of the transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public AccountBalances lockBalances(UUID accountId) {
        try {
            return jdbcTemplate.queryForObject(SELECT_BALANCES + " FOR UPDATE", balancesRowMapper(), accountId);
        } catch (EmptyResultDataAccessException e) {
            throw accountNotFound(accountId);
        }
    }

    /**
     * available_crypto -> collateral_crypto
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void pledgeCollateral(UUID accountId, long amount) {
        requirePositive(amount);
        int updated = jdbcTemplate.update(
            "UPDATE account_balances SET available_crypto = available_crypto - ?, " +
            "collateral_crypto = collateral_crypto + ?, updated_at = CURRENT_TIMESTAMP " +
            "WHERE account_id = ? AND available_crypto >= ?",
            amount, amount, accountId, amount);
        if (updated == 0) {
            throw LendingException.of(LendingErrorCode.INSUFFICIENT_FUNDS,
                "Account %s has less than %d crypto units available to pledge", accountId, amount);
        }
    }

    /**
     * collateral_crypto -> available_crypto
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void releaseCollateral(UUID accountId, long amount) {
        if (amount == 0) {
            return;
        }
        requirePositive(amount);
        int updated = jdbcTemplate.update(
            "UPDATE account_balances SET collateral_crypto = collateral_crypto - ?, " +
            "available_crypto = available_crypto + ?, updated_at = CURRENT_TIMESTAMP " +
            "WHERE account_id = ? AND collateral_crypto >= ?",
            amount, amount, accountId, amount);
        if (updated == 0) {
            throw new IllegalStateException(
                String.format("Account %s holds less than %d crypto units as collateral", accountId, amount));
        }
    }

    /**
     * Pays out borrowed funds: available_base and borrowed_base both rise by the amount.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void disburseLoan(UUID accountId, long amount) {
        requirePositive(amount);
        jdbcTemplate.update(
            "UPDATE account_balances SET available_base = available_base + ?, " +
            "borrowed_base = borrowed_base + ?, updated_at = CURRENT_TIMESTAMP WHERE account_id = ?",
            amount, amount, accountId);
    }

    /**
     * Interest raises the debt mirror and the interest mirror; no cash moves.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void chargeInterest(UUID accountId, long amount) {
        if (amount == 0) {
            return;
        }
        requirePositive(amount);
        jdbcTemplate.update(
            "UPDATE account_balances SET borrowed_base = borrowed_base + ?, " +
            "interest_accrued_base = interest_accrued_base + ?, updated_at = CURRENT_TIMESTAMP " +
            "WHERE account_id = ?",
            amount, amount, accountId);
    }

    /**
     * available_base and borrowed_base both fall by the repayment.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void applyRepayment(UUID accountId, long amount) {
        requirePositive(amount);
        int updated = jdbcTemplate.update(
            "UPDATE account_balances SET available_base = available_base - ?, " +
            "borrowed_base = borrowed_base - ?, updated_at = CURRENT_TIMESTAMP " +
            "WHERE account_id = ? AND available_base >= ? AND borrowed_base >= ?",
            amount, amount, accountId, amount, amount);
        if (updated == 0) {
            throw LendingException.of(LendingErrorCode.INSUFFICIENT_FUNDS,
                "Account %s has less than %d base units available to repay", accountId, amount);
        }
    }

    /**
     * Settles a sale of pledged collateral: the sold crypto leaves collateral, the cleared debt
     * leaves borrowed_base, and proceeds beyond the debt are credited to available_base.
     * The interest mirror is reset; interest charged so far is part of the debt just reduced.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void settleCollateralSale(UUID accountId, long collateralSold, long debtCleared, long excessProceeds) {
        int updated = jdbcTemplate.update(
            "UPDATE account_balances SET collateral_crypto = collateral_crypto - ?, " +
            "borrowed_base = GREATEST(0, borrowed_base - ?), interest_accrued_base = 0, " +
            "available_base = available_base + ?, updated_at = CURRENT_TIMESTAMP " +
            "WHERE account_id = ? AND collateral_crypto >= ?",
            collateralSold, debtCleared, excessProceeds, accountId, collateralSold);
        if (updated == 0) {
            throw new IllegalStateException(
                String.format("Account %s holds less than %d crypto units as collateral", accountId, collateralSold));
        }
    }

    /**
     * Clears the loan mirrors once the account's loan has closed.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void clearLoanPosition(UUID accountId) {
        jdbcTemplate.update(
            "UPDATE account_balances SET borrowed_base = 0, interest_accrued_base = 0, " +
            "updated_at = CURRENT_TIMESTAMP WHERE account_id = ?",
            accountId);
    }

    private RowMapper<AccountBalances> balancesRowMapper() {
        return (rs, rowNum) -> {
            Timestamp updatedAt = rs.getTimestamp("updated_at");
            return new AccountBalances(
                UUID.fromString(rs.getString("account_id")),
                rs.getLong("available_crypto"),
                rs.getLong("collateral_crypto"),
                rs.getLong("available_base"),
                rs.getLong("borrowed_base"),
                rs.getLong("interest_accrued_base"),
                updatedAt != null ? updatedAt.toInstant() : null
            );
        };
    }

    private static void requirePositive(long amount) {
        if (amount <= 0) {
            throw new IllegalArgumentException("Amount must be positive: " + amount);
        }
    }

    private static LendingException accountNotFound(UUID accountId) {
        return new LendingException(LendingErrorCode.ACCOUNT_NOT_FOUND, "Account not found: " + accountId);
    }
}
