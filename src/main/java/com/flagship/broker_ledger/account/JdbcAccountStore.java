package com.flagship.broker_ledger.account;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC access to client_exchange_accounts.
 *
 * The row lock taken by {@link #lockForUpdate(UUID)} serializes every
 * mutation of one account. lock_timeout is set per transaction so a stuck
 * holder turns into a retryable failure instead of an unbounded wait.
 */
@Repository
public class JdbcAccountStore implements AccountStore {

    private static final String COLUMNS =
        "id, client_name, exchange_name, client_type, my_share_pct, company_share_pct, " +
        "cached_capital, cached_balance, cache_refreshed_at, created_at";

    private final JdbcTemplate jdbcTemplate;
    private final long lockTimeoutMs;

    public JdbcAccountStore(JdbcTemplate jdbcTemplate,
                            @Value("${ledger.lock.timeout-ms:5000}") long lockTimeoutMs) {
        this.jdbcTemplate = jdbcTemplate;
        this.lockTimeoutMs = lockTimeoutMs;
    }

    @Override
    public void insert(ClientExchangeAccount account) {
        jdbcTemplate.update(
            "INSERT INTO client_exchange_accounts (" + COLUMNS + ") " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
            account.getId(),
            account.getClientName(),
            account.getExchangeName(),
            account.getClientType().name(),
            account.getMySharePct(),
            account.getCompanySharePct(),
            account.getCachedCapital(),
            account.getCachedBalance(),
            toTimestamp(account.getCacheRefreshedAt()),
            toTimestamp(account.getCreatedAt())
        );
    }

    @Override
    public Optional<ClientExchangeAccount> findById(UUID accountId) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM client_exchange_accounts WHERE id = ?",
            accountRowMapper(),
            accountId
        ).stream().findFirst();
    }

    @Override
    public List<ClientExchangeAccount> findAll() {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM client_exchange_accounts ORDER BY client_name, exchange_name",
            accountRowMapper()
        );
    }

    @Override
    public Optional<ClientExchangeAccount> lockForUpdate(UUID accountId) {
        // set_config(..., true) is the parameterized form of SET LOCAL
        jdbcTemplate.queryForObject(
            "SELECT set_config('lock_timeout', ?, true)",
            String.class,
            lockTimeoutMs + "ms"
        );
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM client_exchange_accounts WHERE id = ? FOR UPDATE",
            accountRowMapper(),
            accountId
        ).stream().findFirst();
    }

    @Override
    public void updateDefaultShares(UUID accountId, BigDecimal mySharePct, BigDecimal companySharePct) {
        int updated = jdbcTemplate.update(
            "UPDATE client_exchange_accounts SET my_share_pct = ?, company_share_pct = ? WHERE id = ?",
            mySharePct,
            companySharePct,
            accountId
        );
        if (updated == 0) {
            throw new AccountNotFoundException(accountId);
        }
    }

    @Override
    public void refreshCaches(UUID accountId, BigDecimal capital, BigDecimal balance) {
        jdbcTemplate.update(
            "UPDATE client_exchange_accounts " +
            "SET cached_capital = ?, cached_balance = ?, cache_refreshed_at = CURRENT_TIMESTAMP " +
            "WHERE id = ?",
            capital,
            balance,
            accountId
        );
    }

    private RowMapper<ClientExchangeAccount> accountRowMapper() {
        return (rs, rowNum) -> {
            Timestamp refreshedAt = rs.getTimestamp("cache_refreshed_at");
            return new ClientExchangeAccount(
                rs.getObject("id", UUID.class),
                rs.getString("client_name"),
                rs.getString("exchange_name"),
                ClientType.valueOf(rs.getString("client_type")),
                rs.getBigDecimal("my_share_pct"),
                rs.getBigDecimal("company_share_pct"),
                rs.getBigDecimal("cached_capital"),
                rs.getBigDecimal("cached_balance"),
                refreshedAt != null ? refreshedAt.toInstant() : null,
                rs.getTimestamp("created_at").toInstant()
            );
        };
    }

    private static Timestamp toTimestamp(java.time.Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }
}
