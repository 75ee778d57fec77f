package com.flagship.broker_ledger.ledger;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * JDBC access to ledger_transactions.
 *
 * Plain JDBC, no JPA: the ledger is append-only and storage enforces it
 * with a trigger that rejects UPDATE and DELETE, plus a unique index on
 * settlement_id.
 */
@Repository
public class JdbcLedgerStore implements LedgerStore {

    private static final String COLUMNS =
        "id, account_id, sequence_number, tx_date, kind, amount, adjustment, capital_closed, " +
        "your_share_amount, counterparty_share_amount, settlement_id, snapshot_id, note, created_at";

    private final JdbcTemplate jdbcTemplate;

    public JdbcLedgerStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Transaction append(Transaction tx) {
        return jdbcTemplate.queryForObject(
            "INSERT INTO ledger_transactions (id, account_id, tx_date, kind, amount, adjustment, " +
            "capital_closed, your_share_amount, counterparty_share_amount, settlement_id, snapshot_id, " +
            "note, created_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, CURRENT_TIMESTAMP) " +
            "RETURNING sequence_number, created_at",
            (rs, rowNum) -> tx.stored(rs.getLong("sequence_number"), rs.getTimestamp("created_at").toInstant()),
            tx.getId(),
            tx.getAccountId(),
            tx.getDate(),
            tx.getKind().name(),
            tx.getAmount(),
            tx.getAdjustment(),
            tx.getCapitalClosed(),
            tx.getYourShareAmount(),
            tx.getCounterpartyShareAmount(),
            tx.getSettlementId(),
            tx.getSnapshotId(),
            tx.getNote()
        );
    }

    @Override
    public AccountLedger loadLedger(UUID accountId) {
        List<Transaction> transactions = jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM ledger_transactions WHERE account_id = ? ORDER BY sequence_number",
            transactionRowMapper(),
            accountId
        );
        return AccountLedger.of(accountId, transactions);
    }

    private RowMapper<Transaction> transactionRowMapper() {
        return (rs, rowNum) -> new Transaction(
            rs.getObject("id", UUID.class),
            rs.getObject("account_id", UUID.class),
            rs.getLong("sequence_number"),
            rs.getObject("tx_date", LocalDate.class),
            TransactionKind.valueOf(rs.getString("kind")),
            rs.getBigDecimal("amount"),
            rs.getBigDecimal("adjustment"),
            rs.getBigDecimal("capital_closed"),
            rs.getBigDecimal("your_share_amount"),
            rs.getBigDecimal("counterparty_share_amount"),
            rs.getObject("settlement_id", UUID.class),
            rs.getObject("snapshot_id", UUID.class),
            rs.getString("note"),
            rs.getTimestamp("created_at").toInstant()
        );
    }
}
