package com.flagship.broker_ledger.snapshot;

import com.flagship.broker_ledger.ledger.BalanceReference;
import com.flagship.broker_ledger.money.BeneficiarySplit;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC access to loss_snapshots. Both directions share the table; the
 * partial unique index on (account_id) WHERE is_settled = false covers them
 * together.
 */
@Repository
public class JdbcSnapshotStore implements SnapshotStore {

    private static final String COLUMNS =
        "id, account_id, direction, original_amount, reference_date, reference_balance, " +
        "reference_sequence, split_type, my_share_pct, counterparty_share_pct, is_settled, " +
        "created_at, settled_at";

    private final JdbcTemplate jdbcTemplate;

    public JdbcSnapshotStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void insert(EpisodeSnapshot snapshot) {
        BalanceReference reference = snapshot.getBalanceReference();
        BeneficiarySplit split = snapshot.getSplit();
        jdbcTemplate.update(
            "INSERT INTO loss_snapshots (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
            snapshot.getId(),
            snapshot.getAccountId(),
            snapshot.getDirection().name(),
            snapshot.getOriginalAmount(),
            reference.getDate(),
            reference.getBalance(),
            reference.getSequenceNumber(),
            split.getType().name(),
            split.getMySharePct(),
            split.getCounterpartySharePct(),
            snapshot.isSettled(),
            Timestamp.from(snapshot.getCreatedAt()),
            snapshot.getSettledAt() != null ? Timestamp.from(snapshot.getSettledAt()) : null
        );
    }

    @Override
    public List<EpisodeSnapshot> findActive(UUID accountId) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM loss_snapshots WHERE account_id = ? AND is_settled = false " +
            "ORDER BY created_at",
            snapshotRowMapper(),
            accountId
        );
    }

    @Override
    public Optional<EpisodeSnapshot> findLatestSettled(UUID accountId, EpisodeDirection direction) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM loss_snapshots " +
            "WHERE account_id = ? AND direction = ? AND is_settled = true " +
            "ORDER BY settled_at DESC, created_at DESC LIMIT 1",
            snapshotRowMapper(),
            accountId,
            direction.name()
        ).stream().findFirst();
    }

    @Override
    public List<EpisodeSnapshot> findByAccount(UUID accountId) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM loss_snapshots WHERE account_id = ? ORDER BY created_at DESC",
            snapshotRowMapper(),
            accountId
        );
    }

    @Override
    public List<EpisodeSnapshot> findAllActive() {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM loss_snapshots WHERE is_settled = false ORDER BY created_at",
            snapshotRowMapper()
        );
    }

    @Override
    public void markSettled(UUID snapshotId) {
        int updated = jdbcTemplate.update(
            "UPDATE loss_snapshots SET is_settled = true, settled_at = CURRENT_TIMESTAMP " +
            "WHERE id = ? AND is_settled = false",
            snapshotId
        );
        if (updated == 0) {
            throw new IllegalStateException("Snapshot is not active: " + snapshotId);
        }
    }

    private RowMapper<EpisodeSnapshot> snapshotRowMapper() {
        return (rs, rowNum) -> {
            UUID id = rs.getObject("id", UUID.class);
            UUID accountId = rs.getObject("account_id", UUID.class);
            BalanceReference reference = new BalanceReference(
                rs.getObject("reference_date", LocalDate.class),
                rs.getBigDecimal("reference_balance"),
                rs.getLong("reference_sequence"));
            BeneficiarySplit split = BeneficiarySplit.of(
                BeneficiarySplit.SplitType.valueOf(rs.getString("split_type")),
                rs.getBigDecimal("my_share_pct"),
                rs.getBigDecimal("counterparty_share_pct"));
            BigDecimal amount = rs.getBigDecimal("original_amount");
            boolean settled = rs.getBoolean("is_settled");
            Instant createdAt = rs.getTimestamp("created_at").toInstant();
            Timestamp settledAtTs = rs.getTimestamp("settled_at");
            Instant settledAt = settledAtTs != null ? settledAtTs.toInstant() : null;

            return switch (EpisodeDirection.valueOf(rs.getString("direction"))) {
                case LOSS -> new LossSnapshot(id, accountId, reference, amount, split, settled, createdAt, settledAt);
                case PROFIT -> new WithdrawalSnapshot(id, accountId, reference, amount, split, settled,
                    createdAt, settledAt);
            };
        };
    }
}
