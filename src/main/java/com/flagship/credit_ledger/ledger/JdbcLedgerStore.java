package com.flagship.credit_ledger.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.credit_ledger.config.CreditLedgerProperties;
import com.flagship.credit_ledger.credit.Credit;
import com.flagship.credit_ledger.credit.CreditPosting;
import com.flagship.credit_ledger.credit.CreditStatus;
import com.flagship.credit_ledger.credit.CreditTransaction;
import com.flagship.credit_ledger.credit.CurrencyCode;
import com.flagship.credit_ledger.credit.TransactionType;
import com.flagship.credit_ledger.credit.exception.CreditConcurrentModificationException;
import com.flagship.credit_ledger.credit.exception.CreditNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

/**
 * PostgreSQL ledger store built on JdbcTemplate.
 *
 * Concurrency: {@code SELECT ... FOR UPDATE} locks the credit row for the rest of the
 * surrounding transaction, so read, balance write and entry insert of one credit are
 * serialized while other credits proceed in parallel. The update is additionally
 * guarded by the version column. Waiting longer than the configured lock timeout, or a
 * version mismatch, surfaces as a retryable {@link CreditConcurrentModificationException}.
 *
 * Database-enforced correctness: CHECK constraints keep amounts sane and a trigger
 * rejects UPDATE and DELETE on credit_transactions (see V1 migration).
 */
@Repository
@Slf4j
public class JdbcLedgerStore implements LedgerStore {

    private static final String CREDIT_COLUMNS =
        "id, code, original_amount, balance, currency, status, expiration_date, customer_id, note, " +
        "version, created_at, updated_at";

    private static final String TRANSACTION_COLUMNS =
        "id, credit_id, customer_id, type, amount, balance_after, currency, staff_id, location_id, " +
        "order_id, order_number, note, metadata, created_at, sequence_number";

    private static final TypeReference<Map<String, String>> METADATA_TYPE = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final long lockTimeoutMs;

    public JdbcLedgerStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper, CreditLedgerProperties properties) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.lockTimeoutMs = properties.getStore().getLockTimeout().toMillis();
    }

    @Override
    @Transactional
    public CreditPosting withCreditLock(UUID creditId, Function<Credit, CreditPosting> mutation) {
        Credit current = lockCredit(creditId);

        CreditPosting posting = mutation.apply(current);
        PostingValidator.validate(current, posting);

        Credit updated = posting.getCredit();
        int rows = jdbcTemplate.update(
            "UPDATE credits SET balance = ?, status = ?, expiration_date = ?, version = version + 1, updated_at = ? " +
            "WHERE id = ? AND version = ?",
            updated.getBalance(),
            updated.getStatus().name(),
            toTimestamp(updated.getExpirationDate()),
            toTimestamp(updated.getUpdatedAt()),
            creditId,
            current.getVersion()
        );
        if (rows == 0) {
            throw new CreditConcurrentModificationException(String.format(
                "Credit %s changed since version %d was read", creditId, current.getVersion()));
        }

        CreditTransaction inserted = insertTransaction(posting.getTransaction());
        log.debug("Posted {} of {} to credit {}: balanceAfter={}, seq={}",
            inserted.getType(), inserted.getAmount(), creditId, inserted.getBalanceAfter(), inserted.getSequenceNumber());

        return new CreditPosting(updated.withVersion(current.getVersion() + 1), inserted);
    }

    @Override
    @Transactional
    public CreditPosting insertIssued(Credit credit, CreditTransaction issueTransaction, String idempotencyKey) {
        if (issueTransaction.getType() != TransactionType.ISSUE
            || issueTransaction.getAmount().compareTo(credit.getOriginalAmount()) != 0
            || issueTransaction.getBalanceAfter().compareTo(credit.getBalance()) != 0) {
            throw new IllegalStateException("Issue entry does not match new credit " + credit.getId());
        }

        try {
            jdbcTemplate.update(
                "INSERT INTO credits (id, code, original_amount, balance, currency, status, expiration_date, " +
                "customer_id, note, idempotency_key, version, created_at, updated_at) " +
                "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                credit.getId(),
                credit.getCode(),
                credit.getOriginalAmount(),
                credit.getBalance(),
                credit.getCurrency().name(),
                credit.getStatus().name(),
                toTimestamp(credit.getExpirationDate()),
                credit.getCustomerId(),
                credit.getNote(),
                idempotencyKey,
                credit.getVersion(),
                toTimestamp(credit.getCreatedAt()),
                toTimestamp(credit.getUpdatedAt())
            );
        } catch (DuplicateKeyException e) {
            throw new CreditConcurrentModificationException(
                "Credit code " + credit.getCode() + " or idempotency key already taken", e);
        }

        return new CreditPosting(credit, insertTransaction(issueTransaction));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Credit> findById(UUID creditId) {
        return jdbcTemplate.query(
            "SELECT " + CREDIT_COLUMNS + " FROM credits WHERE id = ?",
            creditRowMapper(),
            creditId
        ).stream().findFirst();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Credit> findByCode(String code) {
        return jdbcTemplate.query(
            "SELECT " + CREDIT_COLUMNS + " FROM credits WHERE code = ?",
            creditRowMapper(),
            code
        ).stream().findFirst();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Credit> findByIdempotencyKey(String idempotencyKey) {
        return jdbcTemplate.query(
            "SELECT " + CREDIT_COLUMNS + " FROM credits WHERE idempotency_key = ?",
            creditRowMapper(),
            idempotencyKey
        ).stream().findFirst();
    }

    @Override
    @Transactional(readOnly = true)
    public boolean codeExists(String code) {
        Boolean exists = jdbcTemplate.queryForObject(
            "SELECT EXISTS (SELECT 1 FROM credits WHERE code = ?)",
            Boolean.class,
            code
        );
        return Boolean.TRUE.equals(exists);
    }

    @Override
    @Transactional(readOnly = true)
    public List<CreditTransaction> findTransactions(UUID creditId) {
        return jdbcTemplate.query(
            "SELECT " + TRANSACTION_COLUMNS + " FROM credit_transactions WHERE credit_id = ? ORDER BY sequence_number",
            transactionRowMapper(),
            creditId
        );
    }

    @Override
    @Transactional(readOnly = true)
    public List<Credit> findByCustomer(String customerId, boolean includeTerminal) {
        String sql = "SELECT " + CREDIT_COLUMNS + " FROM credits WHERE customer_id = ?" +
            (includeTerminal ? "" : " AND status = 'ACTIVE'") +
            " ORDER BY created_at DESC";
        return jdbcTemplate.query(sql, creditRowMapper(), customerId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<UUID> findExpiredActiveIds(Instant asOf, UUID afterId, int limit) {
        if (afterId == null) {
            return jdbcTemplate.query(
                "SELECT id FROM credits WHERE status = 'ACTIVE' AND expiration_date <= ? ORDER BY id LIMIT ?",
                (rs, rowNum) -> UUID.fromString(rs.getString("id")),
                toTimestamp(asOf), limit
            );
        }
        return jdbcTemplate.query(
            "SELECT id FROM credits WHERE status = 'ACTIVE' AND expiration_date <= ? AND id > ? ORDER BY id LIMIT ?",
            (rs, rowNum) -> UUID.fromString(rs.getString("id")),
            toTimestamp(asOf), afterId, limit
        );
    }

    @Override
    @Transactional(readOnly = true)
    public List<Credit> findActiveExpiringBetween(Instant fromExclusive, Instant toInclusive) {
        return jdbcTemplate.query(
            "SELECT " + CREDIT_COLUMNS + " FROM credits " +
            "WHERE status = 'ACTIVE' AND balance > 0 AND expiration_date > ? AND expiration_date <= ? " +
            "ORDER BY expiration_date",
            creditRowMapper(),
            toTimestamp(fromExclusive), toTimestamp(toInclusive)
        );
    }

    @Override
    @Transactional(readOnly = true)
    public List<CreditTransaction> findTransactions(TransactionFilter filter, DateRange range) {
        StringBuilder sql = new StringBuilder("SELECT " + TRANSACTION_COLUMNS + " FROM credit_transactions WHERE 1 = 1");
        List<Object> args = new ArrayList<>();

        if (filter.getCustomerId() != null) {
            sql.append(" AND customer_id = ?");
            args.add(filter.getCustomerId());
        }
        if (filter.getCreditId() != null) {
            sql.append(" AND credit_id = ?");
            args.add(filter.getCreditId());
        }
        if (!filter.getTypes().isEmpty()) {
            sql.append(" AND type IN (")
                .append(String.join(", ", Collections.nCopies(filter.getTypes().size(), "?")))
                .append(")");
            filter.getTypes().forEach(type -> args.add(type.name()));
        }
        if (filter.getStaffId() != null) {
            sql.append(" AND staff_id = ?");
            args.add(filter.getStaffId());
        }
        if (filter.getLocationId() != null) {
            sql.append(" AND location_id = ?");
            args.add(filter.getLocationId());
        }
        if (filter.getCurrency() != null) {
            sql.append(" AND currency = ?");
            args.add(filter.getCurrency().name());
        }
        if (range.getFrom() != null) {
            sql.append(" AND created_at >= ?");
            args.add(toTimestamp(range.getFrom()));
        }
        if (range.getTo() != null) {
            sql.append(" AND created_at < ?");
            args.add(toTimestamp(range.getTo()));
        }
        sql.append(" ORDER BY sequence_number");

        return jdbcTemplate.query(sql.toString(), transactionRowMapper(), args.toArray());
    }

    @Override
    @Transactional(readOnly = true)
    public Map<CreditStatus, Long> countByStatus() {
        Map<CreditStatus, Long> counts = new EnumMap<>(CreditStatus.class);
        for (CreditStatus status : CreditStatus.values()) {
            counts.put(status, 0L);
        }
        jdbcTemplate.query(
            "SELECT status, COUNT(*) AS total FROM credits GROUP BY status",
            rs -> {
                counts.put(CreditStatus.valueOf(rs.getString("status")), rs.getLong("total"));
            }
        );
        return counts;
    }

    private Credit lockCredit(UUID creditId) {
        // Postgres-specific: bound the wait for the row lock to this transaction only
        jdbcTemplate.execute("SET LOCAL lock_timeout = '" + lockTimeoutMs + "ms'");
        try {
            return jdbcTemplate.query(
                "SELECT " + CREDIT_COLUMNS + " FROM credits WHERE id = ? FOR UPDATE",
                creditRowMapper(),
                creditId
            ).stream().findFirst()
                .orElseThrow(() -> new CreditNotFoundException("Credit not found: " + creditId));
        } catch (PessimisticLockingFailureException e) {
            throw new CreditConcurrentModificationException(
                "Timed out after " + lockTimeoutMs + "ms waiting for lock on credit " + creditId, e);
        }
    }

    private CreditTransaction insertTransaction(CreditTransaction tx) {
        Long sequenceNumber = jdbcTemplate.queryForObject(
            "INSERT INTO credit_transactions (id, credit_id, customer_id, type, amount, balance_after, currency, " +
            "staff_id, location_id, order_id, order_number, note, metadata, created_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, CAST(? AS jsonb), ?) RETURNING sequence_number",
            Long.class,
            tx.getId(),
            tx.getCreditId(),
            tx.getCustomerId(),
            tx.getType().name(),
            tx.getAmount(),
            tx.getBalanceAfter(),
            tx.getCurrency().name(),
            tx.getStaffId(),
            tx.getLocationId(),
            tx.getOrderId(),
            tx.getOrderNumber(),
            tx.getNote(),
            writeMetadata(tx.getMetadata()),
            toTimestamp(tx.getTimestamp())
        );
        return tx.withSequenceNumber(sequenceNumber);
    }

    private RowMapper<Credit> creditRowMapper() {
        return (rs, rowNum) -> new Credit(
            UUID.fromString(rs.getString("id")),
            rs.getString("code"),
            rs.getBigDecimal("original_amount"),
            rs.getBigDecimal("balance"),
            CurrencyCode.valueOf(rs.getString("currency")),
            CreditStatus.valueOf(rs.getString("status")),
            toInstant(rs, "expiration_date"),
            rs.getString("customer_id"),
            rs.getString("note"),
            rs.getLong("version"),
            toInstant(rs, "created_at"),
            toInstant(rs, "updated_at")
        );
    }

    private RowMapper<CreditTransaction> transactionRowMapper() {
        return (rs, rowNum) -> CreditTransaction.builder()
            .id(UUID.fromString(rs.getString("id")))
            .creditId(UUID.fromString(rs.getString("credit_id")))
            .customerId(rs.getString("customer_id"))
            .type(TransactionType.valueOf(rs.getString("type")))
            .amount(rs.getBigDecimal("amount"))
            .balanceAfter(rs.getBigDecimal("balance_after"))
            .currency(CurrencyCode.valueOf(rs.getString("currency")))
            .staffId(rs.getString("staff_id"))
            .locationId(rs.getString("location_id"))
            .orderId(rs.getString("order_id"))
            .orderNumber(rs.getString("order_number"))
            .note(rs.getString("note"))
            .metadata(readMetadata(rs.getString("metadata")))
            .timestamp(toInstant(rs, "created_at"))
            .sequenceNumber(rs.getLong("sequence_number"))
            .build();
    }

    private String writeMetadata(Map<String, String> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize transaction metadata", e);
        }
    }

    private Map<String, String> readMetadata(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, METADATA_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt transaction metadata: " + json, e);
        }
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    private static Instant toInstant(ResultSet rs, String column) throws SQLException {
        Timestamp timestamp = rs.getTimestamp(column);
        return timestamp == null ? null : timestamp.toInstant();
    }
}
