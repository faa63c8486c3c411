package com.streamanalytics.core.storage;

import com.streamanalytics.core.config.StorageConfig;
import com.streamanalytics.core.error.StorageException;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.core.BatchPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.TransactionTimedOutException;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Durable {@link MetricStore} over JDBC with one table per record kind per
 * UTC day.
 *
 * <h3>Layout</h3>
 * <p>
 * Records of kind {@code K} with a timestamp on day {@code D} live in table
 * {@code <k>_pYYYYMMDD}, created on first write with
 * {@code CREATE TABLE IF NOT EXISTS}. Range queries touch only the day tables
 * overlapping the range; {@link #deleteBefore(Instant)} drops whole tables that
 * lie entirely before the cutoff and deletes rows from the boundary day.
 * </p>
 *
 * <h3>Writes</h3>
 * <p>
 * A batch is written inside a single transaction, in JDBC batches of
 * {@code insertChunkSize} rows. Upsert is a delete of existing keys followed
 * by an insert, so the whole batch commits or rolls back together. The
 * transaction timeout bounds the write; an interrupt between chunks rolls it
 * back.
 * </p>
 *
 * <h3>Concurrency</h3>
 * <p>
 * The connection pool size is the concurrency limit. Callers beyond it wait
 * up to the pool's connection timeout.
 * </p>
 *
 * @since 1.0.0
 */
public class JdbcMetricStore implements MetricStore {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcMetricStore.class);

    private static final DateTimeFormatter DAY_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd");
    private static final Pattern PARTITION_RE =
            Pattern.compile("^(aggregate|anomaly|observation)_p(\\d{8})$");

    private static final String COLUMNS = "record_key, metric_name, tags, qualifier, record_time_ms, payload";

    private final DataSource dataSource;
    private final boolean ownsDataSource;
    private final JdbcTemplate jdbc;
    private final DataSourceTransactionManager txManager;
    private final int chunkSize;
    private final Duration defaultTimeout;
    private final RecordCodec codec = new RecordCodec();
    private final Set<String> knownPartitions = ConcurrentHashMap.newKeySet();

    /**
     * Use an externally managed data source. The caller keeps ownership;
     * {@link #close()} does not close it.
     */
    public JdbcMetricStore(DataSource dataSource, int chunkSize, Duration defaultTimeout) {
        this(dataSource, false, chunkSize, defaultTimeout);
    }

    private JdbcMetricStore(DataSource dataSource, boolean ownsDataSource, int chunkSize,
            Duration defaultTimeout) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.ownsDataSource = ownsDataSource;
        if (chunkSize < 1) {
            throw new IllegalArgumentException("chunkSize must be >= 1, got: " + chunkSize);
        }
        this.chunkSize = chunkSize;
        this.defaultTimeout = Objects.requireNonNull(defaultTimeout, "defaultTimeout must not be null");
        this.jdbc = new JdbcTemplate(dataSource);
        this.txManager = new DataSourceTransactionManager(dataSource);
        refreshPartitions();
    }

    /**
     * Build a store over a HikariCP pool sized from the configuration. The
     * store owns the pool and closes it on {@link #close()}.
     */
    public static JdbcMetricStore create(StorageConfig config) {
        HikariConfig hikari = new HikariConfig();
        hikari.setJdbcUrl(config.getJdbcUrl());
        if (config.getUsername() != null) {
            hikari.setUsername(config.getUsername());
        }
        if (config.getPassword() != null) {
            hikari.setPassword(config.getPassword());
        }
        hikari.setMaximumPoolSize(config.getMaxPoolSize());
        hikari.setConnectionTimeout(config.getConnectionTimeoutMillis());
        hikari.setPoolName("metric-store");
        try {
            HikariDataSource pool = new HikariDataSource(hikari);
            LOG.info("Opened JDBC metric store pool (max {} connection(s)) for {}",
                    config.getMaxPoolSize(), config.getJdbcUrl());
            return new JdbcMetricStore(pool, true, config.getInsertChunkSize(), config.writeTimeout());
        } catch (RuntimeException e) {
            throw new StorageException("Failed to open JDBC pool for " + config.getJdbcUrl()
                    + ": " + e.getMessage(), e, true);
        }
    }

    // ---------------------------------------------------------------
    // Writes
    // ---------------------------------------------------------------

    @Override
    public void insertBatch(List<StorageRecord> records) {
        insertBatch(records, defaultTimeout);
    }

    @Override
    public void insertBatch(List<StorageRecord> records, Duration timeout) {
        Objects.requireNonNull(records, "records must not be null");
        Objects.requireNonNull(timeout, "timeout must not be null");
        if (records.isEmpty()) {
            return;
        }

        Map<String, List<StorageRecord>> byPartition = new LinkedHashMap<>();
        for (StorageRecord record : dedupeByKey(records)) {
            byPartition.computeIfAbsent(partitionFor(record.getKind(), record.getTimestamp()),
                    p -> new ArrayList<>()).add(record);
        }

        try {
            byPartition.keySet().forEach(this::ensurePartition);

            TransactionTemplate tx = new TransactionTemplate(txManager);
            tx.setTimeout(Math.max(1, (int) Math.ceil(timeout.toMillis() / 1000.0)));
            tx.executeWithoutResult(status -> byPartition.forEach(this::writePartition));
            LOG.debug("Persisted {} record(s) across {} partition(s)", records.size(), byPartition.size());
        } catch (DataAccessException | TransactionException e) {
            throw translate("insert of " + records.size() + " record(s)", e);
        }
    }

    // ---------------------------------------------------------------
    // Reads
    // ---------------------------------------------------------------

    @Override
    public List<StorageRecord> queryRange(RecordKind kind, String metricName, Instant start, Instant end) {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(metricName, "metricName must not be null");
        List<StorageRecord> result = new ArrayList<>();
        if (end.isBefore(start)) {
            return result;
        }
        LocalDate first = dayOf(start);
        LocalDate last = dayOf(end);
        try {
            for (LocalDate day = first; !day.isAfter(last); day = day.plusDays(1)) {
                String table = partitionName(kind, day);
                if (!knownPartitions.contains(table)) {
                    continue;
                }
                result.addAll(jdbc.query(
                        "SELECT " + COLUMNS + " FROM " + table
                                + " WHERE metric_name = ? AND record_time_ms >= ? AND record_time_ms <= ?"
                                + " ORDER BY record_time_ms",
                        rowMapper(kind), metricName, start.toEpochMilli(), end.toEpochMilli()));
            }
        } catch (DataAccessException e) {
            throw translate("range query on " + metricName, e);
        }
        result.sort(Comparator.comparing(StorageRecord::getTimestamp));
        return result;
    }

    @Override
    public Optional<StorageRecord> find(RecordKey key) {
        Objects.requireNonNull(key, "key must not be null");
        String table = partitionFor(key.getKind(), key.getTimestamp());
        if (!knownPartitions.contains(table)) {
            return Optional.empty();
        }
        try {
            List<StorageRecord> rows = jdbc.query(
                    "SELECT " + COLUMNS + " FROM " + table + " WHERE record_key = ?",
                    rowMapper(key.getKind()), key.asString());
            return rows.stream().findFirst();
        } catch (DataAccessException e) {
            throw translate("lookup of " + key, e);
        }
    }

    @Override
    public boolean containsMetric(String metricName) {
        try {
            for (String table : new TreeSet<>(knownPartitions)) {
                List<Integer> hit = jdbc.queryForList(
                        "SELECT 1 FROM " + table + " WHERE metric_name = ? LIMIT 1", Integer.class, metricName);
                if (!hit.isEmpty()) {
                    return true;
                }
            }
            return false;
        } catch (DataAccessException e) {
            throw translate("metric lookup of " + metricName, e);
        }
    }

    // ---------------------------------------------------------------
    // Retention
    // ---------------------------------------------------------------

    @Override
    public long deleteBefore(Instant cutoff) {
        Objects.requireNonNull(cutoff, "cutoff must not be null");
        LocalDate cutoffDay = dayOf(cutoff);
        long removed = 0;
        try {
            refreshPartitions();
            for (String table : new TreeSet<>(knownPartitions)) {
                Matcher m = PARTITION_RE.matcher(table);
                if (!m.matches()) {
                    continue;
                }
                LocalDate day = LocalDate.parse(m.group(2), DAY_FORMAT);
                if (day.isBefore(cutoffDay)) {
                    Long rows = jdbc.queryForObject("SELECT COUNT(*) FROM " + table, Long.class);
                    jdbc.execute("DROP TABLE IF EXISTS " + table);
                    knownPartitions.remove(table);
                    removed += rows != null ? rows : 0;
                    LOG.info("Dropped expired partition {} ({} row(s))", table, rows);
                } else if (day.equals(cutoffDay)) {
                    removed += jdbc.update("DELETE FROM " + table + " WHERE record_time_ms < ?",
                            cutoff.toEpochMilli());
                }
            }
        } catch (DataAccessException e) {
            throw translate("retention sweep before " + cutoff, e);
        }
        return removed;
    }

    @Override
    public void close() {
        if (ownsDataSource && dataSource instanceof HikariDataSource pool) {
            pool.close();
            LOG.info("Closed JDBC metric store pool");
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void writePartition(String table, List<StorageRecord> records) {
        for (int from = 0; from < records.size(); from += chunkSize) {
            if (Thread.currentThread().isInterrupted()) {
                throw new StorageException("Insert into " + table + " cancelled by interrupt", false);
            }
            List<StorageRecord> chunk = records.subList(from, Math.min(from + chunkSize, records.size()));
            jdbc.batchUpdate("DELETE FROM " + table + " WHERE record_key = ?",
                    new BatchPreparedStatementSetter() {
                        @Override
                        public void setValues(PreparedStatement ps, int i) throws SQLException {
                            ps.setString(1, chunk.get(i).getKey().asString());
                        }

                        @Override
                        public int getBatchSize() {
                            return chunk.size();
                        }
                    });
            jdbc.batchUpdate("INSERT INTO " + table + " (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?)",
                    new BatchPreparedStatementSetter() {
                        @Override
                        public void setValues(PreparedStatement ps, int i) throws SQLException {
                            StorageRecord record = chunk.get(i);
                            ps.setString(1, record.getKey().asString());
                            ps.setString(2, record.getMetricName());
                            ps.setString(3, codec.encodeTags(record.getTags()));
                            ps.setString(4, record.getKey().getQualifier());
                            ps.setLong(5, record.getTimestamp().toEpochMilli());
                            ps.setString(6, codec.encodePayload(record.getPayload()));
                        }

                        @Override
                        public int getBatchSize() {
                            return chunk.size();
                        }
                    });
        }
    }

    private RowMapper<StorageRecord> rowMapper(RecordKind kind) {
        return (rs, rowNum) -> StorageRecord.of(codec.decodePayload(kind, rs.getString("payload")),
                rs.getString("qualifier"));
    }

    private void ensurePartition(String table) {
        if (knownPartitions.contains(table)) {
            return;
        }
        if (!PARTITION_RE.matcher(table).matches()) {
            throw new IllegalArgumentException("Illegal partition name: " + table);
        }
        jdbc.execute("CREATE TABLE IF NOT EXISTS " + table + " ("
                + "record_key VARCHAR(4096) PRIMARY KEY, "
                + "metric_name VARCHAR(255) NOT NULL, "
                + "tags VARCHAR(4096), "
                + "qualifier VARCHAR(1024), "
                + "record_time_ms BIGINT NOT NULL, "
                + "payload VARCHAR(65535) NOT NULL)");
        jdbc.execute("CREATE INDEX IF NOT EXISTS " + table + "_metric_time ON " + table
                + " (metric_name, record_time_ms)");
        knownPartitions.add(table);
        LOG.info("Created partition {}", table);
    }

    private void refreshPartitions() {
        List<String> tables = jdbc.queryForList(
                "SELECT table_name FROM information_schema.tables", String.class);
        for (String table : tables) {
            String normalized = table.toLowerCase(Locale.ROOT);
            if (PARTITION_RE.matcher(normalized).matches()) {
                knownPartitions.add(normalized);
            }
        }
    }

    private static List<StorageRecord> dedupeByKey(List<StorageRecord> records) {
        // Last write wins within a batch, as it would across batches.
        Map<RecordKey, StorageRecord> unique = new LinkedHashMap<>();
        for (StorageRecord record : records) {
            unique.remove(record.getKey());
            unique.put(record.getKey(), record);
        }
        return new ArrayList<>(unique.values());
    }

    static String partitionName(RecordKind kind, LocalDate day) {
        return kind.tablePrefix() + "_p" + DAY_FORMAT.format(day);
    }

    private static String partitionFor(RecordKind kind, Instant timestamp) {
        return partitionName(kind, dayOf(timestamp));
    }

    private static LocalDate dayOf(Instant instant) {
        return LocalDate.ofInstant(instant, ZoneOffset.UTC);
    }

    private static StorageException translate(String operation, RuntimeException e) {
        if (e instanceof StorageException se) {
            return se;
        }
        boolean retryable = e instanceof TransientDataAccessException
                || e instanceof RecoverableDataAccessException
                || e instanceof DataAccessResourceFailureException
                || e instanceof TransactionTimedOutException;
        LOG.warn("JDBC {} failed (retryable={}): {}", operation, retryable, e.getMessage());
        return new StorageException("JDBC " + operation + " failed: " + e.getMessage(), e, retryable);
    }
}
