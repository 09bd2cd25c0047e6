/*
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.facebook.presto.federation.datasource.jdbc;

import com.facebook.airlift.json.JsonCodec;
import com.facebook.airlift.log.Logger;
import com.facebook.presto.federation.FederationException;
import com.facebook.presto.federation.conversion.NativeKind;
import com.facebook.presto.federation.datasource.DataSource;
import com.facebook.presto.federation.datasource.SplitConsumer;
import com.facebook.presto.federation.paging.Acceptor;
import com.facebook.presto.federation.paging.DefaultRowTransformer;
import com.facebook.presto.federation.paging.Sink;
import com.facebook.presto.federation.paging.SinkFactory;
import com.facebook.presto.federation.protocol.Column;
import com.facebook.presto.federation.protocol.DataSourceInstance;
import com.facebook.presto.federation.protocol.DataSourceKind;
import com.facebook.presto.federation.protocol.DescribeTableRequest;
import com.facebook.presto.federation.protocol.Filtering;
import com.facebook.presto.federation.protocol.ListSplitsRequest;
import com.facebook.presto.federation.protocol.ReadSplitsRequest;
import com.facebook.presto.federation.protocol.Select;
import com.facebook.presto.federation.protocol.Split;
import com.facebook.presto.federation.protocol.TableSchema;
import com.facebook.presto.federation.protocol.WireType;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.facebook.airlift.json.JsonCodec.jsonCodec;
import static com.facebook.presto.federation.FederationErrorCode.BACKEND_ERROR;
import static com.facebook.presto.federation.FederationErrorCode.DATA_TYPE_NOT_SUPPORTED;
import static com.facebook.presto.federation.FederationErrorCode.INVALID_REQUEST;
import static com.facebook.presto.federation.FederationErrorCode.TABLE_DOES_NOT_EXIST;
import static com.facebook.presto.federation.FederationErrorCode.UNSUPPORTED_PREDICATE;
import static com.facebook.presto.federation.datasource.RequestValidator.getDataSourceInstance;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.joining;

/**
 * Data source of the relational family. Everything backend specific is delegated to the {@link SqlDialect}.
 */
public class JdbcDataSource
        implements DataSource
{
    private static final Logger log = Logger.get(JdbcDataSource.class);
    private static final JsonCodec<JdbcSplitDescription> SPLIT_DESCRIPTION_CODEC = jsonCodec(JdbcSplitDescription.class);

    /**
     * Instance option naming the schema tables are resolved in. It is not passed on to the driver.
     */
    public static final String SCHEMA_OPTION = "schema";

    private static final String TABLE_NOT_FOUND_STATE_POSTGRESQL = "42P01";
    private static final String TABLE_NOT_FOUND_STATE = "42S02";

    private final DataSourceKind kind;
    private final SqlDialect dialect;
    private final ConnectionFactory connectionFactory;
    private final JdbcTypeMapper typeMapper;
    private final boolean pushdownEnabled;
    private final boolean splittingEnabled;
    private final Optional<Long> rowsPerSplit;

    public JdbcDataSource(DataSourceKind kind, SqlDialect dialect, ConnectionFactory connectionFactory, JdbcDataSourceConfig config)
    {
        this.kind = requireNonNull(kind, "kind is null");
        this.dialect = requireNonNull(dialect, "dialect is null");
        this.connectionFactory = requireNonNull(connectionFactory, "connectionFactory is null");
        this.typeMapper = new JdbcTypeMapper(dialect);
        requireNonNull(config, "config is null");
        this.pushdownEnabled = config.getPushdownEnabledKinds().contains(kind);
        this.splittingEnabled = config.getSplittingEnabledKinds().contains(kind);
        this.rowsPerSplit = config.getRowsPerSplit();
    }

    @Override
    public TableSchema describeTable(DescribeTableRequest request)
    {
        DataSourceInstance instance = request.getDataSourceInstance();
        String table = request.getTable();
        ImmutableList.Builder<Column> columns = ImmutableList.builder();
        try (Connection connection = connectionFactory.openConnection(dialect, instance)) {
            DatabaseMetaData metadata = connection.getMetaData();
            String escape = metadata.getSearchStringEscape();
            try (ResultSet resultSet = metadata.getColumns(
                    null,
                    instance.getOption(SCHEMA_OPTION).map(schema -> escapeNamePattern(schema, escape)).orElse(null),
                    escapeNamePattern(table, escape),
                    null)) {
                while (resultSet.next()) {
                    String name = resultSet.getString("COLUMN_NAME");
                    int jdbcType = resultSet.getInt("DATA_TYPE");
                    String typeName = resultSet.getString("TYPE_NAME");
                    WireType type = typeMapper.toWireType(
                            jdbcType,
                            typeName,
                            resultSet.getInt("COLUMN_SIZE"),
                            resultSet.getInt("DECIMAL_DIGITS"),
                            request.getTypeMappingSettings().getDateTimeFormat())
                            .orElseThrow(() -> new FederationException(DATA_TYPE_NOT_SUPPORTED, format("Unsupported type %s of column %s", typeName, name)));
                    columns.add(new Column(name, type));
                }
            }
        }
        catch (SQLException e) {
            throw translate(e, table);
        }

        List<Column> result = columns.build();
        if (result.isEmpty()) {
            throw new FederationException(TABLE_DOES_NOT_EXIST, "Table not found: " + table);
        }
        return new TableSchema(result);
    }

    @Override
    public void listSplits(ListSplitsRequest request, Select select, SplitConsumer consumer)
    {
        boolean sharding = splittingEnabled && request.getMaxSplitCount() > 1;
        if (!sharding && !rowsPerSplit.isPresent()) {
            consumer.accept(select, SPLIT_DESCRIPTION_CODEC.toJsonBytes(JdbcSplitDescription.wholeTable()));
            return;
        }

        List<JdbcSplitDescription> descriptions;
        try (Connection connection = connectionFactory.openConnection(dialect, select.getDataSourceInstance())) {
            Optional<String> keyColumn = getIntegerPrimaryKey(connection, select.getDataSourceInstance(), select.getFrom());
            if (!keyColumn.isPresent()) {
                log.debug("Table %s has no single integer primary key, listing it as one split", select.getFrom());
                descriptions = ImmutableList.of(JdbcSplitDescription.wholeTable());
            }
            else if (sharding) {
                descriptions = shards(keyColumn.get(), request.getMaxSplitCount());
            }
            else {
                descriptions = ranges(connection, select, keyColumn.get(), rowsPerSplit.get());
            }
        }
        catch (SQLException e) {
            throw translate(e, select.getFrom());
        }

        for (JdbcSplitDescription description : descriptions) {
            consumer.accept(select, SPLIT_DESCRIPTION_CODEC.toJsonBytes(description));
        }
    }

    @Override
    public void readSplit(String queryId, ReadSplitsRequest request, Split split, SinkFactory sinkFactory)
    {
        Select select = split.getSelect();
        DataSourceInstance instance = getDataSourceInstance(request, split);
        JdbcSplitDescription description = decodeDescription(split.getDescription());

        List<String> conditions = new ArrayList<>();
        List<Object> arguments = new ArrayList<>();
        renderPushdown(queryId, select, request.getFiltering()).ifPresent(predicate -> {
            conditions.add(predicate.getClause().get());
            arguments.addAll(predicate.getArguments());
        });
        if (description.getKeyColumn().isPresent()) {
            String key = dialect.quoteIdentifier(description.getKeyColumn().get());
            if (description.getShardCount().isPresent()) {
                conditions.add(dialect.renderShardCondition(key, description.getShardCount().get(), description.getShardIndex().orElse(0L)));
            }
            description.getLowerBound().ifPresent(bound -> {
                conditions.add(key + " >= ?");
                arguments.add(bound);
            });
            description.getUpperBound().ifPresent(bound -> {
                conditions.add(key + " < ?");
                arguments.add(bound);
            });
        }

        List<Column> what = select.getWhat();
        StringBuilder sql = new StringBuilder("SELECT ");
        if (what.isEmpty()) {
            sql.append("0");
        }
        else {
            sql.append(what.stream().map(column -> dialect.quoteIdentifier(column.getName())).collect(joining(", ")));
        }
        sql.append(" FROM ").append(qualifiedTableName(instance, select.getFrom()));
        if (!conditions.isEmpty()) {
            sql.append(" WHERE ").append(Joiner.on(" AND ").join(conditions));
        }
        log.debug("Query %s: %s", queryId, sql);

        try (Connection connection = connectionFactory.openConnection(dialect, instance);
                PreparedStatement statement = connection.prepareStatement(sql.toString())) {
            dialect.configureForStreaming(connection, statement);
            for (int i = 0; i < arguments.size(); i++) {
                statement.setObject(i + 1, arguments.get(i));
            }
            try (ResultSet resultSet = statement.executeQuery()) {
                List<Acceptor> acceptors = what.isEmpty() ? ImmutableList.of() : createAcceptors(resultSet.getMetaData());
                DefaultRowTransformer transformer = DefaultRowTransformer.create(acceptors, what, Optional.empty());
                Sink sink = sinkFactory.makeSink();
                while (resultSet.next()) {
                    for (int i = 0; i < acceptors.size(); i++) {
                        JdbcColumnReader.read(resultSet, i + 1, acceptors.get(i));
                    }
                    sink.addRow(transformer);
                }
            }
        }
        catch (SQLException e) {
            throw translate(e, select.getFrom());
        }
    }

    @Override
    public boolean supportsSplitCount()
    {
        return splittingEnabled;
    }

    /**
     * @return the rendered WHERE clause, or empty when nothing is pushed down
     */
    private Optional<RenderedPredicate> renderPushdown(String queryId, Select select, Filtering filtering)
    {
        if (!select.getWhere().isPresent()) {
            return Optional.empty();
        }
        RenderedPredicate predicate;
        if (pushdownEnabled) {
            predicate = PredicateRenderer.render(dialect, select.getWhere().get());
        }
        else {
            predicate = new RenderedPredicate(Optional.empty(), ImmutableList.of(), ImmutableList.of("pushdown is disabled for " + kind));
        }

        if (!predicate.getErrors().isEmpty()) {
            if (filtering == Filtering.MANDATORY) {
                throw new FederationException(UNSUPPORTED_PREDICATE, "Cannot push down predicate: " + Joiner.on("; ").join(predicate.getErrors()));
            }
            for (String error : predicate.getErrors()) {
                log.warn("Query %s: dropping predicate on %s: %s", queryId, select.getFrom(), error);
            }
        }
        return predicate.getClause().isPresent() ? Optional.of(predicate) : Optional.empty();
    }

    private List<Acceptor> createAcceptors(ResultSetMetaData metadata)
            throws SQLException
    {
        ImmutableList.Builder<Acceptor> acceptors = ImmutableList.builder();
        for (int i = 1; i <= metadata.getColumnCount(); i++) {
            int jdbcType = metadata.getColumnType(i);
            String typeName = metadata.getColumnTypeName(i);
            String name = metadata.getColumnName(i);
            NativeKind nativeKind = typeMapper.toNativeKind(jdbcType, typeName)
                    .orElseThrow(() -> new FederationException(DATA_TYPE_NOT_SUPPORTED, format("Unsupported type %s of column %s", typeName, name)));
            acceptors.add(new Acceptor(nativeKind));
        }
        return acceptors.build();
    }

    private Optional<String> getIntegerPrimaryKey(Connection connection, DataSourceInstance instance, String table)
            throws SQLException
    {
        DatabaseMetaData metadata = connection.getMetaData();
        String schema = instance.getOption(SCHEMA_OPTION).orElse(null);
        List<String> keyColumns = new ArrayList<>();
        try (ResultSet resultSet = metadata.getPrimaryKeys(null, schema, table)) {
            while (resultSet.next()) {
                keyColumns.add(resultSet.getString("COLUMN_NAME"));
            }
        }
        if (keyColumns.size() != 1) {
            return Optional.empty();
        }

        String escape = metadata.getSearchStringEscape();
        try (ResultSet resultSet = metadata.getColumns(
                null,
                schema == null ? null : escapeNamePattern(schema, escape),
                escapeNamePattern(table, escape),
                escapeNamePattern(keyColumns.get(0), escape))) {
            if (resultSet.next() && isInteger(resultSet.getInt("DATA_TYPE"))) {
                return Optional.of(keyColumns.get(0));
            }
        }
        return Optional.empty();
    }

    private static List<JdbcSplitDescription> shards(String keyColumn, long shardCount)
    {
        ImmutableList.Builder<JdbcSplitDescription> shards = ImmutableList.builder();
        for (long shard = 0; shard < shardCount; shard++) {
            shards.add(JdbcSplitDescription.shard(keyColumn, shardCount, shard));
        }
        return shards.build();
    }

    /**
     * Cuts the key space into ranges of {@code rowsPerSplit} key values. The outer ranges are open ended
     * so rows inserted after listing are still read.
     */
    private List<JdbcSplitDescription> ranges(Connection connection, Select select, String keyColumn, long rowsPerSplit)
            throws SQLException
    {
        String key = dialect.quoteIdentifier(keyColumn);
        String sql = format("SELECT MIN(%s), MAX(%s) FROM %s", key, key, qualifiedTableName(select.getDataSourceInstance(), select.getFrom()));
        long min;
        long max;
        try (PreparedStatement statement = connection.prepareStatement(sql);
                ResultSet resultSet = statement.executeQuery()) {
            resultSet.next();
            min = resultSet.getLong(1);
            if (resultSet.wasNull()) {
                return ImmutableList.of(JdbcSplitDescription.wholeTable());
            }
            max = resultSet.getLong(2);
        }

        long splitCount;
        try {
            splitCount = Math.subtractExact(max, min) / rowsPerSplit + 1;
        }
        catch (ArithmeticException e) {
            log.debug("Key range of %s overflows, listing it as one split", select.getFrom());
            return ImmutableList.of(JdbcSplitDescription.wholeTable());
        }
        if (splitCount == 1) {
            return ImmutableList.of(JdbcSplitDescription.wholeTable());
        }

        ImmutableList.Builder<JdbcSplitDescription> ranges = ImmutableList.builder();
        for (long i = 0; i < splitCount; i++) {
            Optional<Long> lower = i == 0 ? Optional.empty() : Optional.of(min + i * rowsPerSplit);
            Optional<Long> upper = i == splitCount - 1 ? Optional.empty() : Optional.of(min + (i + 1) * rowsPerSplit);
            ranges.add(JdbcSplitDescription.range(keyColumn, lower, upper));
        }
        return ranges.build();
    }

    private String qualifiedTableName(DataSourceInstance instance, String table)
    {
        return instance.getOption(SCHEMA_OPTION)
                .map(schema -> dialect.quoteIdentifier(schema) + "." + dialect.quoteIdentifier(table))
                .orElseGet(() -> dialect.quoteIdentifier(table));
    }

    private static JdbcSplitDescription decodeDescription(byte[] description)
    {
        if (description == null || description.length == 0) {
            return JdbcSplitDescription.wholeTable();
        }
        try {
            return SPLIT_DESCRIPTION_CODEC.fromJson(description);
        }
        catch (IllegalArgumentException e) {
            throw new FederationException(INVALID_REQUEST, "Invalid request: malformed split description", e);
        }
    }

    private static boolean isInteger(int jdbcType)
    {
        return jdbcType == Types.TINYINT || jdbcType == Types.SMALLINT || jdbcType == Types.INTEGER || jdbcType == Types.BIGINT;
    }

    private static String escapeNamePattern(String name, String escape)
    {
        if (escape == null || escape.isEmpty()) {
            return name;
        }
        return name.replace(escape, escape + escape)
                .replace("_", escape + "_")
                .replace("%", escape + "%");
    }

    private static FederationException translate(SQLException e, String table)
    {
        String state = e.getSQLState();
        if (TABLE_NOT_FOUND_STATE_POSTGRESQL.equals(state) || TABLE_NOT_FOUND_STATE.equals(state)) {
            return new FederationException(TABLE_DOES_NOT_EXIST, "Table not found: " + table, e);
        }
        return new FederationException(BACKEND_ERROR, e.getMessage(), e);
    }
}
