package io.xmin.replication.supplier.schema;

import io.xmin.replication.commons.connection.ConnectionHolder;
import io.xmin.replication.model.schema.ColumnSchema;
import io.xmin.replication.model.schema.ElementType;
import io.xmin.replication.model.schema.TableId;
import io.xmin.replication.model.schema.TableSchema;
import io.xmin.replication.model.value.TypeConversionException;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads table layouts from the PostgreSQL catalog. Column types are resolved down to the element
 * type: arrays through {@code typelem}, domains through their base type, enums to text.
 */
public class SchemaManager {
    private static final Logger LOG = LogManager.getLogger(SchemaManager.class);

    private static final String LIST_TABLES_SQL =
            "SELECT tablename FROM pg_catalog.pg_tables WHERE schemaname = ? ORDER BY tablename";

    private static final String TABLE_EXISTS_SQL =
            "SELECT EXISTS (SELECT 1 FROM pg_catalog.pg_tables WHERE schemaname = ? AND tablename = ?)";

    private static final String LIST_COLUMNS_SQL =
            "SELECT a.attname, " +
            "format_type(a.atttypid, a.atttypmod) AS declared_type, " +
            "a.attnotnull, " +
            "(t.typcategory = 'A' AND t.typelem <> 0) AS is_array, " +
            "CASE WHEN el.typtype = 'e' THEN 'enum' WHEN el.typtype = 'd' THEN bt.typname ELSE el.typname END AS element_type " +
            "FROM pg_catalog.pg_attribute a " +
            "JOIN pg_catalog.pg_class c ON c.oid = a.attrelid " +
            "JOIN pg_catalog.pg_namespace n ON n.oid = c.relnamespace " +
            "JOIN pg_catalog.pg_type t ON t.oid = a.atttypid " +
            "JOIN pg_catalog.pg_type el ON el.oid = CASE WHEN t.typcategory = 'A' AND t.typelem <> 0 THEN t.typelem ELSE t.oid END " +
            "LEFT JOIN pg_catalog.pg_type bt ON bt.oid = el.typbasetype " +
            "WHERE n.nspname = ? AND c.relname = ? AND a.attnum > 0 AND NOT a.attisdropped " +
            "ORDER BY a.attnum";

    private static final String LIST_PRIMARY_KEY_SQL =
            "SELECT a.attname " +
            "FROM pg_catalog.pg_index i " +
            "JOIN pg_catalog.pg_class c ON c.oid = i.indrelid " +
            "JOIN pg_catalog.pg_namespace n ON n.oid = c.relnamespace " +
            "JOIN pg_catalog.pg_attribute a ON a.attrelid = i.indrelid AND a.attnum = ANY(i.indkey) " +
            "WHERE n.nspname = ? AND c.relname = ? AND i.indisprimary " +
            "ORDER BY array_position(i.indkey, a.attnum)";

    private static final String UNDEFINED_TABLE_STATE = "42P01";

    private final ConnectionHolder connectionHolder;

    public SchemaManager(ConnectionHolder connectionHolder) {
        this.connectionHolder = connectionHolder;
    }

    public List<TableId> listTables(String schema) throws SQLException {
        Connection connection = this.connectionHolder.get();
        List<TableId> tableList = new ArrayList<>();

        try (PreparedStatement statement = connection.prepareStatement(SchemaManager.LIST_TABLES_SQL)) {
            statement.setString(1, schema);

            try (ResultSet resultSet = statement.executeQuery()) {
                while (resultSet.next()) {
                    tableList.add(new TableId(schema, resultSet.getString(1)));
                }
            }
        }

        return tableList;
    }

    public boolean tableExists(TableId tableId) throws SQLException {
        Connection connection = this.connectionHolder.get();

        try (PreparedStatement statement = connection.prepareStatement(SchemaManager.TABLE_EXISTS_SQL)) {
            statement.setString(1, tableId.getSchema());
            statement.setString(2, tableId.getName());

            try (ResultSet resultSet = statement.executeQuery()) {
                return resultSet.next() && resultSet.getBoolean(1);
            }
        }
    }

    /**
     * Describes a table with its declared primary key, which is empty for tables without one.
     *
     * @throws TypeConversionException when a column has a type outside {@link ElementType}
     */
    public TableSchema describe(TableId tableId) throws SQLException {
        Connection connection = this.connectionHolder.get();
        List<ColumnSchema> columnList = new ArrayList<>();

        try (PreparedStatement statement = connection.prepareStatement(SchemaManager.LIST_COLUMNS_SQL)) {
            statement.setString(1, tableId.getSchema());
            statement.setString(2, tableId.getName());

            try (ResultSet resultSet = statement.executeQuery()) {
                while (resultSet.next()) {
                    String name = resultSet.getString(1);
                    String declaredType = resultSet.getString(2);
                    String elementType = resultSet.getString(5);

                    if (!ElementType.isKnown(elementType)) {
                        throw new TypeConversionException(String.format(
                                "column %s.%s has unsupported type %s", tableId, name, declaredType
                        ));
                    }

                    columnList.add(new ColumnSchema(
                            name,
                            ElementType.byCode(elementType),
                            resultSet.getBoolean(4),
                            declaredType,
                            !resultSet.getBoolean(3),
                            false
                    ));
                }
            }
        }

        if (columnList.isEmpty()) {
            throw new SQLException(String.format("table %s does not exist", tableId), SchemaManager.UNDEFINED_TABLE_STATE);
        }

        List<String> primaryKeyColumns = this.listPrimaryKey(connection, tableId);

        SchemaManager.LOG.debug("described {}: {} columns, primary key {}", tableId, columnList.size(), primaryKeyColumns);

        return new TableSchema(tableId, columnList, primaryKeyColumns);
    }

    private List<String> listPrimaryKey(Connection connection, TableId tableId) throws SQLException {
        List<String> primaryKeyColumns = new ArrayList<>();

        try (PreparedStatement statement = connection.prepareStatement(SchemaManager.LIST_PRIMARY_KEY_SQL)) {
            statement.setString(1, tableId.getSchema());
            statement.setString(2, tableId.getName());

            try (ResultSet resultSet = statement.executeQuery()) {
                while (resultSet.next()) {
                    primaryKeyColumns.add(resultSet.getString(1));
                }
            }
        }

        return primaryKeyColumns;
    }
}
