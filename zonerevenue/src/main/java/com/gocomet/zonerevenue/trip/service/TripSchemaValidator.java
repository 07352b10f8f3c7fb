package com.gocomet.zonerevenue.trip.service;

import com.gocomet.zonerevenue.common.exception.SchemaException;
import com.gocomet.zonerevenue.trip.model.TripColumn;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Checks the live {@code fact_trips} table against the columns a computation
 * reads, using JDBC metadata.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TripSchemaValidator {

    public static final String FACT_TABLE = "fact_trips";

    private final DataSource dataSource;

    /**
     * @throws SchemaException listing every missing or incompatible column
     */
    public void validate(Collection<TripColumn> required) {
        Map<String, Integer> actual = readColumnTypes();
        List<String> problems = new ArrayList<>();
        if (actual.isEmpty()) {
            problems.add("table not found");
        } else {
            for (TripColumn column : required) {
                Integer jdbcType = actual.get(column.columnName());
                if (jdbcType == null) {
                    problems.add("missing column " + column.columnName());
                } else if (!column.type().acceptsJdbcType(jdbcType)) {
                    problems.add(String.format("column %s has JDBC type %d, expected %s",
                            column.columnName(), jdbcType, column.type()));
                }
            }
        }
        if (!problems.isEmpty()) {
            throw new SchemaException(FACT_TABLE, problems);
        }
        log.debug("Schema of {} accepted for {} columns", FACT_TABLE, required.size());
    }

    private Map<String, Integer> readColumnTypes() {
        try (Connection connection = dataSource.getConnection()) {
            DatabaseMetaData metaData = connection.getMetaData();
            Map<String, Integer> columns = readColumnTypes(metaData, FACT_TABLE);
            if (columns.isEmpty()) {
                // Databases that fold unquoted identifiers to upper case
                columns = readColumnTypes(metaData, FACT_TABLE.toUpperCase(Locale.ROOT));
            }
            return columns;
        } catch (SQLException e) {
            throw new DataAccessResourceFailureException("Could not read metadata of " + FACT_TABLE, e);
        }
    }

    private Map<String, Integer> readColumnTypes(DatabaseMetaData metaData, String table) throws SQLException {
        Map<String, Integer> columns = new HashMap<>();
        try (ResultSet rs = metaData.getColumns(null, null, table, null)) {
            while (rs.next()) {
                columns.put(rs.getString("COLUMN_NAME").toLowerCase(Locale.ROOT), rs.getInt("DATA_TYPE"));
            }
        }
        return columns;
    }
}
