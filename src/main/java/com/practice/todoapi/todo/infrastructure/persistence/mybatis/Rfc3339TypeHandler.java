package com.practice.todoapi.todo.infrastructure.persistence.mybatis;

import java.sql.CallableStatement;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

import org.apache.ibatis.type.BaseTypeHandler;
import org.apache.ibatis.type.JdbcType;
import org.apache.ibatis.type.MappedTypes;

/**
 * Stores {@link OffsetDateTime} as RFC3339 text, which is how SQLite keeps timestamps in the
 * {@code todos} table. Values are written in UTC with all nine fraction digits, so no precision is
 * lost and text order matches time order.
 */
@MappedTypes(OffsetDateTime.class)
public class Rfc3339TypeHandler extends BaseTypeHandler<OffsetDateTime> {

    private static final DateTimeFormatter WRITE_FORMAT = DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSSSSSSSSXXX");

    @Override
    public void setNonNullParameter(PreparedStatement ps, int i, OffsetDateTime parameter, JdbcType jdbcType)
            throws SQLException {
        ps.setString(i, format(parameter));
    }

    @Override
    public OffsetDateTime getNullableResult(ResultSet rs, String columnName) throws SQLException {
        return parse(rs.getString(columnName));
    }

    @Override
    public OffsetDateTime getNullableResult(ResultSet rs, int columnIndex) throws SQLException {
        return parse(rs.getString(columnIndex));
    }

    @Override
    public OffsetDateTime getNullableResult(CallableStatement cs, int columnIndex) throws SQLException {
        return parse(cs.getString(columnIndex));
    }

    static String format(OffsetDateTime value) {
        return WRITE_FORMAT.format(value.withOffsetSameInstant(ZoneOffset.UTC));
    }

    private static OffsetDateTime parse(String text) throws SQLException {
        if (text == null) {
            return null;
        }
        try {
            return OffsetDateTime.parse(text, DateTimeFormatter.ISO_OFFSET_DATE_TIME);
        } catch (DateTimeParseException e) {
            throw new SQLException("Not an RFC3339 timestamp: " + text, e);
        }
    }
}
