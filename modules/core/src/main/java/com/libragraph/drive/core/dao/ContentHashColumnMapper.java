package com.libragraph.drive.core.dao;

import com.libragraph.drive.util.ContentHash;
import org.jdbi.v3.core.mapper.ColumnMapper;
import org.jdbi.v3.core.statement.StatementContext;

import java.sql.ResultSet;
import java.sql.SQLException;

public class ContentHashColumnMapper implements ColumnMapper<ContentHash> {

    @Override
    public ContentHash map(ResultSet r, int columnNumber, StatementContext ctx) throws SQLException {
        byte[] bytes = r.getBytes(columnNumber);
        return bytes == null ? null : new ContentHash(bytes);
    }
}
