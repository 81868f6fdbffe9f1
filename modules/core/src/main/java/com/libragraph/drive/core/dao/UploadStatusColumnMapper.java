package com.libragraph.drive.core.dao;

import com.libragraph.drive.types.UploadStatus;
import org.jdbi.v3.core.mapper.ColumnMapper;
import org.jdbi.v3.core.statement.StatementContext;

import java.sql.ResultSet;
import java.sql.SQLException;

public class UploadStatusColumnMapper implements ColumnMapper<UploadStatus> {

    @Override
    public UploadStatus map(ResultSet r, int columnNumber, StatementContext ctx) throws SQLException {
        return UploadStatus.fromId(r.getShort(columnNumber));
    }
}
