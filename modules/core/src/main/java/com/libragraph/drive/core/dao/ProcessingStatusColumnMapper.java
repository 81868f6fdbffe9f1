package com.libragraph.drive.core.dao;

import com.libragraph.drive.types.ProcessingStatus;
import org.jdbi.v3.core.mapper.ColumnMapper;
import org.jdbi.v3.core.statement.StatementContext;

import java.sql.ResultSet;
import java.sql.SQLException;

public class ProcessingStatusColumnMapper implements ColumnMapper<ProcessingStatus> {

    @Override
    public ProcessingStatus map(ResultSet r, int columnNumber, StatementContext ctx) throws SQLException {
        return ProcessingStatus.fromId(r.getShort(columnNumber));
    }
}
