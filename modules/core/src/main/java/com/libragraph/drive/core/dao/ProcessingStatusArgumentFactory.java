package com.libragraph.drive.core.dao;

import com.libragraph.drive.types.ProcessingStatus;
import org.jdbi.v3.core.argument.AbstractArgumentFactory;
import org.jdbi.v3.core.argument.Argument;
import org.jdbi.v3.core.config.ConfigRegistry;

import java.sql.Types;

public class ProcessingStatusArgumentFactory extends AbstractArgumentFactory<ProcessingStatus> {

    public ProcessingStatusArgumentFactory() {
        super(Types.SMALLINT);
    }

    @Override
    protected Argument build(ProcessingStatus value, ConfigRegistry config) {
        return (position, statement, ctx) -> statement.setShort(position, (short) value.id());
    }
}
