package com.libragraph.drive.core.dao;

import com.libragraph.drive.types.UploadStatus;
import org.jdbi.v3.core.argument.AbstractArgumentFactory;
import org.jdbi.v3.core.argument.Argument;
import org.jdbi.v3.core.config.ConfigRegistry;

import java.sql.Types;

public class UploadStatusArgumentFactory extends AbstractArgumentFactory<UploadStatus> {

    public UploadStatusArgumentFactory() {
        super(Types.SMALLINT);
    }

    @Override
    protected Argument build(UploadStatus value, ConfigRegistry config) {
        return (position, statement, ctx) -> statement.setShort(position, (short) value.id());
    }
}
