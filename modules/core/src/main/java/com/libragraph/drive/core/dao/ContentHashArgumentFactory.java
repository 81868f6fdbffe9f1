package com.libragraph.drive.core.dao;

import com.libragraph.drive.util.ContentHash;
import org.jdbi.v3.core.argument.AbstractArgumentFactory;
import org.jdbi.v3.core.argument.Argument;
import org.jdbi.v3.core.config.ConfigRegistry;

import java.sql.Types;

/**
 * Binds {@link ContentHash} as raw digest bytes.
 */
public class ContentHashArgumentFactory extends AbstractArgumentFactory<ContentHash> {

    public ContentHashArgumentFactory() {
        super(Types.BINARY);
    }

    @Override
    protected Argument build(ContentHash value, ConfigRegistry config) {
        return (position, statement, ctx) -> statement.setBytes(position, value.bytes());
    }
}
