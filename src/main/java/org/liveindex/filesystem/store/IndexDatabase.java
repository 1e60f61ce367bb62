package org.liveindex.filesystem.store;

import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;

/**
 * 进程内 H2 索引库。每次调用都得到一个独立命名的新库，表结构来自 {@code db/index-schema.sql}。
 */
public final class IndexDatabase {

    static final String SCHEMA = "db/index-schema.sql";

    private IndexDatabase() {
    }

    public static EmbeddedDatabase create() {
        return new EmbeddedDatabaseBuilder()
                .generateUniqueName(true)
                .setType(EmbeddedDatabaseType.H2)
                .setScriptEncoding("UTF-8")
                .addScript(SCHEMA)
                .build();
    }
}
