package me.golemcore.soundboard.testsupport;

import me.golemcore.soundboard.adapter.outbound.storage.JdbcStorageAdapter;
import org.h2.jdbcx.JdbcDataSource;

import java.util.UUID;

public final class InMemoryStorage {

    private InMemoryStorage() {
    }

    public static JdbcStorageAdapter create() {
        JdbcDataSource dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        dataSource.setUser("sa");
        dataSource.setPassword("");
        JdbcStorageAdapter storage = new JdbcStorageAdapter(dataSource, null);
        storage.init();
        return storage;
    }
}
