package me.golemcore.soundboard.adapter.outbound.storage;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.soundboard.domain.exception.StorageException;
import me.golemcore.soundboard.port.outbound.StoragePort;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.h2.api.ErrorCode;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;

/**
 * Embedded H2 implementation of {@link StoragePort}.
 *
 * <p>
 * The backing store tolerates concurrent readers but not concurrent writers,
 * so writes go through the write half of a fair {@link ReadWriteLock}. With a
 * fair lock a queued writer also holds back readers that arrive after it,
 * which gives read-after-write consistency to every later caller.
 *
 * <p>
 * On startup the schema is created if missing. A database file that exists
 * but cannot be opened is moved aside to {@code <file>.bak} and a fresh
 * database is created; any further failure is fatal.
 *
 * @see StoragePort
 */
@Slf4j
public class JdbcStorageAdapter implements StoragePort {

    private static final String CREATE_SOUNDS = """
            CREATE TABLE IF NOT EXISTS sounds (
                id INTEGER GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                name VARCHAR(255) NOT NULL,
                name_key VARCHAR(255) NOT NULL,
                payload BLOB NOT NULL,
                created_at BIGINT NOT NULL,
                CONSTRAINT uq_sounds_name_key UNIQUE (name_key)
            )""";

    private static final String CREATE_CONFIG = """
            CREATE TABLE IF NOT EXISTS config (
                config_key VARCHAR(64) PRIMARY KEY,
                config_value VARCHAR(255)
            )""";

    private final DataSource dataSource;
    private final Path databaseFile;
    private final ReadWriteLock lock = new ReentrantReadWriteLock(true);

    /**
     * @param dataSource
     *            connection source
     * @param databaseFile
     *            on-disk file backing the data source, or {@code null} for
     *            in-memory databases
     */
    public JdbcStorageAdapter(DataSource dataSource, Path databaseFile) {
        this.dataSource = dataSource;
        this.databaseFile = databaseFile;
    }

    @PostConstruct
    public void init() {
        try {
            createSchema();
        } catch (SQLException e) {
            if (!isUnreadableFile(e)) {
                throw new StorageException("Failed to initialize storage", e);
            }
            backupInvalidDatabase(e);
            try {
                createSchema();
            } catch (SQLException retry) {
                throw new StorageException("Failed to initialize storage after backup", retry);
            }
        }
        log.info("[Storage] Initialized at {}", databaseFile != null ? databaseFile : "memory");
    }

    @PreDestroy
    public void close() {
        lock.writeLock().lock();
        try (Connection connection = dataSource.getConnection();
                Statement statement = connection.createStatement()) {
            statement.execute("SHUTDOWN");
            log.info("[Storage] Database closed");
        } catch (SQLException e) {
            log.warn("[Storage] Failed to close database: {}", e.getMessage());
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public <T> T read(StorageCallback<T> callback) {
        Lock readLock = lock.readLock();
        acquire(readLock);
        try (Connection connection = dataSource.getConnection()) {
            return callback.doInConnection(connection);
        } catch (SQLException e) {
            log.error("[Storage] Read failed: {}", e.getMessage());
            throw new StorageException("Storage read failed", e);
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public <T> T write(StorageCallback<T> callback, Consumer<? super T> afterCommit) {
        Lock writeLock = lock.writeLock();
        acquire(writeLock);
        try (Connection connection = dataSource.getConnection()) {
            connection.setAutoCommit(false);
            T result;
            try {
                result = callback.doInConnection(connection);
                connection.commit();
            } catch (SQLException | RuntimeException e) {
                rollback(connection);
                throw e;
            }
            afterCommit.accept(result);
            return result;
        } catch (SQLException e) {
            log.error("[Storage] Write failed: {}", e.getMessage());
            throw new StorageException("Storage write failed", e);
        } finally {
            writeLock.unlock();
        }
    }

    private static void acquire(Lock target) {
        try {
            target.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StorageException("Interrupted while waiting for storage", e);
        }
    }

    private static void rollback(Connection connection) {
        try {
            connection.rollback();
        } catch (SQLException e) {
            log.warn("[Storage] Rollback failed: {}", e.getMessage());
        }
    }

    private void createSchema() throws SQLException {
        try (Connection connection = dataSource.getConnection();
                Statement statement = connection.createStatement()) {
            statement.execute(CREATE_SOUNDS);
            statement.execute(CREATE_CONFIG);
        }
    }

    private boolean isUnreadableFile(SQLException e) {
        if (databaseFile == null || !Files.exists(databaseFile)) {
            return false;
        }
        int code = e.getErrorCode();
        return code == ErrorCode.FILE_CORRUPTED_1
                || code == ErrorCode.FILE_VERSION_ERROR_1
                || code == ErrorCode.GENERAL_ERROR_1;
    }

    private void backupInvalidDatabase(SQLException cause) {
        Path backup = databaseFile.resolveSibling(databaseFile.getFileName() + ".bak");
        try {
            Files.move(databaseFile, backup, StandardCopyOption.REPLACE_EXISTING);
            log.warn("[Storage] Backed up invalid database to {} ({})", backup, cause.getMessage());
        } catch (IOException e) {
            throw new StorageException("Failed to back up invalid database " + databaseFile, e);
        }
    }
}
