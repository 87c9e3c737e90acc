package me.golemcore.soundboard.adapter.outbound.storage;

import me.golemcore.soundboard.domain.exception.StorageException;
import me.golemcore.soundboard.domain.exception.ValidationException;
import me.golemcore.soundboard.testsupport.InMemoryStorage;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JdbcStorageAdapterTest {

    private JdbcStorageAdapter storage;

    @BeforeEach
    void setUp() {
        storage = InMemoryStorage.create();
    }

    @AfterEach
    void tearDown() {
        storage.close();
    }

    @Test
    void shouldMakeCommittedWriteVisibleToLaterRead() {
        storage.write(conn -> {
            try (Statement st = conn.createStatement()) {
                return st.executeUpdate("INSERT INTO config (config_key, config_value) VALUES ('volume', '40')");
            }
        });

        String value = storage.read(conn -> {
            try (Statement st = conn.createStatement();
                    ResultSet rs = st.executeQuery("SELECT config_value FROM config WHERE config_key = 'volume'")) {
                return rs.next() ? rs.getString(1) : null;
            }
        });

        assertEquals("40", value);
    }

    @Test
    void shouldRollBackWhenCallbackThrowsDomainException() {
        assertThrows(ValidationException.class, () -> storage.write(conn -> {
            try (Statement st = conn.createStatement()) {
                st.executeUpdate("INSERT INTO config (config_key, config_value) VALUES ('interval', '60')");
            }
            throw new ValidationException("rejected");
        }));

        assertEquals(0, countConfigRows());
    }

    @Test
    void shouldTranslateSqlErrorsToStorageException() {
        StorageException error = assertThrows(StorageException.class, () -> storage.read(conn -> {
            try (Statement st = conn.createStatement()) {
                return st.executeQuery("SELECT * FROM missing_table");
            }
        }));

        assertTrue(error.getCause() instanceof java.sql.SQLException);
    }

    @Test
    void shouldRollBackAllStatementsOfFailedWrite() {
        assertThrows(StorageException.class, () -> storage.write(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    "INSERT INTO config (config_key, config_value) VALUES (?, ?)")) {
                ps.setString(1, "a");
                ps.setString(2, "1");
                ps.executeUpdate();
                ps.setString(1, "a");
                ps.setString(2, "2");
                return ps.executeUpdate();
            }
        }));

        assertEquals(0, countConfigRows());
    }

    @Test
    void shouldSerializeConcurrentWriters() throws Exception {
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                String key = "k" + i;
                futures.add(pool.submit(() -> {
                    start.await();
                    return storage.write(conn -> {
                        int now = inside.incrementAndGet();
                        maxInside.accumulateAndGet(now, Math::max);
                        try (PreparedStatement ps = conn.prepareStatement(
                                "INSERT INTO config (config_key, config_value) VALUES (?, ?)")) {
                            ps.setString(1, key);
                            ps.setString(2, "v");
                            ps.executeUpdate();
                        }
                        inside.decrementAndGet();
                        return null;
                    });
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1, maxInside.get());
        assertEquals(8, countConfigRows());
    }

    @Test
    void afterCommitHookShouldRunBeforeNextWriterStarts() throws Exception {
        CountDownLatch hookEntered = new CountDownLatch(1);
        CountDownLatch releaseHook = new CountDownLatch(1);
        CountDownLatch secondStarted = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<Integer> first = pool.submit(() -> storage.write(conn -> insert(conn, "first"), rows -> {
                hookEntered.countDown();
                awaitQuietly(releaseHook);
            }));
            assertTrue(hookEntered.await(5, TimeUnit.SECONDS));
            Future<Integer> second = pool.submit(() -> storage.write(conn -> {
                secondStarted.countDown();
                return insert(conn, "second");
            }));

            assertFalse(secondStarted.await(200, TimeUnit.MILLISECONDS));
            releaseHook.countDown();

            assertEquals(1, first.get(5, TimeUnit.SECONDS));
            assertEquals(1, second.get(5, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }
        assertEquals(2, countConfigRows());
    }

    @Test
    void afterCommitHookShouldNotRunWhenWriteFails() {
        AtomicInteger hookCalls = new AtomicInteger();

        assertThrows(ValidationException.class, () -> storage.write(conn -> {
            insert(conn, "rejected");
            throw new ValidationException("rejected");
        }, result -> hookCalls.incrementAndGet()));

        assertEquals(0, hookCalls.get());
        assertEquals(0, countConfigRows());
    }

    private static int insert(Connection conn, String key) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT INTO config (config_key, config_value) VALUES (?, ?)")) {
            ps.setString(1, key);
            ps.setString(2, "v");
            return ps.executeUpdate();
        }
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Test
    void shouldBackUpUnreadableDatabaseFileAndStartFresh(@TempDir Path dir) throws Exception {
        Path base = dir.resolve("soundboard");
        Path file = dir.resolve("soundboard.mv.db");
        Files.writeString(file, "this is not a database file\n".repeat(1024), StandardCharsets.UTF_8);

        JdbcDataSource dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:file:" + base + ";DB_CLOSE_DELAY=-1");
        dataSource.setUser("sa");
        dataSource.setPassword("");
        JdbcStorageAdapter fileStorage = new JdbcStorageAdapter(dataSource, file);

        fileStorage.init();
        try {
            assertTrue(Files.exists(dir.resolve("soundboard.mv.db.bak")));
            assertTrue(Files.readString(dir.resolve("soundboard.mv.db.bak")).startsWith("this is not a database"));
            assertEquals(0, (int) fileStorage.read(conn -> {
                try (Statement st = conn.createStatement();
                        ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM sounds")) {
                    rs.next();
                    return rs.getInt(1);
                }
            }));
        } finally {
            fileStorage.close();
        }
    }

    @Test
    void shouldNotCreateBackupForHealthyDatabase(@TempDir Path dir) {
        Path base = dir.resolve("healthy");
        JdbcDataSource dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:file:" + base + ";DB_CLOSE_DELAY=-1");
        dataSource.setUser("sa");
        JdbcStorageAdapter fileStorage = new JdbcStorageAdapter(dataSource, dir.resolve("healthy.mv.db"));

        fileStorage.init();
        fileStorage.close();

        assertFalse(Files.exists(dir.resolve("healthy.mv.db.bak")));
    }

    private int countConfigRows() {
        return storage.read(conn -> {
            try (Statement st = conn.createStatement();
                    ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM config")) {
                rs.next();
                return rs.getInt(1);
            }
        });
    }
}
