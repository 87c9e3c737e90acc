package me.golemcore.soundboard.port.outbound;

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

import java.sql.Connection;
import java.sql.SQLException;
import java.util.function.Consumer;

/**
 * Port for transactional access to the persisted {@code sounds} and
 * {@code config} tables.
 *
 * <p>
 * Writes are serialized through a single logical writer and run in one
 * transaction each: a callback that throws leaves storage unchanged. Reads may
 * run concurrently with each other, but a write in progress blocks new reads
 * until it commits, so a read issued after a write returns observes it.
 *
 * <p>
 * Callers never see {@link SQLException}; implementations translate it into
 * {@link me.golemcore.soundboard.domain.exception.StorageException}.
 * Domain exceptions thrown by a callback propagate unchanged.
 */
public interface StoragePort {

    /**
     * Run a read-only callback.
     */
    <T> T read(StorageCallback<T> callback);

    /**
     * Run a callback inside the single-writer section and commit its transaction.
     */
    default <T> T write(StorageCallback<T> callback) {
        return write(callback, result -> {
        });
    }

    /**
     * Run a callback inside the single-writer section, commit its transaction,
     * then pass the result to {@code afterCommit} before the writer section is
     * released. Successive writes therefore run their hooks in commit order.
     * The hook is not called when the callback fails.
     */
    <T> T write(StorageCallback<T> callback, Consumer<? super T> afterCommit);

    /**
     * Unit of work executed against a JDBC connection owned by the gateway.
     */
    @FunctionalInterface
    interface StorageCallback<T> {
        T doInConnection(Connection connection) throws SQLException;
    }
}
