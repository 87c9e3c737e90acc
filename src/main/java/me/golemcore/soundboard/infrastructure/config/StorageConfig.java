package me.golemcore.soundboard.infrastructure.config;

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

import me.golemcore.soundboard.adapter.outbound.storage.JdbcStorageAdapter;
import me.golemcore.soundboard.port.outbound.StoragePort;
import lombok.extern.slf4j.Slf4j;
import org.h2.jdbcx.JdbcDataSource;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Wires the embedded H2 database used by {@link JdbcStorageAdapter}.
 *
 * <p>
 * Location configured via {@code soundboard.storage.path} (environment
 * {@code SOUNDBOARD_DB_PATH}); H2 appends {@code .mv.db} to it.
 */
@Configuration
@Slf4j
public class StorageConfig {

    static final String H2_FILE_SUFFIX = ".mv.db";

    @Bean
    public StoragePort storagePort(SoundboardProperties properties) throws IOException {
        Path basePath = resolvePath(properties.getStorage().getPath());
        Path parent = basePath.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        JdbcDataSource dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:file:" + basePath + ";DB_CLOSE_DELAY=-1");
        dataSource.setUser("sa");
        dataSource.setPassword("");

        Path databaseFile = basePath.resolveSibling(basePath.getFileName() + H2_FILE_SUFFIX);
        log.info("Storage Path: {}", databaseFile);
        return new JdbcStorageAdapter(dataSource, databaseFile);
    }

    static Path resolvePath(String configured) {
        String expanded = configured.replace("${user.home}", System.getProperty("user.home"));
        String trimmed = expanded.endsWith(H2_FILE_SUFFIX)
                ? expanded.substring(0, expanded.length() - H2_FILE_SUFFIX.length())
                : expanded;
        return Paths.get(trimmed).toAbsolutePath().normalize();
    }
}
