package com.example.convoy.mapping;

import java.nio.file.Path;
import java.nio.file.Paths;

import org.springframework.util.StringUtils;

import com.example.convoy.exceptions.ConfigurationException;

import lombok.Getter;
import lombok.ToString;

/**
 * Backend selection for the auctions mapping, resolved once from the raw
 * options. A configured host selects the networked Redis backend, otherwise
 * the embedded file-backed store is used.
 */
public abstract class DedupStoreSettings {

        public static final String DEFAULT_NAME = "auctions_mapping";
        public static final int DEFAULT_PORT = 6379;
        public static final int DEFAULT_DATABASE = 0;

        private DedupStoreSettings() {
        }

        public static DedupStoreSettings resolve(String host, Integer port, String name, String password,
                        String directory) {
                if (StringUtils.hasText(host)) {
                        return new Networked(host, port != null ? port : DEFAULT_PORT, databaseIndex(name),
                                        StringUtils.hasText(password) ? password : null);
                }
                Path dir = StringUtils.hasText(directory) ? Paths.get(directory) : Paths.get(".");
                return new Embedded(StringUtils.hasText(name) ? name : DEFAULT_NAME, dir);
        }

        private static int databaseIndex(String name) {
                if (!StringUtils.hasText(name)) {
                        return DEFAULT_DATABASE;
                }
                try {
                        return Integer.parseInt(name.trim());
                } catch (NumberFormatException e) {
                        throw new ConfigurationException("Redis database must be a number, got '" + name + "'", e);
                }
        }

        @Getter
        @ToString(exclude = "password")
        public static final class Networked extends DedupStoreSettings {
                private final String host;
                private final int port;
                private final int database;
                private final String password;

                public Networked(String host, int port, int database, String password) {
                        this.host = host;
                        this.port = port;
                        this.database = database;
                        this.password = password;
                }
        }

        @Getter
        @ToString
        public static final class Embedded extends DedupStoreSettings {
                private final String name;
                private final Path directory;

                public Embedded(String name, Path directory) {
                        this.name = name;
                        this.directory = directory;
                }
        }
}
