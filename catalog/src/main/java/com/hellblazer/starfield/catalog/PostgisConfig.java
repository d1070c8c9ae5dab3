/*
 * Copyright (c) 2025 Hal Hildebrand. All rights reserved.
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */

package com.hellblazer.starfield.catalog;

/**
 * Connection parameters for the PostGIS star catalog.
 *
 * @author hal.hildebrand
 */
public record PostgisConfig(String host, int port, String database, String user, String password, int poolSize) {

    public static final String DEFAULT_HOST     = "localhost";
    public static final int    DEFAULT_PORT     = 5432;
    public static final String DEFAULT_DATABASE = "epistemic_engine";
    public static final String DEFAULT_USER     = "postgres";

    public PostgisConfig {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("Database host must be set");
        }
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("Database port out of range: " + port);
        }
        if (database == null || database.isBlank()) {
            throw new IllegalArgumentException("Database name must be set");
        }
        if (poolSize <= 0) {
            throw new IllegalArgumentException("Pool size must be positive: " + poolSize);
        }
        password = password == null ? "" : password;
    }

    public static PostgisConfig defaults() {
        return new PostgisConfig(DEFAULT_HOST, DEFAULT_PORT, DEFAULT_DATABASE, DEFAULT_USER, "",
                                 Runtime.getRuntime().availableProcessors());
    }

    public String jdbcUrl() {
        return String.format("jdbc:postgresql://%s:%d/%s", host, port, database);
    }

    public PostgisConfig withHost(String host) {
        return new PostgisConfig(host, port, database, user, password, poolSize);
    }

    public PostgisConfig withPort(int port) {
        return new PostgisConfig(host, port, database, user, password, poolSize);
    }

    public PostgisConfig withDatabase(String database) {
        return new PostgisConfig(host, port, database, user, password, poolSize);
    }

    public PostgisConfig withUser(String user) {
        return new PostgisConfig(host, port, database, user, password, poolSize);
    }

    public PostgisConfig withPassword(String password) {
        return new PostgisConfig(host, port, database, user, password, poolSize);
    }

    public PostgisConfig withPoolSize(int poolSize) {
        return new PostgisConfig(host, port, database, user, password, poolSize);
    }

    @Override
    public String toString() {
        return String.format("PostgisConfig[%s, user=%s, poolSize=%d]", jdbcUrl(), user, poolSize);
    }
}
