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

import com.hellblazer.starfield.geometry.BoundingVolume;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import javax.vecmath.Point3d;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Point source backed by the {@code cosmic_objects} table of a PostGIS database. Positions are the Cartesian
 * coordinates of the {@code location} POINTZ, in meters.
 * <p>
 * Each query borrows its own connection from the pool, so concurrent octant queries never share a cursor.
 *
 * @author hal.hildebrand
 */
public class PostgisPointSource implements PointSource {
    static final  String BOUNDS_QUERY = """
                                        SELECT MIN(ST_X(location::geometry)), MAX(ST_X(location::geometry)),
                                               MIN(ST_Y(location::geometry)), MAX(ST_Y(location::geometry)),
                                               MIN(ST_Z(location::geometry)), MAX(ST_Z(location::geometry))
                                        FROM cosmic_objects""";
    static final  String POINTS_QUERY = """
                                        SELECT ST_X(location::geometry), ST_Y(location::geometry),
                                               ST_Z(location::geometry), magnitude_g, truth_label::text
                                        FROM cosmic_objects
                                        WHERE ST_X(location::geometry) BETWEEN ? AND ?
                                          AND ST_Y(location::geometry) BETWEEN ? AND ?
                                          AND ST_Z(location::geometry) BETWEEN ? AND ?""";
    static final  String LABEL_CLAUSE = "truth_label::text = ?";
    static final  int    FETCH_SIZE   = 10_000;
    private static final Logger log = LoggerFactory.getLogger(PostgisPointSource.class);

    private final DataSource       dataSource;
    private final HikariDataSource ownedPool;

    /**
     * Query through an externally managed data source, which this source will not close.
     */
    public PostgisPointSource(DataSource dataSource) {
        this(dataSource, null);
    }

    private PostgisPointSource(DataSource dataSource, HikariDataSource ownedPool) {
        this.dataSource = dataSource;
        this.ownedPool = ownedPool;
    }

    /**
     * Open a connection pool to the catalog database.
     *
     * @throws SourceUnavailableException if the pool cannot establish its first connection
     */
    public static PostgisPointSource connect(PostgisConfig config) {
        var hikari = new HikariConfig();
        hikari.setJdbcUrl(config.jdbcUrl());
        hikari.setUsername(config.user());
        hikari.setPassword(config.password());
        hikari.setMaximumPoolSize(config.poolSize());
        hikari.setPoolName("starfield-catalog");
        hikari.setReadOnly(true);
        try {
            var pool = new HikariDataSource(hikari);
            log.info("Connected to catalog: {}", config);
            return new PostgisPointSource(pool, pool);
        } catch (RuntimeException e) {
            throw new SourceUnavailableException("Cannot connect to catalog " + config, e);
        }
    }

    @Override
    public BoundingVolume globalBounds(ProvenanceFilter filter) {
        var sql = filter.isUnrestricted() ? BOUNDS_QUERY : BOUNDS_QUERY + "\nWHERE " + LABEL_CLAUSE;
        try (var connection = dataSource.getConnection(); var statement = connection.prepareStatement(sql)) {
            bindFilter(statement, 1, filter);
            try (var rs = statement.executeQuery()) {
                if (!rs.next() || rs.getObject(1) == null) {
                    throw new EmptyDatasetException(filter);
                }
                var bounds = new BoundingVolume(rs.getDouble(1), rs.getDouble(3), rs.getDouble(5), rs.getDouble(2),
                                                rs.getDouble(4), rs.getDouble(6));
                log.info("Catalog extent (filter {}): {}", filter, bounds);
                return bounds.padded(BOUNDS_PADDING);
            }
        } catch (SQLException e) {
            throw new SourceUnavailableException("Global bounds query failed: " + e.getMessage(), e);
        }
    }

    @Override
    public List<Star> pointsIn(BoundingVolume volume, ProvenanceFilter filter) {
        var sql = filter.isUnrestricted() ? POINTS_QUERY : POINTS_QUERY + "\n  AND " + LABEL_CLAUSE;
        try (var connection = dataSource.getConnection()) {
            // The driver only streams with a fetch size inside a transaction
            connection.setAutoCommit(false);
            try (var statement = connection.prepareStatement(sql)) {
                statement.setFetchSize(FETCH_SIZE);
                statement.setDouble(1, volume.minX());
                statement.setDouble(2, volume.maxX());
                statement.setDouble(3, volume.minY());
                statement.setDouble(4, volume.maxY());
                statement.setDouble(5, volume.minZ());
                statement.setDouble(6, volume.maxZ());
                bindFilter(statement, 7, filter);
                try (var rs = statement.executeQuery()) {
                    var stars = readStars(rs);
                    connection.commit();
                    return stars;
                }
            }
        } catch (SQLException e) {
            throw new SourceUnavailableException("Volume query failed for " + volume + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        if (ownedPool != null && !ownedPool.isClosed()) {
            ownedPool.close();
            log.debug("Catalog connection pool closed");
        }
    }

    private static void bindFilter(PreparedStatement statement, int index, ProvenanceFilter filter)
    throws SQLException {
        var provenance = filter.provenance();
        if (provenance.isPresent()) {
            statement.setString(index, provenance.get().name());
        }
    }

    private static List<Star> readStars(ResultSet rs) throws SQLException {
        var stars = new ArrayList<Star>();
        while (rs.next()) {
            var position = new Point3d(rs.getDouble(1), rs.getDouble(2), rs.getDouble(3));
            var magnitude = (float) rs.getDouble(4);
            if (rs.wasNull()) {
                magnitude = Star.DEFAULT_MAGNITUDE;
            }
            var label = rs.getString(5);
            Provenance provenance;
            try {
                provenance = Provenance.fromLabel(label);
            } catch (IllegalArgumentException e) {
                throw new PointSourceException("Catalog row has unrecognized truth label: " + label, e);
            }
            stars.add(new Star(position, magnitude, provenance));
        }
        return stars;
    }
}
