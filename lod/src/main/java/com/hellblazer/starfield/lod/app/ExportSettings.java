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

package com.hellblazer.starfield.lod.app;

import com.hellblazer.starfield.catalog.PostgisConfig;
import com.hellblazer.starfield.lod.OctreeBuildConfig;

/**
 * Everything an export run needs: the build policy and the catalog connection.
 *
 * @author hal.hildebrand
 */
public class ExportSettings {

    private final OctreeBuildConfig build;
    private       PostgisConfig     database;

    public ExportSettings(OctreeBuildConfig build, PostgisConfig database) {
        this.build = build;
        this.database = database;
    }

    public static ExportSettings defaults() {
        return new ExportSettings(new OctreeBuildConfig(), PostgisConfig.defaults());
    }

    public OctreeBuildConfig getBuild() {
        return build;
    }

    public PostgisConfig getDatabase() {
        return database;
    }

    public ExportSettings withDatabase(PostgisConfig database) {
        this.database = database;
        return this;
    }

    @Override
    public String toString() {
        return "ExportSettings[" + build + ", " + database + "]";
    }
}
