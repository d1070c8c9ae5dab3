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

package com.hellblazer.starfield.lod.inspect;

import com.hellblazer.starfield.lod.NodeId;

import java.nio.file.Path;

/**
 * What inspection found for a single node file.
 *
 * @param node      the node named by the file
 * @param file      the node file
 * @param starCount the header count, or -1 if the header could not be read
 * @param size      file size in bytes
 * @param problem   why the file is invalid, or null if it is valid
 * @author hal.hildebrand
 */
public record NodeFileReport(NodeId node, Path file, int starCount, long size, String problem) {

    public boolean isValid() {
        return problem == null;
    }
}
