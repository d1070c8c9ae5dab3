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

package com.hellblazer.starfield.lod.io;

import com.hellblazer.starfield.catalog.Star;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;

/**
 * Writes star lists as node files. Each file is written to a temporary sibling, forced to disk and then moved over
 * the final name, so a reader never observes a truncated node.
 * <p>
 * Safe for concurrent use as long as callers write distinct paths.
 *
 * @author hal.hildebrand
 * @see NodeDeserializer
 * @see NodeFileFormat
 */
public class NodeSerializer {
    private static final Logger log        = LoggerFactory.getLogger(NodeSerializer.class);
    private static final String TMP_SUFFIX = ".tmp";

    /**
     * Encode stars into a buffer positioned at zero, ready to be drained.
     */
    public static ByteBuffer encode(List<Star> stars) {
        if (stars.size() > NodeFileFormat.MAX_STARS) {
            throw new IllegalArgumentException("Too many stars for one node file: " + stars.size());
        }
        var buffer = ByteBuffer.allocate((int) NodeFileFormat.expectedSize(stars.size()))
                               .order(NodeFileFormat.BYTE_ORDER);
        buffer.putInt(stars.size());
        for (var star : stars) {
            buffer.putFloat((float) star.x());
            buffer.putFloat((float) star.y());
            buffer.putFloat((float) star.z());
            buffer.putFloat(star.magnitude());
            buffer.putInt(star.provenance().code());
        }
        buffer.flip();
        return buffer;
    }

    /**
     * Write a node file, creating parent directories as needed and replacing any existing file.
     *
     * @param stars      the node's stars, in the order they should appear
     * @param outputFile the final path of the node file
     * @return the size of the published file in bytes
     * @throws IOException if the file cannot be written
     */
    public long write(List<Star> stars, Path outputFile) throws IOException {
        var parent = outputFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        var buffer = encode(stars);
        var size = buffer.remaining();
        var tmp = outputFile.resolveSibling(outputFile.getFileName() + TMP_SUFFIX);

        try (var channel = FileChannel.open(tmp, StandardOpenOption.CREATE, StandardOpenOption.WRITE,
                                            StandardOpenOption.TRUNCATE_EXISTING)) {
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        } catch (IOException e) {
            Files.deleteIfExists(tmp);
            throw e;
        }
        publish(tmp, outputFile);

        log.debug("Wrote {}: {} stars, {} bytes", outputFile.getFileName(), stars.size(), size);
        return size;
    }

    private static void publish(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move unsupported for {}, replacing", target);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
