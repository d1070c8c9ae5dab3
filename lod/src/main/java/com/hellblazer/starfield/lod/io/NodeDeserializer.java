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

import com.hellblazer.starfield.catalog.Provenance;
import com.hellblazer.starfield.catalog.Star;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads node files written by {@link NodeSerializer}. Every structural problem is reported as a
 * {@link CorruptRecordException}; nothing is coerced.
 *
 * @author hal.hildebrand
 * @see NodeSerializer
 * @see NodeFileFormat
 */
public class NodeDeserializer {
    private static final Logger log = LoggerFactory.getLogger(NodeDeserializer.class);

    /**
     * Decode a complete node image. The buffer's byte order is ignored; the format's order is always used.
     *
     * @param buffer the node file content, from position to limit
     * @return the stars in file order
     * @throws CorruptRecordException if the content is not a valid node
     */
    public static List<Star> decode(ByteBuffer buffer) throws CorruptRecordException {
        var data = buffer.slice().order(NodeFileFormat.BYTE_ORDER);
        if (data.remaining() < NodeFileFormat.HEADER_SIZE) {
            throw new CorruptRecordException(
            "Node is " + data.remaining() + " bytes, shorter than the " + NodeFileFormat.HEADER_SIZE + " byte header");
        }
        var count = checkedCount(data.getInt());
        var expected = NodeFileFormat.expectedSize(count);
        if (buffer.remaining() != expected) {
            throw new CorruptRecordException(
            "Header declares " + count + " stars (" + expected + " bytes) but node is " + buffer.remaining()
            + " bytes");
        }
        var stars = new ArrayList<Star>(count);
        for (int i = 0; i < count; i++) {
            var x = data.getFloat();
            var y = data.getFloat();
            var z = data.getFloat();
            var magnitude = data.getFloat();
            var code = data.getInt();
            Provenance provenance;
            try {
                provenance = Provenance.fromCode(code);
            } catch (IllegalArgumentException e) {
                throw new CorruptRecordException("Record " + i + " has unknown provenance code " + code, e);
            }
            stars.add(new Star(x, y, z, magnitude, provenance));
        }
        return stars;
    }

    /**
     * Read and decode a node file.
     *
     * @throws CorruptRecordException if the file is not a valid node
     * @throws IOException            if the file cannot be read
     */
    public List<Star> read(Path inputFile) throws IOException {
        try (var channel = FileChannel.open(inputFile, StandardOpenOption.READ)) {
            var size = channel.size();
            if (size > NodeFileFormat.expectedSize(NodeFileFormat.MAX_STARS)) {
                throw new CorruptRecordException(inputFile + " is too large for a node file: " + size + " bytes");
            }
            var buffer = ByteBuffer.allocate((int) size);
            while (buffer.hasRemaining()) {
                if (channel.read(buffer) < 0) {
                    break;
                }
            }
            buffer.flip();
            try {
                var stars = decode(buffer);
                log.debug("Read {}: {} stars", inputFile.getFileName(), stars.size());
                return stars;
            } catch (CorruptRecordException e) {
                throw new CorruptRecordException(inputFile.getFileName() + ": " + e.getMessage(), e);
            }
        }
    }

    /**
     * Read only the header of a node file.
     *
     * @return the declared star count, never negative
     * @throws CorruptRecordException if the header is missing or negative
     */
    public int readCount(Path inputFile) throws IOException {
        try (var channel = FileChannel.open(inputFile, StandardOpenOption.READ)) {
            var header = ByteBuffer.allocate(NodeFileFormat.HEADER_SIZE).order(NodeFileFormat.BYTE_ORDER);
            while (header.hasRemaining()) {
                if (channel.read(header) < 0) {
                    throw new CorruptRecordException(inputFile.getFileName() + ": truncated header");
                }
            }
            header.flip();
            try {
                return checkedCount(header.getInt());
            } catch (CorruptRecordException e) {
                throw new CorruptRecordException(inputFile.getFileName() + ": " + e.getMessage(), e);
            }
        }
    }

    private static int checkedCount(int count) throws CorruptRecordException {
        if (count < 0) {
            throw new CorruptRecordException("Negative star count in header: " + count);
        }
        return count;
    }
}
