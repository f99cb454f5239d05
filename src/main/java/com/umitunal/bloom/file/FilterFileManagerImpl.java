/*
 * Copyright (c) 2023-2025 Umit Unal
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.umitunal.bloom.file;

import com.umitunal.bloom.codec.BloomFilterCodec;
import com.umitunal.bloom.codec.ReadResult;
import com.umitunal.bloom.config.BloomFilterConfig;
import com.umitunal.bloom.filter.BloomFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Implementation of the FilterFileManager interface.
 * Filters are written and read through {@link BloomFilterCodec}'s streaming format,
 * so the body is never held in memory twice.
 */
public class FilterFileManagerImpl implements FilterFileManager {
    private static final Logger logger = LoggerFactory.getLogger(FilterFileManagerImpl.class);

    /**
     * File extension of filter files.
     */
    public static final String FILE_EXTENSION = ".bloom";

    private final Path directory;
    private final String name;
    private final BloomFilterConfig config;

    /**
     * Creates a new FilterFileManagerImpl with the default configuration.
     *
     * @param directory the directory holding the filter file
     * @param name the file name without extension
     */
    public FilterFileManagerImpl(Path directory, String name) {
        this(directory, name, BloomFilterConfig.getDefault());
    }

    /**
     * Creates a new FilterFileManagerImpl.
     *
     * @param directory the directory holding the filter file
     * @param name the file name without extension
     * @param config the configuration supplying the I/O chunk size and bit array backend
     */
    public FilterFileManagerImpl(Path directory, String name, BloomFilterConfig config) {
        if (directory == null || name == null || name.isEmpty()) {
            throw new IllegalArgumentException("directory and name must not be null or empty");
        }
        if (config == null) {
            throw new IllegalArgumentException("config must not be null");
        }
        this.directory = directory;
        this.name = name;
        this.config = config;
    }

    @Override
    public Path getFilterFilePath() {
        return directory.resolve(name + FILE_EXTENSION);
    }

    @Override
    public boolean exists() {
        return Files.exists(getFilterFilePath());
    }

    @Override
    public void save(BloomFilter filter) throws IOException {
        Path path = getFilterFilePath();
        Files.createDirectories(directory);

        try (FileChannel channel = FileChannel.open(path,
                StandardOpenOption.CREATE,
                StandardOpenOption.WRITE,
                StandardOpenOption.TRUNCATE_EXISTING);
             OutputStream out = new BufferedOutputStream(Channels.newOutputStream(channel), config.ioChunkSizeBytes())) {

            BloomFilterCodec.writeTo(filter, out);
            out.flush();
            channel.force(true);
        } catch (IOException e) {
            logger.error("Error saving Bloom filter to file: " + path, e);
            throw e;
        }

        logger.debug("Saved {} to {}", filter, path);
    }

    @Override
    public BloomFilter load() throws IOException {
        Path path = getFilterFilePath();

        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ);
             InputStream in = Channels.newInputStream(channel)) {

            ReadResult result = BloomFilterCodec.readFrom(in, config.ioChunkSizeBytes(), config.bitArrayType());
            if (result instanceof ReadResult.Failure failure) {
                logger.warn("File {} does not hold a Bloom filter: {}", path, failure.message());
            }
            BloomFilter filter = result.orElseThrow();
            logger.debug("Loaded {} from {}", filter, path);
            return filter;
        }
    }

    @Override
    public boolean delete() throws IOException {
        return Files.deleteIfExists(getFilterFilePath());
    }
}
