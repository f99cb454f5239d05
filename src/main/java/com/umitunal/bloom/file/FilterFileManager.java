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

import com.umitunal.bloom.filter.BloomFilter;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Interface for storing Bloom filters in files.
 * This interface defines methods for saving, loading and removing a filter file.
 */
public interface FilterFileManager {

    /**
     * Gets the path of the filter file.
     *
     * @return the path of the filter file
     */
    Path getFilterFilePath();

    /**
     * Checks whether the filter file exists.
     *
     * @return true if the file exists
     */
    boolean exists();

    /**
     * Saves a Bloom filter to the file, replacing any previous content.
     *
     * @param filter the filter to save
     * @throws IOException if an I/O error occurs
     */
    void save(BloomFilter filter) throws IOException;

    /**
     * Loads the Bloom filter from the file.
     *
     * @return the loaded filter
     * @throws com.umitunal.bloom.codec.FilterFormatException if the file does not hold a filter
     * @throws IOException if an I/O error occurs
     */
    BloomFilter load() throws IOException;

    /**
     * Deletes the filter file if it exists.
     *
     * @return true if a file was deleted
     * @throws IOException if an I/O error occurs
     */
    boolean delete() throws IOException;
}
