/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.tsensemble.registry;

import static com.amazon.tsensemble.CommonUtils.checkArgument;
import static com.amazon.tsensemble.CommonUtils.checkNotNull;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import lombok.Getter;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.amazon.tsensemble.exception.ModelNotFoundException;

/**
 * Stores each record as two files in one directory: {@code <name>.json} with
 * the metadata and {@code <name>.bin} with the fitted state. Files are written
 * to a temporary file first and then moved into place, and all writes of one
 * registry instance are serialized, so a reader of the same instance never
 * sees half a record. The metadata file is written last and marks the record
 * as present.
 */
public class FileModelRegistry implements ModelRegistry {

    private static final Logger logger = LogManager.getLogger(FileModelRegistry.class);

    public static final String METADATA_SUFFIX = ".json";

    public static final String STATE_SUFFIX = ".bin";

    private static final Pattern VALID_NAME = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]*");

    @Getter
    private final Path directory;

    private final ModelRecordSerializer serializer = new ModelRecordSerializer();

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * @param directory the directory holding the records, created if missing
     */
    public FileModelRegistry(Path directory) {
        checkNotNull(directory, "directory cannot be null");
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot create registry directory " + directory, e);
        }
        this.directory = directory;
    }

    @Override
    public String save(String name, ModelRecord record) {
        checkName(name);
        checkNotNull(record, "record cannot be null");
        byte[] bytes = serializer.stateToBytes(record);
        byte[] json = serializer.metadataToJson(record);
        Path metadataFile = metadataFile(name);
        lock.writeLock().lock();
        try {
            write(stateFile(name), bytes);
            write(metadataFile, json);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot save model " + name, e);
        } finally {
            lock.writeLock().unlock();
        }
        logger.info("saved {} {} to {}", record.getKind(), name, metadataFile);
        return metadataFile.toAbsolutePath().toString();
    }

    void write(Path target, byte[] content) throws IOException {
        Path temporary = Files.createTempFile(directory, target.getFileName().toString(), ".tmp");
        try {
            Files.write(temporary, content);
            try {
                Files.move(temporary, target, StandardCopyOption.ATOMIC_MOVE,
                        StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                logger.debug("atomic move not supported in {}", directory);
                Files.move(temporary, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temporary);
        }
    }

    @Override
    public ModelRecord load(String name) {
        checkName(name);
        lock.readLock().lock();
        try {
            Path metadataFile = metadataFile(name);
            if (!Files.exists(metadataFile)) {
                throw new ModelNotFoundException(name);
            }
            return serializer.toRecord(Files.readAllBytes(metadataFile), Files.readAllBytes(stateFile(name)));
        } catch (NoSuchFileException e) {
            throw new ModelNotFoundException(name, e);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot load model " + name, e);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<String> list() {
        lock.readLock().lock();
        try (Stream<Path> files = Files.list(directory)) {
            return files.map(file -> file.getFileName().toString())
                    .filter(file -> file.endsWith(METADATA_SUFFIX))
                    .map(file -> file.substring(0, file.length() - METADATA_SUFFIX.length()))
                    .filter(name -> VALID_NAME.matcher(name).matches()).sorted().collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("cannot list " + directory, e);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void delete(String name) {
        checkName(name);
        lock.writeLock().lock();
        try {
            // metadata first, so a failure in between leaves no visible record
            boolean removed = Files.deleteIfExists(metadataFile(name));
            removed |= Files.deleteIfExists(stateFile(name));
            if (!removed) {
                throw new ModelNotFoundException(name);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("cannot delete model " + name, e);
        } finally {
            lock.writeLock().unlock();
        }
        logger.info("deleted {}", name);
    }

    @Override
    public boolean exists(String name) {
        checkName(name);
        return Files.exists(metadataFile(name));
    }

    Path metadataFile(String name) {
        return directory.resolve(name + METADATA_SUFFIX);
    }

    Path stateFile(String name) {
        return directory.resolve(name + STATE_SUFFIX);
    }

    private static void checkName(String name) {
        checkArgument(name != null && VALID_NAME.matcher(name).matches(),
                "model names may contain letters, digits, '.', '_' and '-' and must not start with a symbol, got "
                        + name);
    }
}
