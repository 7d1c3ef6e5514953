// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.lantern.wallet.store;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

import sh.lantern.core.error.StorageException;

/**
 * Shared Jackson setup and atomic file writes for the JSON stores.
 *
 * <p>
 * Files are written to a sibling temp file and moved over the target, so a crash mid-write leaves
 * either the old or the new content. Amounts are written as plain decimals.
 */
public final class JsonFiles {

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(StreamWriteFeature.WRITE_BIGDECIMAL_AS_PLAIN)
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private JsonFiles() {
        // Utility class
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * Reads {@code path}, or returns empty when the file does not exist.
     *
     * @throws StorageException if the file exists but cannot be read or parsed
     */
    public static <T> Optional<T> read(final Path path, final TypeReference<T> type) {
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(MAPPER.readValue(path.toFile(), type));
        } catch (IOException e) {
            throw new StorageException("Failed to read " + path, e);
        }
    }

    /**
     * Serializes {@code value} to {@code path}, creating parent directories as needed.
     *
     * @throws StorageException on any I/O failure
     */
    public static void write(final Path path, final Object value) {
        final Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        try {
            final Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            MAPPER.writeValue(tmp.toFile(), value);
            try {
                Files.move(tmp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new StorageException("Failed to write " + path, e);
        }
    }

    /**
     * Removes {@code path} if present.
     *
     * @throws StorageException on any I/O failure
     */
    public static void delete(final Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            throw new StorageException("Failed to delete " + path, e);
        }
    }
}
