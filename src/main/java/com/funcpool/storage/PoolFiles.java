package com.funcpool.storage;

import com.funcpool.exception.PoolStorageException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * File operations for the pool, with automatic directory creation.
 */
public final class PoolFiles {

    private PoolFiles() {
        // Utility class
    }

    /**
     * Writes content through a temporary sibling file that is then moved into place, so readers
     * see either no file or the complete file.
     */
    public static void writeAtomically(Path filePath, String content) {
        Path parentDir = filePath.toAbsolutePath().getParent();
        try {
            Files.createDirectories(parentDir);
            Path temp = Files.createTempFile(parentDir, "." + filePath.getFileName(), ".tmp");
            try {
                Files.writeString(temp, content, StandardCharsets.UTF_8);
                move(temp, filePath);
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException e) {
            throw new PoolStorageException("Failed to write", filePath, e);
        }
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    public static String read(Path filePath) {
        try {
            return Files.readString(filePath, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new PoolStorageException("Failed to read", filePath, e);
        }
    }

    /**
     * Entries of a directory sorted by name; empty when the directory does not exist.
     */
    public static List<Path> list(Path directory) {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> entries = Files.list(directory)) {
            List<Path> sorted = new ArrayList<>();
            entries.sorted().forEach(sorted::add);
            return sorted;
        } catch (IOException e) {
            throw new PoolStorageException("Failed to list", directory, e);
        }
    }

    public static void delete(Path filePath) {
        try {
            Files.deleteIfExists(filePath);
        } catch (IOException e) {
            throw new PoolStorageException("Failed to delete", filePath, e);
        }
    }

    /**
     * Deletes a directory if it is empty. Returns whether it was removed.
     */
    public static boolean deleteIfEmpty(Path directory) {
        try {
            return Files.deleteIfExists(directory);
        } catch (DirectoryNotEmptyException e) {
            return false;
        } catch (IOException e) {
            throw new PoolStorageException("Failed to delete", directory, e);
        }
    }
}
