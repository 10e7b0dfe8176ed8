package com.project.prism.keystore;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.TreeMap;

/**
 * JSON file holding every owner's entry, keyed by normalized owner id.
 * Writes replace the whole file through a temp file and a move, so readers never see half a file.
 */
final class KeystoreFile {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<TreeMap<String, KeystoreEntry>> ENTRIES = new TypeReference<>() {
    };

    private final Path path;

    KeystoreFile(Path path) {
        this.path = path;
    }

    Path path() {
        return path;
    }

    TreeMap<String, KeystoreEntry> read() throws KeystoreException {
        if (!Files.exists(path)) {
            return new TreeMap<>();
        }
        try {
            TreeMap<String, KeystoreEntry> entries = MAPPER.readValue(path.toFile(), ENTRIES);
            return entries == null ? new TreeMap<>() : entries;
        } catch (IOException e) {
            throw new KeystoreException("Failed to read keystore " + path, e);
        }
    }

    void write(Map<String, KeystoreEntry> entries) throws KeystoreException {
        try {
            Path parent = path.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            Path temp = Files.createTempFile(parent, ".keystore-", ".tmp");
            try {
                MAPPER.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), new TreeMap<>(entries));
                moveIntoPlace(temp);
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException e) {
            throw new KeystoreException("Failed to write keystore " + path, e);
        }
    }

    private void moveIntoPlace(Path temp) throws IOException {
        try {
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
