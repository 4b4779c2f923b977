package com.imageanalysis.shared.store;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * File helpers for the local stores: a write goes to a temp file that is then
 * moved over the target, so readers see the old or the new content, never a mix.
 */
final class JsonFiles {

    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9._-]+");

    private JsonFiles() {
    }

    static Path fileFor(Path directory, String id) {
        if (id == null || !SAFE_ID.matcher(id).matches() || id.startsWith(".")) {
            throw new IllegalArgumentException("Invalid record id: " + id);
        }
        return directory.resolve(id + ".json");
    }

    static void writeAtomically(Path target, String content) throws IOException {
        Path temp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
        try {
            Files.writeString(temp, content, StandardCharsets.UTF_8);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    static Optional<String> read(Path file) throws IOException {
        try {
            return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        }
    }

    static boolean isRecordFile(Path file) {
        String name = file.getFileName().toString();
        return name.endsWith(".json") && Files.isRegularFile(file);
    }
}
