package com.agentrelay.common.infra;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Set;

/**
 * JSON file save with owner-only permissions and atomic replace.
 */
public final class JsonFile {

    private JsonFile() {
    }

    /**
     * Write {@code data} as pretty JSON to {@code path}: temp file, then move over the target.
     */
    public static void save(ObjectMapper mapper, Path path, Object data) throws IOException {
        Path dir = path.toAbsolutePath().getParent();
        if (dir != null && !Files.exists(dir)) {
            Files.createDirectories(dir);
        }
        Path tempFile = path.resolveSibling(path.getFileName() + ".tmp");
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(data) + "\n";
        Files.writeString(tempFile, json, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING,
                StandardOpenOption.WRITE);
        restrictPermissions(tempFile);
        try {
            Files.move(tempFile, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            Files.move(tempFile, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /**
     * Read a file as UTF-8, or null when it does not exist or is blank.
     */
    public static String readIfPresent(Path path) throws IOException {
        if (!Files.exists(path)) {
            return null;
        }
        String raw = Files.readString(path, StandardCharsets.UTF_8);
        return raw.isBlank() ? null : raw;
    }

    private static void restrictPermissions(Path path) throws IOException {
        try {
            Set<PosixFilePermission> perms = PosixFilePermissions.fromString("rw-------");
            Files.setPosixFilePermissions(path, perms);
        } catch (UnsupportedOperationException ignored) {
            // Non-POSIX file system
        }
    }
}
