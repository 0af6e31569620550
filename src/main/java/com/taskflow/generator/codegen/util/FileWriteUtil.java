package com.taskflow.generator.codegen.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Utility for safe file operations with automatic directory creation.
 */
public class FileWriteUtil {

    private FileWriteUtil() {
        // Utility class
    }

    /**
     * Writes content to a file, creating parent directories if needed.
     *
     * <p>The content goes to a sibling temp file first and is then moved over the
     * target, so readers never see a half-written file.
     */
    public static void safeWriteString(Path filePath, String content) throws IOException {
        Path parentDir = filePath.toAbsolutePath().getParent();
        Files.createDirectories(parentDir);

        Path temp = Files.createTempFile(parentDir, "." + filePath.getFileName(), ".tmp");
        try {
            Files.writeString(temp, content, StandardCharsets.UTF_8);
            try {
                Files.move(temp, filePath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, filePath, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    /**
     * Writes content only when the file does not exist yet.
     *
     * @return true if the file was created
     */
    public static boolean writeIfAbsent(Path filePath, String content) throws IOException {
        if (Files.exists(filePath)) {
            return false;
        }
        safeWriteString(filePath, content);
        return true;
    }
}
