package io.meshgraph.export;

import com.fasterxml.jackson.databind.JsonNode;
import io.meshgraph.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Set;

/**
 * Writes artifacts through a temp file in the target directory followed by an atomic
 * rename, so readers only ever see a complete previous or complete new file. Artifacts
 * are world-readable since the web front end usually runs as another user.
 */
public final class ArtifactWriter {
    private static final Logger log = LoggerFactory.getLogger(ArtifactWriter.class);
    static final Set<PosixFilePermission> ARTIFACT_PERMISSIONS = PosixFilePermissions.fromString("rw-r--r--");

    private ArtifactWriter() {
    }

    public static Path writeJson(Path target, JsonNode content) {
        return writeText(target, Jsons.toJson(content) + "\n");
    }

    public static Path writeText(Path target, String content) {
        Path dir = target.toAbsolutePath().getParent();
        Path tmp = null;
        try {
            Files.createDirectories(dir);
            tmp = Files.createTempFile(dir, "." + target.getFileName(), ".tmp");
            Files.writeString(tmp, content, StandardCharsets.UTF_8);
            if (Files.getFileAttributeView(tmp, PosixFileAttributeView.class) != null) {
                Files.setPosixFilePermissions(tmp, ARTIFACT_PERMISSIONS);
            }
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move unsupported in {}, falling back to replace", dir);
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            return target;
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new UncheckedIOException("Failed to write " + target, e);
        }
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("Could not remove temp file {}: {}", tmp, e.getMessage());
        }
    }
}
