package de.bsommerfeld.scratchdb.db.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.UUID;

/**
 * {@link BlobStorage} on a local directory.
 *
 * <p>
 * Puts are atomic: the content is copied to {@code <name>.<uuid>.tmp} next
 * to the target and then moved over it, so readers never see a half-written
 * archive. Keys are validated against path traversal.
 */
public class FileSystemBlobStorage implements BlobStorage {

    private static final Logger LOG = LoggerFactory.getLogger(FileSystemBlobStorage.class);

    private final Path root;

    public FileSystemBlobStorage(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    public Path root() {
        return root;
    }

    @Override
    public boolean exists(String key) {
        return Files.isRegularFile(resolve(key));
    }

    @Override
    public InputStream open(String key) throws IOException {
        return Files.newInputStream(resolve(key));
    }

    @Override
    public void put(String key, Path source) throws IOException {
        Path target = resolve(key);
        Path parent = target.getParent();
        Files.createDirectories(parent);

        Path temp = parent.resolve(target.getFileName() + "." + UUID.randomUUID() + ".tmp");
        Files.copy(source, temp, StandardCopyOption.REPLACE_EXISTING);
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException cleanupFailure) {
                LOG.warn("Failed to clean up temp file after move failure: {}", temp, cleanupFailure);
            }
            throw e;
        }
        LOG.debug("Stored blob {} ({} bytes)", key, Files.size(target));
    }

    @Override
    public void delete(String key) throws IOException {
        if (Files.deleteIfExists(resolve(key)))
            LOG.debug("Deleted blob {}", key);
    }

    private Path resolve(String key) {
        validateKey(key);
        Path resolved = root.resolve(key).normalize();
        if (!resolved.startsWith(root))
            throw new IllegalArgumentException("Key escapes the storage root: " + key);
        return resolved;
    }

    static void validateKey(String key) {
        if (key == null || key.isEmpty())
            throw new IllegalArgumentException("Key cannot be null or empty");
        if (key.contains(".."))
            throw new IllegalArgumentException("Key cannot contain '..': " + key);
        if (key.startsWith("/") || key.startsWith("\\"))
            throw new IllegalArgumentException("Key cannot be an absolute path: " + key);
        if (key.length() >= 2 && key.charAt(1) == ':')
            throw new IllegalArgumentException("Key cannot contain a drive letter: " + key);
    }
}
