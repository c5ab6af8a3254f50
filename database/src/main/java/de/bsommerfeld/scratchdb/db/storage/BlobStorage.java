package de.bsommerfeld.scratchdb.db.storage;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;

/**
 * Object storage for scratch database archives. Keys are slash-separated
 * relative paths such as {@code agent_state/ab/cd/<id>.db.zst}.
 *
 * <p>
 * Writes replace the whole object. There is no append and no versioning.
 */
public interface BlobStorage {

    boolean exists(String key) throws IOException;

    /**
     * Opens the object for reading. The caller closes the stream.
     *
     * @throws java.nio.file.NoSuchFileException if the key does not exist
     */
    InputStream open(String key) throws IOException;

    /** Stores the content of {@code source} under {@code key}, replacing any previous object. */
    void put(String key, Path source) throws IOException;

    /** Deletes the object. A missing key is not an error. */
    void delete(String key) throws IOException;
}
