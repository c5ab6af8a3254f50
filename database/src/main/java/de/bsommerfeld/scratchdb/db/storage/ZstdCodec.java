package de.bsommerfeld.scratchdb.db.storage;

import com.github.luben.zstd.ZstdInputStream;
import com.github.luben.zstd.ZstdOutputStream;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Zstandard compression for scratch database archives, using zstd-jni.
 * Levels outside 1..22 are clamped.
 */
public class ZstdCodec {

    static final int MIN_LEVEL = 1;
    static final int MAX_LEVEL = 22;
    static final String FILE_EXTENSION = ".zst";

    private final int level;

    public ZstdCodec(int level) {
        this.level = Math.max(MIN_LEVEL, Math.min(MAX_LEVEL, level));
    }

    public int level() {
        return level;
    }

    /** Compresses {@code source} into {@code target}, replacing it. */
    public void compress(Path source, Path target) throws IOException {
        try (InputStream in = Files.newInputStream(source);
                OutputStream out = new ZstdOutputStream(Files.newOutputStream(target), level)) {
            in.transferTo(out);
        }
    }

    /** Decompresses the stream into {@code target}, replacing it. The stream is closed. */
    public void decompress(InputStream compressed, Path target) throws IOException {
        try (InputStream in = new ZstdInputStream(compressed)) {
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
