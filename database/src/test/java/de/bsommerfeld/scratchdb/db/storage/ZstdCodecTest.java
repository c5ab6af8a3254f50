package de.bsommerfeld.scratchdb.db.storage;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ZstdCodecTest {

    @TempDir
    Path tempDir;

    @Test
    void constructor_shouldClampLevel() {
        assertEquals(1, new ZstdCodec(0).level());
        assertEquals(22, new ZstdCodec(25).level());
        assertEquals(3, new ZstdCodec(3).level());
    }

    @Test
    void compress_shouldShrinkRepetitiveContentAndRestoreIt() throws IOException {
        Path source = tempDir.resolve("state.db");
        Path archive = tempDir.resolve("state.db.zst");
        Path restored = tempDir.resolve("restored.db");
        Files.writeString(source, "row,".repeat(10_000));

        ZstdCodec codec = new ZstdCodec(3);
        codec.compress(source, archive);
        codec.decompress(Files.newInputStream(archive), restored);

        assertTrue(Files.size(archive) < Files.size(source) / 10);
        assertEquals(Files.readString(source), Files.readString(restored));
    }

    @Test
    void decompress_shouldFailOnGarbage() {
        ZstdCodec codec = new ZstdCodec(3);

        assertThrows(IOException.class, () -> codec.decompress(
                new ByteArrayInputStream("definitely not zstd".getBytes()), tempDir.resolve("out.db")));
    }

    @Test
    void archiveKey_shouldShardByHexPrefix() {
        assertEquals("agent_state/12/34/1234abcd-0000-0000-0000-000000000000.db.zst",
                StorageKeys.archiveKey("agent_state", "1234abcd-0000-0000-0000-000000000000"));
    }
}
