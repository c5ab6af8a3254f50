package de.bsommerfeld.scratchdb.db.storage;

/**
 * Deterministic archive keys. The first two pairs of hex digits of the
 * agent id shard the key space:
 * {@code <prefix>/<hex[0:2]>/<hex[2:4]>/<agentId>.db.zst}.
 */
public final class StorageKeys {

    private StorageKeys() {
    }

    public static String archiveKey(String prefix, String agentId) {
        String clean = agentId.replace("-", "");
        String first = clean.substring(0, Math.min(2, clean.length()));
        String second = clean.length() > 2 ? clean.substring(2, Math.min(4, clean.length())) : "";
        return prefix + "/" + first + "/" + second + "/" + agentId + ".db" + ZstdCodec.FILE_EXTENSION;
    }
}
