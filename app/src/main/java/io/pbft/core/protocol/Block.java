package io.pbft.core.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * A ledger entry: opaque payload, creation time (epoch seconds), and a link to the previous block.
 * hash = hex(SHA-256(data || decimal(timestamp) || prevHash)).
 *
 * Blocks built through {@link #create} always carry a consistent hash. The public constructor
 * takes the hash as given so that blocks received from peers can be represented and then checked
 * with {@link #hasValidHash()}.
 */
public final class Block {
    private final byte[] data;
    private final long timestamp;
    private final String prevHash;
    private final String hash;

    @JsonCreator
    public Block(@JsonProperty("data") byte[] data,
                 @JsonProperty("timestamp") long timestamp,
                 @JsonProperty("prevHash") String prevHash,
                 @JsonProperty("hash") String hash) {
        this.data = data != null ? data.clone() : new byte[0];
        this.timestamp = timestamp;
        this.prevHash = Objects.requireNonNull(prevHash, "prevHash");
        this.hash = Objects.requireNonNull(hash, "hash");
    }

    public static Block create(byte[] data, long timestamp, String prevHash) {
        byte[] payload = data != null ? data : new byte[0];
        return new Block(payload, timestamp, prevHash, computeHash(payload, timestamp, prevHash));
    }

    public static Block create(String data, long timestamp, String prevHash) {
        return create(data.getBytes(StandardCharsets.UTF_8), timestamp, prevHash);
    }

    /** Stamped with the current wall clock (seconds). */
    public static Block create(String data, String prevHash) {
        return create(data, Instant.now().getEpochSecond(), prevHash);
    }

    public static String computeHash(byte[] data, long timestamp, String prevHash) {
        return Hashes.sha256Hex(
                data,
                Long.toString(timestamp).getBytes(StandardCharsets.UTF_8),
                prevHash.getBytes(StandardCharsets.UTF_8));
    }

    @JsonProperty("data")
    public byte[] data() { return data.clone(); }

    @JsonProperty("timestamp")
    public long timestamp() { return timestamp; }

    @JsonProperty("prevHash")
    public String prevHash() { return prevHash; }

    @JsonProperty("hash")
    public String hash() { return hash; }

    public String dataAsString() { return new String(data, StandardCharsets.UTF_8); }

    public boolean hasValidHash() {
        return hash.equals(computeHash(data, timestamp, prevHash));
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Block)) return false;
        Block other = (Block) o;
        return timestamp == other.timestamp
                && Arrays.equals(data, other.data)
                && prevHash.equals(other.prevHash)
                && hash.equals(other.hash);
    }

    @Override public int hashCode() {
        return Objects.hash(Arrays.hashCode(data), timestamp, prevHash, hash);
    }

    @Override public String toString() {
        return "Block{data=" + dataAsString() + ", ts=" + timestamp + ", hash=" + Hashes.shortHex(hash) + "}";
    }
}
