package io.atprose.types;

import io.atprose.types.encoding.Base32;
import io.atprose.types.encoding.Base58;
import java.io.ByteArrayOutputStream;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Map;

/**
 * A content identifier: a self-describing reference to content by hash.
 *
 * <p>
 * Accepted string forms are CIDv0 (46 characters of base58btc starting with
 * {@code Qm}) and CIDv1 with multibase prefix {@code b}/{@code B} (base32),
 * {@code z} (base58btc) or {@code f}/{@code F} (base16). The multihash digest
 * length must equal the declared length and, for known hash functions, the
 * function's fixed digest size.
 *
 * <p>
 * Equality is structural over version, codec and multihash bytes, so the
 * same CIDv1 written in different multibases compares equal. The canonical
 * string form is base58btc for v0 and lowercase base32 for v1.
 */
public final class Cid {

    /** Codec implied by CIDv0. */
    public static final long CODEC_DAG_PB = 0x70;

    public static final long CODEC_RAW = 0x55;
    public static final long CODEC_DAG_CBOR = 0x71;

    public static final long HASH_SHA2_256 = 0x12;

    private static final Map<Long, Integer> DIGEST_SIZES = Map.of(
            0x11L, 20, // sha1
            0x12L, 32, // sha2-256
            0x13L, 64, // sha2-512
            0x16L, 32, // sha3-256
            0x14L, 64, // sha3-512
            0x1bL, 32, // keccak-256
            0x1eL, 32, // blake3
            0x56L, 32, // dbl-sha2-256
            0xb220L, 32 // blake2b-256
            );

    private final int version;
    private final long codec;
    private final long hashFunction;
    private final byte[] multihash;

    private Cid(int version, long codec, long hashFunction, byte[] multihash) {
        this.version = version;
        this.codec = codec;
        this.hashFunction = hashFunction;
        this.multihash = multihash;
    }

    /**
     * Parses a CID string.
     *
     * @throws InvalidFormatException if the CID is invalid
     */
    public static Cid parse(String raw) {
        if (raw == null || raw.isEmpty()) {
            throw new InvalidFormatException(FormatError.CID_EMPTY, raw);
        }
        if (raw.length() == 46 && raw.startsWith("Qm")) {
            byte[] multihash = decode(() -> Base58.decode(raw), raw);
            long hash = checkMultihash(multihash, 0, raw);
            return new Cid(0, CODEC_DAG_PB, hash, multihash);
        }
        char prefix = raw.charAt(0);
        String payload = raw.substring(1);
        byte[] bytes = switch (prefix) {
            case 'b' -> decode(() -> Base32.RFC4648_LOWER.decode(payload), raw);
            case 'B' -> decode(() -> Base32.RFC4648_LOWER.decode(payload.toLowerCase(Locale.ROOT)), raw);
            case 'z' -> decode(() -> Base58.decode(payload), raw);
            case 'f', 'F' -> decode(() -> HexFormat.of().parseHex(payload), raw);
            default -> throw new InvalidFormatException(FormatError.BAD_MULTIBASE_PREFIX, raw);
        };
        return fromBytes(bytes, raw);
    }

    /**
     * Decodes the binary form of a CIDv1.
     *
     * @throws InvalidFormatException if the bytes are not a valid CIDv1
     */
    public static Cid fromBytes(byte[] bytes) {
        return fromBytes(bytes, HexFormat.of().formatHex(bytes));
    }

    /** Builds a CIDv1 from a codec and a multihash. */
    public static Cid of(long codec, long hashFunction, byte[] digest) {
        ByteArrayOutputStream multihash = new ByteArrayOutputStream();
        writeVarint(multihash, hashFunction);
        writeVarint(multihash, digest.length);
        multihash.writeBytes(digest);
        byte[] bytes = multihash.toByteArray();
        checkMultihash(bytes, 0, "cid");
        return new Cid(1, codec, hashFunction, bytes);
    }

    /** Returns {@code true} if {@code raw} parses. */
    public static boolean isValid(String raw) {
        try {
            parse(raw);
            return true;
        } catch (InvalidFormatException e) {
            return false;
        }
    }

    private static Cid fromBytes(byte[] bytes, String raw) {
        int[] cursor = {0};
        long version = readVarint(bytes, cursor, raw);
        if (version != 1) {
            throw new InvalidFormatException(FormatError.UNSUPPORTED_CID_VERSION, raw);
        }
        long codec = readVarint(bytes, cursor, raw);
        byte[] multihash = Arrays.copyOfRange(bytes, cursor[0], bytes.length);
        long hash = checkMultihash(multihash, 0, raw);
        return new Cid(1, codec, hash, multihash);
    }

    /** Validates a multihash occupying the whole array and returns its hash function code. */
    private static long checkMultihash(byte[] multihash, int offset, String raw) {
        int[] cursor = {offset};
        long hash = readVarint(multihash, cursor, raw);
        long length = readVarint(multihash, cursor, raw);
        long remaining = multihash.length - cursor[0];
        if (remaining < length) {
            throw new InvalidFormatException(FormatError.CID_TRUNCATED, raw);
        }
        if (remaining > length) {
            throw new InvalidFormatException(FormatError.CID_TRAILING_BYTES, raw);
        }
        Integer expected = DIGEST_SIZES.get(hash);
        if (expected != null && expected != length) {
            throw new InvalidFormatException(FormatError.DIGEST_LENGTH_MISMATCH, raw);
        }
        return hash;
    }

    private static long readVarint(byte[] bytes, int[] cursor, String raw) {
        long value = 0;
        for (int shift = 0; shift < 63; shift += 7) {
            if (cursor[0] >= bytes.length) {
                throw new InvalidFormatException(FormatError.CID_TRUNCATED, raw);
            }
            int b = bytes[cursor[0]++] & 0xFF;
            value |= (long) (b & 0x7F) << shift;
            if ((b & 0x80) == 0) {
                return value;
            }
        }
        throw new InvalidFormatException(FormatError.INVALID_MULTIBASE_ENCODING, raw);
    }

    private static void writeVarint(ByteArrayOutputStream out, long value) {
        long remaining = value;
        while ((remaining & ~0x7FL) != 0) {
            out.write((int) ((remaining & 0x7F) | 0x80));
            remaining >>>= 7;
        }
        out.write((int) remaining);
    }

    private interface Decoder {
        byte[] decode();
    }

    private static byte[] decode(Decoder decoder, String raw) {
        try {
            return decoder.decode();
        } catch (IllegalArgumentException e) {
            throw new InvalidFormatException(FormatError.INVALID_MULTIBASE_ENCODING, raw);
        }
    }

    /** CID version, 0 or 1. */
    public int version() {
        return version;
    }

    /** Multicodec of the addressed content. */
    public long codec() {
        return codec;
    }

    /** Multihash function code. */
    public long hashFunction() {
        return hashFunction;
    }

    /** A copy of the multihash bytes (function code, length, digest). */
    public byte[] multihash() {
        return multihash.clone();
    }

    /** The binary CID. CIDv0 is its bare multihash. */
    public byte[] toBytes() {
        if (version == 0) {
            return multihash.clone();
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream(multihash.length + 4);
        writeVarint(out, version);
        writeVarint(out, codec);
        out.writeBytes(multihash);
        return out.toByteArray();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Cid other
                && version == other.version
                && codec == other.codec
                && Arrays.equals(multihash, other.multihash);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * version + Long.hashCode(codec)) + Arrays.hashCode(multihash);
    }

    @Override
    public String toString() {
        return version == 0 ? Base58.encode(multihash) : "b" + Base32.RFC4648_LOWER.encode(toBytes());
    }
}
