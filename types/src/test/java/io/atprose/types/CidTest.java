package io.atprose.types;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.Locale;
import java.util.stream.Stream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

@DisplayName("Cid")
class CidTest {

    /** dag-cbor, sha2-256 of "hello". */
    private static final String DAG_CBOR = "bafyreibm6jg3ux5qumhcn2b3flc3tyu6dmlb4xa7u5bf44yegnrjhc4yeq";

    private static final String RAW = "bafkreibm6jg3ux5qumhcn2b3flc3tyu6dmlb4xa7u5bf44yegnrjhc4yeq";
    private static final String V0 = "QmRN6wdp1S2A5EtjW9A3M1vKSBuQQGcgvuhoMUoEz4iiT5";
    private static final String DAG_CBOR_BASE58 = "zdpuAoStiTAjdepMR7C7uVZUpQNChA2kLDmMMj1faemPzZwMu";

    @Nested
    @DisplayName("parsing")
    class Parsing {

        @Test
        @DisplayName("decodes a base32 CIDv1")
        void decodesV1() {
            Cid cid = Cid.parse(DAG_CBOR);

            assertThat(cid.version()).isEqualTo(1);
            assertThat(cid.codec()).isEqualTo(Cid.CODEC_DAG_CBOR);
            assertThat(cid.hashFunction()).isEqualTo(Cid.HASH_SHA2_256);
            assertThat(cid.toString()).isEqualTo(DAG_CBOR);
        }

        @Test
        @DisplayName("decodes a CIDv0 and keeps its base58 form")
        void decodesV0() {
            Cid cid = Cid.parse(V0);

            assertThat(cid.version()).isZero();
            assertThat(cid.codec()).isEqualTo(Cid.CODEC_DAG_PB);
            assertThat(cid.toString()).isEqualTo(V0);
        }

        @Test
        @DisplayName("other multibase encodings compare equal and canonicalize to base32")
        void otherEncodingsCanonicalize() {
            Cid canonical = Cid.parse(DAG_CBOR);
            String hex = "f" + HexFormat.of().formatHex(canonical.toBytes());

            assertThat(Cid.parse(DAG_CBOR_BASE58)).isEqualTo(canonical);
            assertThat(Cid.parse(DAG_CBOR_BASE58).toString()).isEqualTo(DAG_CBOR);
            assertThat(Cid.parse("B" + DAG_CBOR.substring(1).toUpperCase(Locale.ROOT))).isEqualTo(canonical);
            assertThat(Cid.parse(hex)).isEqualTo(canonical);
        }

        @Test
        @DisplayName("codec participates in equality")
        void codecMatters() {
            assertThat(Cid.parse(RAW)).isNotEqualTo(Cid.parse(DAG_CBOR));
            assertThat(Cid.parse(RAW).codec()).isEqualTo(Cid.CODEC_RAW);
        }

        @Test
        @DisplayName("building from a digest yields the same CID")
        void buildsFromDigest() throws Exception {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest("hello".getBytes(StandardCharsets.UTF_8));

            assertThat(Cid.of(Cid.CODEC_DAG_CBOR, Cid.HASH_SHA2_256, digest)).isEqualTo(Cid.parse(DAG_CBOR));
            assertThat(Cid.fromBytes(Cid.parse(DAG_CBOR).toBytes()).toString()).isEqualTo(DAG_CBOR);
        }
    }

    static Stream<Arguments> invalidCids() {
        return Stream.of(
                Arguments.of("", FormatError.CID_EMPTY),
                Arguments.of("xafyreib", FormatError.BAD_MULTIBASE_PREFIX),
                Arguments.of("b!!!!", FormatError.INVALID_MULTIBASE_ENCODING),
                Arguments.of("bAFYREIBM6JG3UX5QUMHCN2B3FLC3TYU6DMLB4XA7U5BF44YEGNRJHC4YEQ", FormatError.INVALID_MULTIBASE_ENCODING),
                Arguments.of("bafyreibm6jg3ux5qumhcn2b3flc3tyu6dmlb4xa7u5bf44yegnrjhc4y", FormatError.CID_TRUNCATED),
                Arguments.of("bajyreibm6jg3ux5qumhcn2b3flc3tyu6dmlb4xa7u5bf44yegnrjhc4yeq", FormatError.UNSUPPORTED_CID_VERSION),
                Arguments.of("bafyreebm6jg3ux5qumhcn2b3flc3tyu6", FormatError.DIGEST_LENGTH_MISMATCH),
                Arguments.of("bafyreibm6jg3ux5qumhcn2b3flc3tyu6dmlb4xa7u5bf44yegnrjhc4yeqaa", FormatError.CID_TRAILING_BYTES));
    }

    @ParameterizedTest
    @MethodSource("invalidCids")
    @DisplayName("rejects invalid CIDs with the specific rule")
    void rejectsInvalid(String raw, FormatError expected) {
        assertThatThrownBy(() -> Cid.parse(raw))
                .isInstanceOf(InvalidFormatException.class)
                .extracting(e -> ((InvalidFormatException) e).error())
                .isEqualTo(expected);
    }
}
