package io.atprose.types;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Set;
import java.util.stream.Stream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("Did")
class DidTest {

    @ParameterizedTest
    @ValueSource(
            strings = {
                "did:plc:ewvi7nxzyoun6zhxrhs64oiz",
                "did:web:bsky.app",
                "did:web:localhost%3A8080",
                "did:key:z6MkhaXgBZDvotDkL5257faiztiGiC2QtKLGpbnnEGta2doK",
                "did:example:abc:def",
                "did:example:caf%C3%A9"
            })
    @DisplayName("accepts valid DIDs")
    void acceptsValidDids(String raw) {
        assertThat(Did.parse(raw).toString()).isEqualTo(raw);
    }

    static Stream<Arguments> invalidDids() {
        return Stream.of(
                Arguments.of("plc:ewvi7nxzyoun6zhxrhs64oiz", FormatError.DID_MISSING_PREFIX),
                Arguments.of("did:PLC:ewvi7nxzyoun6zhxrhs64oiz", FormatError.DID_BAD_METHOD),
                Arguments.of("did::abc", FormatError.DID_BAD_METHOD),
                Arguments.of("did:example", FormatError.DID_BAD_METHOD),
                Arguments.of("did:example:", FormatError.DID_EMPTY_IDENTIFIER),
                Arguments.of("did:example:abc:", FormatError.DID_TRAILING_COLON),
                Arguments.of("did:example:a b", FormatError.DID_INVALID_CHARACTER),
                Arguments.of("did:example:a%zz", FormatError.DID_BAD_PERCENT_ESCAPE),
                Arguments.of("did:example:a%4", FormatError.DID_BAD_PERCENT_ESCAPE),
                Arguments.of("did:example:%C3%28", FormatError.DID_BAD_PERCENT_ESCAPE),
                Arguments.of("did:plc:short", FormatError.DID_PLC_MALFORMED),
                Arguments.of("did:plc:EWVI7NXZYOUN6ZHXRHS64OIZ", FormatError.DID_PLC_MALFORMED),
                Arguments.of("did:web:under_score.com", FormatError.DID_WEB_MALFORMED),
                Arguments.of("did:web:example.com%3Aport", FormatError.DID_WEB_MALFORMED),
                Arguments.of("did:web:example.com%3A%D9%A1", FormatError.DID_WEB_MALFORMED));
    }

    @ParameterizedTest
    @MethodSource("invalidDids")
    @DisplayName("rejects invalid DIDs with the specific rule")
    void rejectsInvalidDids(String raw, FormatError expected) {
        assertThatThrownBy(() -> Did.parse(raw))
                .isInstanceOf(InvalidFormatException.class)
                .extracting(e -> ((InvalidFormatException) e).error())
                .isEqualTo(expected);
    }

    @Test
    @DisplayName("enforces the length ceiling")
    void enforcesLengthCeiling() {
        String raw = "did:example:" + "a".repeat(Did.DEFAULT_MAX_LENGTH);

        assertThatThrownBy(() -> Did.parse(raw))
                .isInstanceOf(InvalidFormatException.class)
                .extracting(e -> ((InvalidFormatException) e).error())
                .isEqualTo(FormatError.DID_TOO_LONG);
    }

    @Test
    @DisplayName("restricts methods when a registered set is configured")
    void restrictsMethods() {
        Did.Policy policy = new Did.Policy(256, Set.of("plc", "web"));

        assertThat(Did.parse("did:web:bsky.app", policy).method()).isEqualTo("web");
        assertThatThrownBy(() -> Did.parse("did:key:z6Mk", policy))
                .isInstanceOf(InvalidFormatException.class)
                .extracting(e -> ((InvalidFormatException) e).error())
                .isEqualTo(FormatError.DID_METHOD_NOT_ALLOWED);
    }

    @Test
    @DisplayName("exposes method and percent-decoded identifier")
    void exposesParts() {
        Did did = Did.parse("did:example:caf%C3%A9");

        assertThat(did.method()).isEqualTo("example");
        assertThat(did.identifier()).isEqualTo("caf%C3%A9");
        assertThat(did.decodedIdentifier()).isEqualTo("café");
    }
}
