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

@DisplayName("AtUri")
class AtUriTest {

    private static final String DID = "did:plc:ewvi7nxzyoun6zhxrhs64oiz";

    @Test
    @DisplayName("parses authority, collection, record key and fragment")
    void parsesParts() {
        AtUri uri = AtUri.parse("at://" + DID + "/app.bsky.feed.post/3kkqvzbva22jz#/text");

        assertThat(uri.authority().did()).map(Did::method).contains("plc");
        assertThat(uri.collection()).map(Nsid::toString).contains("app.bsky.feed.post");
        assertThat(uri.recordKey()).map(RecordKey::toString).contains("3kkqvzbva22jz");
        assertThat(uri.fragment()).contains("/text");
    }

    @Test
    @DisplayName("repository-only URI canonicalizes its handle")
    void canonicalizesHandle() {
        AtUri uri = AtUri.parse("at://Alice.Example.com");

        assertThat(uri.toString()).isEqualTo("at://alice.example.com");
        assertThat(uri.collection()).isEmpty();
        assertThat(uri.authority().handle()).isPresent();
    }

    static Stream<Arguments> invalidUris() {
        return Stream.of(
                Arguments.of("http://alice.example.com", FormatError.AT_URI_BAD_SCHEME),
                Arguments.of("at://alice.example.com/", FormatError.AT_URI_MALFORMED),
                Arguments.of("at://alice.example.com?x=1", FormatError.AT_URI_MALFORMED),
                Arguments.of("at://alice.example.com/app.bsky.feed.post/a/b", FormatError.AT_URI_MALFORMED),
                Arguments.of("at://alice.example.com#frag", FormatError.AT_URI_MALFORMED),
                Arguments.of("at://not_a_handle", FormatError.AT_URI_BAD_AUTHORITY),
                Arguments.of("at://alice.example.com/notnsid", FormatError.AT_URI_BAD_COLLECTION),
                Arguments.of("at://alice.example.com/app.bsky.feed.post/..", FormatError.AT_URI_BAD_RECORD_KEY));
    }

    @ParameterizedTest
    @MethodSource("invalidUris")
    @DisplayName("rejects invalid URIs with the specific rule")
    void rejectsInvalid(String raw, FormatError expected) {
        assertThatThrownBy(() -> AtUri.parse(raw))
                .isInstanceOf(InvalidFormatException.class)
                .extracting(e -> ((InvalidFormatException) e).error())
                .isEqualTo(expected);
    }

    @Test
    @DisplayName("applies the DID policy to the authority")
    void appliesDidPolicy() {
        Did.Policy webOnly = new Did.Policy(2048, Set.of("web"));

        assertThatThrownBy(() -> AtUri.parse("at://" + DID, true, webOnly))
                .isInstanceOf(InvalidFormatException.class)
                .extracting(e -> ((InvalidFormatException) e).error())
                .isEqualTo(FormatError.AT_URI_BAD_AUTHORITY);
    }
}
