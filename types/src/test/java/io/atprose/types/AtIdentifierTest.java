package io.atprose.types;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("AtIdentifier")
class AtIdentifierTest {

    @Test
    @DisplayName("input with the did: prefix parses as a DID")
    void parsesDid() {
        AtIdentifier id = AtIdentifier.parse("did:web:bsky.app");

        assertThat(id.did()).isPresent();
        assertThat(id.handle()).isEmpty();
    }

    @Test
    @DisplayName("anything else parses as a handle")
    void parsesHandle() {
        AtIdentifier id = AtIdentifier.parse("Jay.Bsky.Social");

        assertThat(id.handle()).isPresent();
        assertThat(id.toString()).isEqualTo("jay.bsky.social");
    }

    @Test
    @DisplayName("reports the DID rule that failed")
    void reportsDidError() {
        assertThatThrownBy(() -> AtIdentifier.parse("did:plc:short"))
                .isInstanceOf(InvalidFormatException.class)
                .extracting(e -> ((InvalidFormatException) e).error())
                .isEqualTo(FormatError.DID_PLC_MALFORMED);
    }

    @Test
    @DisplayName("lenient handles accept a bare hostname")
    void lenientHandles() {
        assertThat(AtIdentifier.parse("localhost", false, Did.Policy.DEFAULT).toString()).isEqualTo("localhost");
        assertThatThrownBy(() -> AtIdentifier.parse("localhost"))
                .isInstanceOf(InvalidFormatException.class)
                .extracting(e -> ((InvalidFormatException) e).error())
                .isEqualTo(FormatError.HANDLE_SINGLE_LABEL);
    }
}
