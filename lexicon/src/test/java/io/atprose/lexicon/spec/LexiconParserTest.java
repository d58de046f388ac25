package io.atprose.lexicon.spec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.atprose.lexicon.error.DuplicateDefinitionException;
import io.atprose.lexicon.error.LexiconException;
import io.atprose.lexicon.error.LexiconParseException;
import io.atprose.lexicon.error.UnsupportedLexiconVersionException;
import io.atprose.lexicon.model.LexiconDocument;
import io.atprose.lexicon.testkit.Fixtures;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link LexiconParser}: document shape, version gate, duplicate definitions and the
 * error types raised for malformed input.
 */
@DisplayName("LexiconParser")
class LexiconParserTest {

    private final LexiconParser parser = new LexiconParser();

    @Nested
    @DisplayName("Valid documents")
    class ValidDocuments {

        @Test
        @DisplayName("post fixture → id, version, description and defs in file order")
        void parsePostFixture() {
            Path path = Fixtures.lexiconPath("dev.atprose.test.post");

            LexiconDocument doc = parser.parse(path);

            assertThat(doc.version()).isEqualTo(1);
            assertThat(doc.id().toString()).isEqualTo("dev.atprose.test.post");
            assertThat(doc.description()).isEqualTo("A short text post.");
            assertThat(doc.revision()).isNull();
            assertThat(doc.defs()).containsOnlyKeys("main", "body");
            assertThat(doc.defs().keySet()).containsExactly("main", "body");
            assertThat(doc.source()).isEqualTo(path.toString());
        }

        @Test
        @DisplayName("revision is read when present")
        void revisionIsRead() {
            LexiconDocument doc = Fixtures.lexicon("dev.atprose.test.status");

            assertThat(doc.revision()).isEqualTo(2);
        }

        @Test
        @DisplayName("stream input parses like text")
        void streamInput() {
            String json = """
                    {"lexicon": 1, "id": "dev.atprose.test.tiny", "defs": {"main": {"type": "token"}}}
                    """;

            LexiconDocument doc =
                    parser.parse(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)), "stream");

            assertThat(doc.id().toString()).isEqualTo("dev.atprose.test.tiny");
            assertThat(doc.source()).isEqualTo("stream");
        }

        @Test
        @DisplayName("defs are immutable")
        void defsAreImmutable() {
            LexiconDocument doc = Fixtures.lexicon("dev.atprose.test.post");

            assertThatThrownBy(() -> doc.defs().remove("main")).isInstanceOf(UnsupportedOperationException.class);
        }
    }

    @Nested
    @DisplayName("Version gate")
    class VersionGate {

        @Test
        @DisplayName("lexicon 2 → UnsupportedLexiconVersionException")
        void versionTwoRejected() {
            String json = """
                    {"lexicon": 2, "id": "dev.atprose.test.v2", "defs": {"main": {"type": "token"}}}
                    """;

            assertThatThrownBy(() -> parser.parse(json, "v2.json"))
                    .isInstanceOf(UnsupportedLexiconVersionException.class)
                    .satisfies(e -> {
                        var ex = (UnsupportedLexiconVersionException) e;
                        assertThat(ex.version()).isEqualTo(2);
                        assertThat(ex.documentId()).isEqualTo("dev.atprose.test.v2");
                        assertThat(ex.phase()).isEqualTo(LexiconException.Phase.LOAD);
                    });
        }

        @Test
        @DisplayName("missing lexicon field → shape error")
        void missingVersionRejected() {
            String json = """
                    {"id": "dev.atprose.test.noversion", "defs": {"main": {"type": "token"}}}
                    """;

            assertThatThrownBy(() -> parser.parse(json, "noversion.json"))
                    .isInstanceOf(LexiconParseException.class)
                    .hasMessageContaining("lexicon");
        }

        @Test
        @DisplayName("string version → shape error, not a version error")
        void stringVersionRejected() {
            String json = """
                    {"lexicon": "1", "id": "dev.atprose.test.strver", "defs": {"main": {"type": "token"}}}
                    """;

            assertThatThrownBy(() -> parser.parse(json, "strver.json")).isInstanceOf(LexiconParseException.class);
        }
    }

    @Nested
    @DisplayName("Duplicate keys")
    class DuplicateKeys {

        @Test
        @DisplayName("definition name repeated under defs → DuplicateDefinitionException")
        void duplicateDefinition() {
            String json = """
                    {
                      "lexicon": 1,
                      "id": "dev.atprose.test.dup",
                      "defs": {
                        "thing": {"type": "string"},
                        "thing": {"type": "integer"}
                      }
                    }
                    """;

            assertThatThrownBy(() -> parser.parse(json, "dup.json"))
                    .isInstanceOf(DuplicateDefinitionException.class)
                    .hasMessageContaining("thing")
                    .satisfies(e -> assertThat(((DuplicateDefinitionException) e).definitionPath())
                            .isEqualTo("thing"));
        }

        @Test
        @DisplayName("duplicate key inside a definition → LexiconParseException")
        void duplicateNestedKey() {
            String json = """
                    {
                      "lexicon": 1,
                      "id": "dev.atprose.test.dupnested",
                      "defs": {
                        "thing": {"type": "string", "maxLength": 1, "maxLength": 2}
                      }
                    }
                    """;

            assertThatThrownBy(() -> parser.parse(json, "dupnested.json"))
                    .isInstanceOf(LexiconParseException.class)
                    .isNotInstanceOf(DuplicateDefinitionException.class);
        }
    }

    @Nested
    @DisplayName("Malformed documents")
    class Malformed {

        @Test
        @DisplayName("not JSON → LexiconParseException naming the source")
        void notJson() {
            assertThatThrownBy(() -> parser.parse("{lexicon: ", "broken.json"))
                    .isInstanceOf(LexiconParseException.class)
                    .hasMessageContaining("broken.json");
        }

        @Test
        @DisplayName("unknown definition type → shape error")
        void unknownType() {
            String json = """
                    {"lexicon": 1, "id": "dev.atprose.test.typo", "defs": {"main": {"type": "strng"}}}
                    """;

            assertThatThrownBy(() -> parser.parse(json, "typo.json"))
                    .isInstanceOf(LexiconParseException.class)
                    .hasMessageContaining("invalid shape")
                    .satisfies(e -> assertThat(((LexiconParseException) e).documentId())
                            .isEqualTo("dev.atprose.test.typo"));
        }

        @Test
        @DisplayName("unknown top-level key → shape error")
        void unknownTopLevelKey() {
            String json = """
                    {"lexicon": 1, "id": "dev.atprose.test.extra", "defz": {}, "defs": {"main": {"type": "token"}}}
                    """;

            assertThatThrownBy(() -> parser.parse(json, "extra.json")).isInstanceOf(LexiconParseException.class);
        }

        @Test
        @DisplayName("invalid NSID as id → LexiconParseException")
        void invalidId() {
            String json = """
                    {"lexicon": 1, "id": "not-an-nsid", "defs": {"main": {"type": "token"}}}
                    """;

            assertThatThrownBy(() -> parser.parse(json, "badid.json"))
                    .isInstanceOf(LexiconParseException.class)
                    .hasMessageContaining("Invalid lexicon id");
        }

        @Test
        @DisplayName("empty input → LexiconParseException")
        void emptyInput() {
            assertThatThrownBy(() -> parser.parse("", "empty.json")).isInstanceOf(LexiconParseException.class);
        }

        @Test
        @DisplayName("missing file → LexiconParseException")
        void missingFile() {
            assertThatThrownBy(() -> parser.parse(Path.of("/nonexistent/lexicon.json")))
                    .isInstanceOf(LexiconParseException.class)
                    .hasMessageContaining("Failed to read");
        }
    }
}
