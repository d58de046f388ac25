package io.atprose.lexicon.engine;

import static io.atprose.lexicon.testkit.Fixtures.json;
import static io.atprose.lexicon.testkit.Fixtures.lexiconPath;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.atprose.lexicon.config.LexiconConfig;
import io.atprose.lexicon.error.DefinitionNotFoundException;
import io.atprose.lexicon.error.ReferenceCycleException;
import io.atprose.lexicon.error.UnresolvedReferenceException;
import io.atprose.lexicon.model.KeyOutcome;
import io.atprose.lexicon.model.RecordOutcome;
import io.atprose.lexicon.model.SchemaGraph;
import io.atprose.lexicon.model.SchemaNode;
import io.atprose.lexicon.model.SchemaRef;
import io.atprose.types.Nsid;
import io.atprose.types.TypeId;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** End-to-end tests for {@link LexiconEngine}: loading from files, catalog lookups, concurrency. */
@DisplayName("LexiconEngine")
class LexiconEngineTest {

    private static final Nsid POST = Nsid.parse("dev.atprose.test.post");

    private static final String LOOP_B_OPEN = """
            {"lexicon": 1, "id": "dev.atprose.test.loopb", "defs": {
              "main": {"type": "object", "properties": {"note": {"type": "string"}}}
            }}
            """;

    private static final String LOOP_A = """
            {"lexicon": 1, "id": "dev.atprose.test.loopa", "defs": {
              "main": {"type": "record", "key": "tid", "record": {
                "type": "object", "required": ["entry"], "properties": {"entry": {"type": "ref", "ref": "#entry"}}
              }},
              "entry": {"type": "object", "required": ["b"], "properties": {
                "b": {"type": "ref", "ref": "dev.atprose.test.loopb"}
              }}
            }}
            """;

    private static final String LOOP_B_REQUIRING_A = """
            {"lexicon": 1, "id": "dev.atprose.test.loopb", "defs": {
              "main": {"type": "object", "required": ["a"], "properties": {
                "a": {"type": "ref", "ref": "dev.atprose.test.loopa#entry"}
              }}
            }}
            """;

    private LexiconEngine engine;

    @BeforeEach
    void setUp() {
        engine = new LexiconEngine();
    }

    @Test
    @DisplayName("load → graph registered in the catalog")
    void loadRegisters() {
        SchemaGraph graph = engine.load(List.of(lexiconPath("dev.atprose.test.post")));

        assertThat(engine.catalog().find(POST)).containsSame(graph);
        assertThat(engine.config()).isEqualTo(LexiconConfig.DEFAULTS);
    }

    @Test
    @DisplayName("later batch resolves references into an earlier one")
    void crossBatchReferences() {
        engine.load(List.of(lexiconPath("dev.atprose.test.post")));

        SchemaGraph methods = engine.load(List.of(lexiconPath("dev.atprose.test.getPost")));

        var query = (SchemaNode.QuerySchema) methods.require(TypeId.parse("dev.atprose.test.getPost")).node();
        var output = (SchemaNode.RefSchema) methods.node(query.output().schema());
        assertThat(output.target()).isInstanceOf(SchemaRef.External.class);
        assertThat(engine.methods()
                        .validateOutput(methods, Nsid.parse("dev.atprose.test.getPost"), json("{\"text\": \"ok\"}"))
                        .isValid())
                .isTrue();
    }

    @Test
    @DisplayName("failed load registers nothing")
    void failedLoadRegistersNothing() {
        assertThatThrownBy(() -> engine.load(List.of(lexiconPath("dev.atprose.test.getPost"))))
                .isInstanceOf(UnresolvedReferenceException.class);

        assertThat(engine.catalog().size()).isZero();
    }

    @Test
    @DisplayName("validateRecord by collection uses the catalog")
    void validateThroughCatalog() {
        engine.load(List.of(lexiconPath("dev.atprose.test.post")));

        RecordOutcome outcome = engine.validateRecord(
                POST, json("{\"id\": \"1\", \"body\": {\"text\": \"hello\", \"languages\": [\"en\"]}}"), null);

        assertThat(outcome.isValid()).isTrue();
        assertThat(((KeyOutcome.Accepted) outcome.key()).key().isTid()).isTrue();
    }

    @Test
    @DisplayName("validateRecord for an unloaded collection → DefinitionNotFoundException")
    void unloadedCollection() {
        assertThatThrownBy(() -> engine.validateRecord(POST, json("{}"), null))
                .isInstanceOf(DefinitionNotFoundException.class)
                .hasMessageContaining("is not loaded");
    }

    @Test
    @DisplayName("validate checks a value against any named definition")
    void validateNamedDefinition() {
        SchemaGraph graph = engine.buildGraph(List.of(engine.parse(lexiconPath("dev.atprose.test.post"))));

        var outcome = engine.validate(graph, TypeId.parse("dev.atprose.test.post#body"), json("{\"text\": 1}"));

        assertThat(outcome.violations()).extracting(v -> v.path().toString()).containsExactly("text");
        assertThat(engine.catalog().size()).isZero();
    }

    @Test
    @DisplayName("replacement closing a required loop through an earlier batch → ReferenceCycleException")
    void replacementClosingCycleRejected() {
        SchemaGraph original = register(LOOP_B_OPEN);
        register(LOOP_A);

        assertThatThrownBy(() -> register(LOOP_B_REQUIRING_A))
                .isInstanceOf(ReferenceCycleException.class)
                .satisfies(e -> assertThat(((ReferenceCycleException) e).cycle())
                        .containsExactly(
                                "dev.atprose.test.loopb", "dev.atprose.test.loopa#entry", "dev.atprose.test.loopb"));

        assertThat(engine.catalog().find(Nsid.parse("dev.atprose.test.loopb"))).containsSame(original);
    }

    @Test
    @DisplayName("replacement referring back through an optional property still loads")
    void replacementWithOptionalBackReference() {
        register(LOOP_B_OPEN);
        register(LOOP_A);

        SchemaGraph replaced = register(LOOP_B_REQUIRING_A.replace("\"required\": [\"a\"], ", ""));

        assertThat(engine.catalog().find(Nsid.parse("dev.atprose.test.loopb"))).containsSame(replaced);
        assertThat(engine.validate(
                                engine.catalog().find(Nsid.parse("dev.atprose.test.loopa")).orElseThrow(),
                                TypeId.parse("dev.atprose.test.loopa#entry"),
                                json("{\"b\": {\"a\": {\"b\": {}}}}"))
                        .isValid())
                .isTrue();
    }

    private SchemaGraph register(String json) {
        SchemaGraph graph = engine.buildGraph(List.of(engine.parse(json, "inline.json")), engine.catalog());
        engine.catalog().register(graph);
        return graph;
    }

    @Test
    @DisplayName("one graph serves concurrent validations")
    void concurrentValidation() throws Exception {
        SchemaGraph graph = engine.load(List.of(lexiconPath("dev.atprose.test.post")));
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                String body = i % 2 == 0
                        ? "{\"id\": \"" + i + "\", \"body\": {\"text\": \"post " + i + "\"}}"
                        : "{\"id\": \"" + i + "\"}";
                results.add(pool.submit(() -> engine.validateRecord(graph, POST, json(body)).isValid()));
            }
            for (int i = 0; i < results.size(); i++) {
                assertThat(results.get(i).get(10, TimeUnit.SECONDS)).isEqualTo(i % 2 == 0);
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
