package io.atprose.lexicon.testkit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import io.atprose.lexicon.model.LexiconDocument;
import io.atprose.lexicon.spec.LexiconParser;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/** Loads lexicon and instance fixtures from the test classpath. */
public final class Fixtures {

    public static final ObjectMapper JSON = new ObjectMapper();

    private static final LexiconParser PARSER = new LexiconParser();

    private Fixtures() {}

    /** Path of {@code lexicons/<id>.json}. */
    public static Path lexiconPath(String id) {
        return resource("lexicons/" + id + ".json");
    }

    /** Parses {@code lexicons/<id>.json}. */
    public static LexiconDocument lexicon(String id) {
        return PARSER.parse(lexiconPath(id));
    }

    /** Parses several fixture lexicons. */
    public static List<LexiconDocument> lexicons(String... ids) {
        List<LexiconDocument> out = new ArrayList<>(ids.length);
        for (String id : ids) {
            out.add(lexicon(id));
        }
        return out;
    }

    /** Parses an inline lexicon document. */
    public static LexiconDocument document(String json) {
        return PARSER.parse(json, "inline");
    }

    public static JsonNode json(String text) {
        try {
            return JSON.readTree(text);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("bad test JSON: " + text, e);
        }
    }

    /** A JSON string node; avoids escaping in inline JSON. */
    public static JsonNode text(String value) {
        return TextNode.valueOf(value);
    }

    public static Path resource(String name) {
        URL url = Fixtures.class.getClassLoader().getResource(name);
        if (url == null) {
            throw new IllegalArgumentException("missing test resource " + name);
        }
        try {
            return Path.of(url.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("bad resource URL " + url, e);
        }
    }
}
