package io.atprose.lexicon.engine;

import io.atprose.lexicon.config.LexiconConfig;
import io.atprose.lexicon.spi.FormatValidator;
import io.atprose.types.AtIdentifier;
import io.atprose.types.AtUri;
import io.atprose.types.Cid;
import io.atprose.types.Datetime;
import io.atprose.types.Did;
import io.atprose.types.FormatError;
import io.atprose.types.Handle;
import io.atprose.types.InvalidFormatException;
import io.atprose.types.LanguageTag;
import io.atprose.types.Nsid;
import io.atprose.types.RecordKey;
import io.atprose.types.Tid;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Maps {@code format} names used in string definitions to {@link FormatValidator}s. Lookup of an
 * unknown name fails the graph build, so a misspelled format never silently accepts every value.
 *
 * <p>
 * Graphs capture the validator at build time; registering or replacing a format afterwards only
 * affects graphs built later.
 *
 * <p>
 * Thread-safe: registration and lookup can happen concurrently.
 */
public final class FormatRegistry {

    /** Scheme, colon, then at least one non-whitespace character. */
    private static final Pattern URI = Pattern.compile("^[a-zA-Z][a-zA-Z0-9+.-]*:\\S+$");

    static final int URI_MAX_LENGTH = 8192;

    private final Map<String, FormatValidator> formats = new ConcurrentHashMap<>();

    /** Creates an empty registry. */
    public FormatRegistry() {}

    /** Creates a registry holding the standard protocol formats under {@link LexiconConfig#DEFAULTS}. */
    public static FormatRegistry standard() {
        return standard(LexiconConfig.DEFAULTS);
    }

    /**
     * Creates a registry holding the standard protocol formats: {@code at-identifier},
     * {@code at-uri}, {@code cid}, {@code datetime}, {@code did}, {@code handle},
     * {@code language}, {@code nsid}, {@code record-key}, {@code tid} and {@code uri}.
     *
     * @param config supplies the handle strictness and DID policy
     */
    public static FormatRegistry standard(LexiconConfig config) {
        boolean strict = config.strictHandles();
        Did.Policy policy = config.didPolicy();

        FormatRegistry registry = new FormatRegistry();
        registry.register("at-identifier", raw -> AtIdentifier.parse(raw, strict, policy).toString());
        registry.register("at-uri", raw -> AtUri.parse(raw, strict, policy).toString());
        registry.register("cid", raw -> Cid.parse(raw).toString());
        registry.register("datetime", raw -> Datetime.parse(raw).toString());
        registry.register("did", raw -> Did.parse(raw, policy).toString());
        registry.register("handle", raw -> Handle.parse(raw, strict).toString());
        registry.register("language", raw -> LanguageTag.parse(raw).toString());
        registry.register("nsid", raw -> Nsid.parse(raw).toString());
        registry.register("record-key", raw -> RecordKey.parse(raw).toString());
        registry.register("tid", raw -> Tid.parse(raw).toString());
        registry.register("uri", FormatRegistry::uri);
        return registry;
    }

    /**
     * Registers a format. A format already registered under the same name is replaced
     * (last-write-wins semantics).
     *
     * @throws NullPointerException     if name or validator is null
     * @throws IllegalArgumentException if name is empty
     */
    public void register(String name, FormatValidator validator) {
        if (name == null || validator == null) {
            throw new NullPointerException("name and validator must not be null");
        }
        if (name.isEmpty()) {
            throw new IllegalArgumentException("format name must not be empty");
        }
        formats.put(name, validator);
    }

    /**
     * Looks up a format by name.
     *
     * @return the validator, or empty if no format is registered under {@code name}
     */
    public Optional<FormatValidator> find(String name) {
        return Optional.ofNullable(formats.get(name));
    }

    /** Returns {@code true} if a format is registered under {@code name}. */
    public boolean hasFormat(String name) {
        return formats.containsKey(name);
    }

    /** Registered format names, sorted. */
    public Set<String> names() {
        return new TreeSet<>(formats.keySet());
    }

    private static String uri(String raw) {
        if (raw.length() > URI_MAX_LENGTH || !URI.matcher(raw).matches()) {
            throw new InvalidFormatException(FormatError.URI_MALFORMED, raw);
        }
        return raw;
    }
}
