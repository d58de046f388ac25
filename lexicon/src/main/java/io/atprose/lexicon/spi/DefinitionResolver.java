package io.atprose.lexicon.spi;

import io.atprose.lexicon.model.ResolvedNode;
import io.atprose.types.TypeId;
import java.util.Optional;

/**
 * Looks up definitions owned by other schema graphs. Supplied to the graph builder for
 * {@code ref}s and union members that point outside the documents being built, and kept by the
 * built graph to follow those references during validation.
 *
 * <p>
 * Implementations may block (e.g. fetch a document over the network). Any exception they throw
 * is reported by the builder as a build failure; no timeout or retry is applied on top.
 */
@FunctionalInterface
public interface DefinitionResolver {

    /** A resolver that knows no definitions. */
    DefinitionResolver NONE = id -> Optional.empty();

    /**
     * @param id the definition to find
     * @return the resolved definition, or empty if no such definition exists
     */
    Optional<ResolvedNode> resolve(TypeId id);
}
