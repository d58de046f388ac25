package io.atprose.lexicon.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.atprose.lexicon.error.DefinitionNotFoundException;
import io.atprose.lexicon.model.ResolvedNode;
import io.atprose.lexicon.model.SchemaGraph;
import io.atprose.lexicon.model.SchemaNode;
import io.atprose.lexicon.model.SchemaNode.Body;
import io.atprose.lexicon.model.SchemaNode.ProcedureSchema;
import io.atprose.lexicon.model.SchemaNode.QuerySchema;
import io.atprose.lexicon.model.ValidationOutcome;
import io.atprose.types.Nsid;
import io.atprose.types.TypeId;
import java.util.Objects;
import java.util.Optional;

/**
 * Validates the parameters and bodies of {@code query} and {@code procedure} definitions.
 *
 * <p>
 * Parameters are checked as an object; a method that declares none accepts any parameter object.
 * A body without a {@code schema} is opaque and passes unchecked.
 */
public final class MethodValidator {

    private final ValueValidator values;

    public MethodValidator(ValueValidator values) {
        this.values = Objects.requireNonNull(values, "values must not be null");
    }

    /** Validates query-string or call parameters, given as a JSON object. */
    public ValidationOutcome validateParameters(SchemaGraph graph, Nsid method, JsonNode parameters) {
        ResolvedNode node = requireMethod(graph, method);
        JsonNode input = parameters == null ? JsonNodeFactory.instance.objectNode() : parameters;
        Integer handle = node.node() instanceof QuerySchema query
                ? query.parameters()
                : ((ProcedureSchema) node.node()).parameters();
        if (handle == null) {
            return passThrough(input);
        }
        return values.validate(new ResolvedNode(graph, handle), input);
    }

    /**
     * Validates a procedure's request body.
     *
     * @throws DefinitionNotFoundException if {@code method} is not a procedure with an input
     */
    public ValidationOutcome validateInput(SchemaGraph graph, Nsid method, JsonNode body) {
        ResolvedNode node = requireMethod(graph, method);
        Body input = node.node() instanceof ProcedureSchema procedure ? procedure.input() : null;
        if (input == null) {
            throw new DefinitionNotFoundException(
                    "Method '" + method + "' declares no input body", method + "#input", method.toString());
        }
        return validateBody(graph, input, body);
    }

    /**
     * Validates a method's response body.
     *
     * @throws DefinitionNotFoundException if {@code method} declares no output
     */
    public ValidationOutcome validateOutput(SchemaGraph graph, Nsid method, JsonNode body) {
        ResolvedNode node = requireMethod(graph, method);
        Body output = node.node() instanceof QuerySchema query
                ? query.output()
                : ((ProcedureSchema) node.node()).output();
        if (output == null) {
            throw new DefinitionNotFoundException(
                    "Method '" + method + "' declares no output body", method + "#output", method.toString());
        }
        return validateBody(graph, output, body);
    }

    /** Declared encoding of a procedure's request body, if it has one. */
    public Optional<String> inputEncoding(SchemaGraph graph, Nsid method) {
        SchemaNode node = requireMethod(graph, method).node();
        if (node instanceof ProcedureSchema procedure && procedure.input() != null) {
            return Optional.of(procedure.input().encoding());
        }
        return Optional.empty();
    }

    /** Declared encoding of a method's response body, if it has one. */
    public Optional<String> outputEncoding(SchemaGraph graph, Nsid method) {
        SchemaNode node = requireMethod(graph, method).node();
        Body output = node instanceof QuerySchema query ? query.output() : ((ProcedureSchema) node).output();
        return output == null ? Optional.empty() : Optional.of(output.encoding());
    }

    private ValidationOutcome validateBody(SchemaGraph graph, Body body, JsonNode value) {
        JsonNode input = value == null ? JsonNodeFactory.instance.nullNode() : value;
        if (body.schema() == null) {
            return passThrough(input);
        }
        return values.validate(new ResolvedNode(graph, body.schema()), input);
    }

    private static ValidationOutcome passThrough(JsonNode value) {
        return new ValidationOutcome.Valid(value.deepCopy());
    }

    private static ResolvedNode requireMethod(SchemaGraph graph, Nsid method) {
        Objects.requireNonNull(graph, "graph must not be null");
        Objects.requireNonNull(method, "method must not be null");
        ResolvedNode node = graph.require(TypeId.main(method));
        if (!(node.node() instanceof QuerySchema) && !(node.node() instanceof ProcedureSchema)) {
            throw new DefinitionNotFoundException(
                    "Definition '" + method + "' is a " + node.kind().typeName() + ", not a query or procedure",
                    method.toString(),
                    method.toString());
        }
        return node;
    }
}
