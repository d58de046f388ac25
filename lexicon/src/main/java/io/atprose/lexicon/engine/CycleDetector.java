package io.atprose.lexicon.engine;

import io.atprose.lexicon.error.ReferenceCycleException;
import io.atprose.lexicon.model.ResolvedNode;
import io.atprose.lexicon.model.SchemaGraph;
import io.atprose.lexicon.model.SchemaNode;
import io.atprose.lexicon.model.SchemaNode.ArraySchema;
import io.atprose.lexicon.model.SchemaNode.ObjectSchema;
import io.atprose.lexicon.model.SchemaNode.RecordSchema;
import io.atprose.lexicon.model.SchemaNode.RefSchema;
import io.atprose.lexicon.model.SchemaNode.UnionSchema;
import io.atprose.lexicon.model.SchemaRef;
import io.atprose.types.Nsid;
import io.atprose.types.TypeId;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Rejects definitions that no finite instance can satisfy.
 *
 * <p>
 * A node is <em>finite</em> if some finite value conforms to it. Primitives are finite. An object
 * is finite when every required, non-nullable property is; an array when it may be empty or its
 * items are finite; a union when it is open, has no members, has an unresolvable member or has a
 * finite member. The least fixpoint of these rules is computed; any node left non-finite sits on,
 * or leads into, a cycle of mandatory edges.
 *
 * <p>
 * Mandatory edges are followed into previously built graphs as well. An external reference found
 * there that names a document of the current build is taken to mean the new version of that
 * document, since the new version replaces the old one once registered.
 */
final class CycleDetector {

    /** A node of the arena being built ({@code graph == null}) or of an earlier graph. */
    private record Position(SchemaGraph graph, int handle) {}

    private final List<SchemaNode> nodes;
    private final Map<TypeId, Integer> definitions;
    private final Map<TypeId, ResolvedNode> externals;
    private final Set<Nsid> documents = new HashSet<>();

    private final List<Position> positions = new ArrayList<>();
    private final List<TypeId> labels = new ArrayList<>();
    private final Map<Position, Integer> indexes = new HashMap<>();
    private final Deque<Integer> pending = new ArrayDeque<>();

    // Per index: mandatory successors, and whether one finite successor suffices.
    private final List<int[]> successors = new ArrayList<>();
    private final List<Boolean> anySuffices = new ArrayList<>();

    CycleDetector(
            List<SchemaNode> nodes,
            List<Integer> owners,
            Map<Integer, TypeId> named,
            Map<TypeId, Integer> definitions,
            Map<TypeId, ResolvedNode> externals) {
        this.nodes = nodes;
        this.definitions = definitions;
        this.externals = externals;
        definitions.keySet().forEach(id -> documents.add(id.nsid()));
        for (int handle = 0; handle < nodes.size(); handle++) {
            indexOf(new Position(null, handle), named.get(owners.get(handle)));
        }
    }

    /** @throws ReferenceCycleException for the first offending definition, in handle order */
    void check() {
        while (!pending.isEmpty()) {
            link(pending.poll());
        }

        boolean[] finite = new boolean[positions.size()];
        boolean changed = true;
        while (changed) {
            changed = false;
            for (int index = 0; index < finite.length; index++) {
                if (!finite[index] && isFinite(index, finite)) {
                    finite[index] = true;
                    changed = true;
                }
            }
        }
        for (int handle = 0; handle < nodes.size(); handle++) {
            if (!finite[handle]) {
                throw cycleFrom(handle, finite);
            }
        }
    }

    private int indexOf(Position position, TypeId label) {
        Integer index = indexes.get(position);
        if (index != null) {
            return index;
        }
        int created = positions.size();
        indexes.put(position, created);
        positions.add(position);
        labels.add(label);
        successors.add(null);
        anySuffices.add(false);
        pending.add(created);
        return created;
    }

    private SchemaNode nodeAt(int index) {
        Position position = positions.get(index);
        return position.graph() == null ? nodes.get(position.handle()) : position.graph().node(position.handle());
    }

    /** Records the mandatory successors of a node, discovering them as needed. */
    private void link(int index) {
        SchemaNode node = nodeAt(index);
        List<Integer> out = new ArrayList<>();
        boolean any = false;
        if (node instanceof ObjectSchema object) {
            for (String name : object.required()) {
                Integer child = object.properties().get(name);
                if (child != null && !object.nullable().contains(name)) {
                    out.add(inner(index, child));
                }
            }
        } else if (node instanceof ArraySchema array) {
            if (array.minLength() != null && array.minLength() > 0) {
                out.add(inner(index, array.items()));
            }
        } else if (node instanceof RefSchema ref) {
            int target = target(index, ref.target());
            if (target >= 0) {
                out.add(target);
            }
        } else if (node instanceof UnionSchema union && union.closed() && !union.members().isEmpty()) {
            any = true;
            for (SchemaRef member : union.members()) {
                int target = target(index, member);
                if (target < 0) {
                    out.clear();
                    any = false;
                    break;
                }
                out.add(target);
            }
        } else if (node instanceof RecordSchema wrapper) {
            out.add(inner(index, wrapper.payload()));
        }
        successors.set(index, out.stream().mapToInt(Integer::intValue).toArray());
        anySuffices.set(index, any);
    }

    private int inner(int from, int handle) {
        return indexOf(new Position(positions.get(from).graph(), handle), labels.get(from));
    }

    /** Index of a reference target, or -1 when it cannot be resolved here. */
    private int target(int from, SchemaRef ref) {
        SchemaGraph graph = positions.get(from).graph();
        TypeId id = ref.target();
        if (ref instanceof SchemaRef.Local local) {
            return indexOf(new Position(graph, local.handle()), id);
        }
        if (graph == null) {
            ResolvedNode resolved = externals.get(id);
            return resolved == null ? -1 : indexOf(new Position(resolved.graph(), resolved.handle()), id);
        }
        if (documents.contains(id.nsid())) {
            Integer handle = definitions.get(id);
            return handle == null ? -1 : handle;
        }
        Optional<ResolvedNode> resolved = graph.lookup(ref);
        return resolved.isEmpty() ? -1 : indexOf(new Position(resolved.get().graph(), resolved.get().handle()), id);
    }

    private boolean isFinite(int index, boolean[] finite) {
        int[] next = successors.get(index);
        if (anySuffices.get(index)) {
            for (int successor : next) {
                if (finite[successor]) {
                    return true;
                }
            }
            return false;
        }
        for (int successor : next) {
            if (!finite[successor]) {
                return false;
            }
        }
        return true;
    }

    /** The first non-finite successor of a non-finite node; one always exists. */
    private int blockingSuccessor(int index, boolean[] finite) {
        for (int successor : successors.get(index)) {
            if (!finite[successor]) {
                return successor;
            }
        }
        throw new IllegalStateException("node " + nodeAt(index) + " has no blocking successor");
    }

    private ReferenceCycleException cycleFrom(int start, boolean[] finite) {
        Map<Integer, Integer> seenAt = new HashMap<>();
        List<Integer> walk = new ArrayList<>();
        int current = start;
        while (!seenAt.containsKey(current)) {
            seenAt.put(current, walk.size());
            walk.add(current);
            current = blockingSuccessor(current, finite);
        }

        // Name the loop by the named definitions it passes through.
        List<String> cycle = new ArrayList<>();
        for (int index : walk.subList(seenAt.get(current), walk.size())) {
            String label = labels.get(index).toString();
            if (cycle.isEmpty() || !cycle.get(cycle.size() - 1).equals(label)) {
                cycle.add(label);
            }
        }
        if (cycle.size() > 1 && cycle.get(0).equals(cycle.get(cycle.size() - 1))) {
            cycle.remove(cycle.size() - 1);
        }
        cycle.add(cycle.get(0));

        return new ReferenceCycleException(cycle, labels.get(current).nsid().toString());
    }
}
