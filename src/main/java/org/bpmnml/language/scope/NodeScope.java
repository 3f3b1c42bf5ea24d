package org.bpmnml.language.scope;

import org.bpmnml.language.model.Node;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Candidate nodes a reference may bind to. Nodes sharing a name are kept as separate
 * candidates; the first one in collection order wins a lookup.
 */
public final class NodeScope {
    private final List<Node> candidates;

    NodeScope(List<Node> candidates) {
        this.candidates = Collections.unmodifiableList(candidates);
    }

    public List<Node> getCandidates() {
        return candidates;
    }

    public boolean contains(Node node) {
        return candidates.stream().anyMatch(candidate -> candidate == node);
    }

    public Optional<Node> lookup(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return candidates.stream()
                .filter(candidate -> name.equals(candidate.getName()))
                .findFirst();
    }

    public int size() {
        return candidates.size();
    }
}
