package org.bpmnml.generator;

import org.bpmnml.language.model.Connection;
import org.bpmnml.language.model.Node;
import org.bpmnml.language.model.Pool;

import java.util.List;

/**
 * The content of one synthesized process.
 *
 * @param pool        the pool the process belongs to, or null for the global process
 * @param nodes       nodes of the process in tree order, lanes flattened
 * @param connections sequence flows and associations of the process in tree order
 */
public record ProcessGroup(
        Pool pool,
        List<Node> nodes,
        List<Connection> connections
) {

    public boolean isGlobal() {
        return pool == null;
    }
}
