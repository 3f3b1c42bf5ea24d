package org.bpmnml.generator;

import org.bpmnml.language.model.Connection;
import org.bpmnml.language.model.Pool;

import java.util.List;

/**
 * @param groups       process groups: the global one first when present, then pools in declaration order
 * @param pools        every pool of the model in declaration order, including empty ones without a group
 * @param messageFlows every message-flow connection of the model, in tree order
 */
public record ModelPartition(
        List<ProcessGroup> groups,
        List<Pool> pools,
        List<Connection> messageFlows
) {
}
