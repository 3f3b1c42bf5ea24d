package org.bpmnml.generator;

import org.bpmnml.language.model.BpmnModel;
import org.bpmnml.language.model.Connection;
import org.bpmnml.language.model.Container;
import org.bpmnml.language.model.Node;
import org.bpmnml.language.model.Pool;
import org.bpmnml.language.model.PoolElement;
import org.bpmnml.language.model.RootElement;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a model into the groups that become processes.
 */
public final class ModelPartitioner {

    private ModelPartitioner() {
    }

    /**
     * Partitions the model.
     * <ul>
     *   <li>root nodes and root sequence/association connections form the global group;</li>
     *   <li>every pool with at least one element forms its own group, lanes flattened;</li>
     *   <li>every pool, empty or not, is listed for the collaboration;</li>
     *   <li>message flows are pulled out of all groups.</li>
     * </ul>
     * The global group is kept when it has content or when no pool group exists,
     * so a document always holds at least one process.
     */
    public static ModelPartition partition(BpmnModel model) {
        List<Node> globalNodes = new ArrayList<>();
        List<Connection> globalConnections = new ArrayList<>();
        List<Connection> messageFlows = new ArrayList<>();
        List<ProcessGroup> poolGroups = new ArrayList<>();
        List<Pool> pools = new ArrayList<>();

        for (RootElement element : model.getElements()) {
            switch (element.kind()) {
                case EVENT, TASK, GATEWAY -> globalNodes.add((Node) element);
                case CONNECTION -> addConnection((Connection) element, globalConnections, messageFlows);
                case POOL -> {
                    Pool pool = (Pool) element;
                    pools.add(pool);
                    if (pool.getElements().isEmpty()) {
                        continue;
                    }
                    List<Node> nodes = new ArrayList<>();
                    List<Connection> connections = new ArrayList<>();
                    collect(pool, nodes, connections, messageFlows);
                    poolGroups.add(new ProcessGroup(pool, nodes, connections));
                }
                default -> throw new IllegalStateException("Unexpected root element: " + element);
            }
        }

        List<ProcessGroup> groups = new ArrayList<>();
        if (!globalNodes.isEmpty() || !globalConnections.isEmpty() || poolGroups.isEmpty()) {
            groups.add(new ProcessGroup(null, globalNodes, globalConnections));
        }
        groups.addAll(poolGroups);
        return new ModelPartition(groups, pools, messageFlows);
    }

    private static void collect(Container container, List<Node> nodes, List<Connection> connections,
                                List<Connection> messageFlows) {
        for (PoolElement element : container.getElements()) {
            switch (element.kind()) {
                case EVENT, TASK, GATEWAY -> nodes.add((Node) element);
                case CONNECTION -> addConnection((Connection) element, connections, messageFlows);
                case LANE -> collect((Container) element, nodes, connections, messageFlows);
                default -> throw new IllegalStateException("Unexpected pool element: " + element);
            }
        }
    }

    private static void addConnection(Connection connection, List<Connection> flows, List<Connection> messageFlows) {
        if (connection.getConnector().isMessageFlow()) {
            messageFlows.add(connection);
        } else {
            flows.add(connection);
        }
    }
}
