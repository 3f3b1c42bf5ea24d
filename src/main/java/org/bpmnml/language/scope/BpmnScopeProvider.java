package org.bpmnml.language.scope;

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
 * Computes the nodes a connection endpoint may refer to.
 * <p>
 * The provider answers "can this name be seen here". Whether a particular
 * source/target pairing is allowed is left to the validator.
 */
public class BpmnScopeProvider {
    private final ScopeMode mode;

    public BpmnScopeProvider() {
        this(ScopeMode.POOL_WIDE);
    }

    public BpmnScopeProvider(ScopeMode mode) {
        this.mode = mode;
    }

    public ScopeMode getMode() {
        return mode;
    }

    /**
     * Gets the scope for one endpoint of a connection.
     * Both endpoints of a connection currently share the same visibility rules.
     *
     * @param connection the connection being linked
     * @param property   the endpoint being resolved
     * @return the candidate nodes, in depth-first declaration order
     */
    public NodeScope getScope(Connection connection, ReferenceProperty property) {
        List<Node> nodes = new ArrayList<>();

        if (mode == ScopeMode.POOL_WIDE && connection.getConnector().isMessageFlow()) {
            BpmnModel model = ContainmentHelper.findModel(connection);
            if (model != null) {
                collectPooledNodes(model, nodes);
            }
            return new NodeScope(nodes);
        }

        Container container = ContainmentHelper.findContainer(connection);
        if (container == null) {
            BpmnModel model = ContainmentHelper.findModel(connection);
            if (model != null) {
                collectGlobalNodes(model, nodes);
            }
        } else if (mode == ScopeMode.POOL_WIDE) {
            // lanes do not restrict visibility inside their pool
            Pool pool = container instanceof Pool p ? p : ContainmentHelper.findPool(container);
            collectNodesFromContainer(pool != null ? pool : container, nodes);
        } else {
            collectNodesFromContainer(container, nodes);
        }

        return new NodeScope(nodes);
    }

    /**
     * Collects all nodes of a container, descending into nested lanes.
     */
    protected void collectNodesFromContainer(Container container, List<Node> nodes) {
        for (PoolElement element : container.getElements()) {
            switch (element.kind()) {
                case EVENT, TASK, GATEWAY -> nodes.add((Node) element);
                case LANE -> collectNodesFromContainer((Container) element, nodes);
                default -> {
                    // connections are not referable
                }
            }
        }
    }

    /**
     * Collects the nodes declared directly in the model root, without entering pools.
     */
    protected void collectGlobalNodes(BpmnModel model, List<Node> nodes) {
        for (RootElement element : model.getElements()) {
            if (element.kind().isNode()) {
                nodes.add((Node) element);
            }
        }
    }

    /**
     * Collects the nodes of every pool in the model.
     */
    protected void collectPooledNodes(BpmnModel model, List<Node> nodes) {
        for (RootElement element : model.getElements()) {
            if (element instanceof Pool pool) {
                collectNodesFromContainer(pool, nodes);
            }
        }
    }
}
