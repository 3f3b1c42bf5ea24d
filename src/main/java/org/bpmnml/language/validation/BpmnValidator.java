package org.bpmnml.language.validation;

import org.bpmnml.language.model.BpmnModel;
import org.bpmnml.language.model.Connection;
import org.bpmnml.language.model.Container;
import org.bpmnml.language.model.Lane;
import org.bpmnml.language.model.ModelElement;
import org.bpmnml.language.model.Node;
import org.bpmnml.language.model.Pool;
import org.bpmnml.language.model.PoolElement;
import org.bpmnml.language.scope.ContainmentHelper;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Semantic checks for BPMNml models that the grammar cannot express.
 * <p>
 * The validator holds no state between calls; each {@link #validate(BpmnModel)}
 * collects into its own list, so one instance can be shared.
 */
public class BpmnValidator {
    private static final String GLOBAL_SCOPE = "global";

    /**
     * Runs every check over the model.
     *
     * @param model the linked model
     * @return all findings, in tree order
     */
    public List<Diagnostic> validate(BpmnModel model) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        ValidationAcceptor accept = (severity, message, element, property) -> diagnostics.add(
                Diagnostic.builder()
                        .severity(severity)
                        .message(message)
                        .element(element)
                        .property(property)
                        .build());

        checkDuplicateNodeNames(model, accept);
        validateElements(model.getElements(), accept);
        return diagnostics;
    }

    private void validateElements(List<? extends ModelElement> elements, ValidationAcceptor accept) {
        for (ModelElement element : elements) {
            switch (element.kind()) {
                case CONNECTION -> checkConnection((Connection) element, accept);
                case POOL -> {
                    Pool pool = (Pool) element;
                    checkPoolElements(pool, accept);
                    validateElements(pool.getElements(), accept);
                }
                case LANE -> {
                    Lane lane = (Lane) element;
                    checkLaneElements(lane, accept);
                    validateElements(lane.getElements(), accept);
                }
                default -> {
                    // nodes are covered by the duplicate-name walk
                }
            }
        }
    }

    /**
     * Validates that a connection's endpoints exist and respect pool boundaries.
     */
    public void checkConnection(Connection connection, ValidationAcceptor accept) {
        boolean sourceResolved = connection.getSource() != null && connection.getSource().isResolved();
        boolean targetResolved = connection.getTarget() != null && connection.getTarget().isResolved();

        if (!sourceResolved) {
            accept.accept(DiagnosticSeverity.ERROR, "Connection source node is not defined.", connection, "source");
        }
        if (!targetResolved) {
            accept.accept(DiagnosticSeverity.ERROR, "Connection target node is not defined.", connection, "target");
        }
        if (!sourceResolved || !targetResolved) {
            return;
        }

        Node source = connection.getSource().getRef();
        Node target = connection.getTarget().getRef();
        Pool sourcePool = ContainmentHelper.findPool(source);
        Pool targetPool = ContainmentHelper.findPool(target);

        if (connection.getConnector().isMessageFlow()) {
            if (sourcePool == null || targetPool == null) {
                accept.accept(DiagnosticSeverity.ERROR, "Message flows must connect nodes in different pools.", connection);
            } else if (sourcePool == targetPool) {
                accept.accept(DiagnosticSeverity.ERROR, "Message flows cannot connect nodes within the same pool.", connection);
            }
        } else {
            if (sourcePool != null && targetPool != null && sourcePool != targetPool) {
                accept.accept(DiagnosticSeverity.ERROR, "Connections cannot cross pool boundaries.", connection);
            } else if ((sourcePool == null) != (targetPool == null)) {
                accept.accept(DiagnosticSeverity.ERROR, "Connections cannot mix pooled and unpooled nodes.", connection);
            }
        }

        if (source == target) {
            accept.accept(DiagnosticSeverity.WARNING, "Self-loops are not recommended in BPMN.", connection);
        }
    }

    /**
     * Checks node names per scope. A scope is the dotted path of the enclosing pool and lanes,
     * or "global" for root-level nodes.
     */
    public void checkDuplicateNodeNames(BpmnModel model, ValidationAcceptor accept) {
        Map<String, Set<String>> namesByScope = new HashMap<>();
        Map<String, Set<String>> scopesByName = new HashMap<>();

        for (ModelElement element : model.getElements()) {
            if (element.kind().isNode()) {
                checkNodeName((Node) element, null, namesByScope, scopesByName, accept);
            } else if (element instanceof Pool pool) {
                checkContainerNodeNames(pool, pool.getName(), namesByScope, scopesByName, accept);
            }
        }
    }

    private void checkContainerNodeNames(Container container, String scope,
                                         Map<String, Set<String>> namesByScope,
                                         Map<String, Set<String>> scopesByName,
                                         ValidationAcceptor accept) {
        for (PoolElement element : container.getElements()) {
            switch (element.kind()) {
                case EVENT, TASK, GATEWAY -> checkNodeName((Node) element, scope, namesByScope, scopesByName, accept);
                case LANE -> {
                    Lane lane = (Lane) element;
                    checkContainerNodeNames(lane, scope + "." + lane.getName(), namesByScope, scopesByName, accept);
                }
                default -> {
                    // connections carry no names
                }
            }
        }
    }

    private void checkNodeName(Node node, String containerScope,
                               Map<String, Set<String>> namesByScope,
                               Map<String, Set<String>> scopesByName,
                               ValidationAcceptor accept) {
        String scope = containerScope != null ? containerScope : GLOBAL_SCOPE;
        Set<String> scopeNames = namesByScope.computeIfAbsent(scope, key -> new HashSet<>());

        if (!scopeNames.add(node.getName())) {
            accept.accept(DiagnosticSeverity.ERROR,
                    String.format("Duplicate node name '%s' in %s scope.", node.getName(), scope), node, "name");
        }

        Set<String> seenIn = scopesByName.computeIfAbsent(node.getName(), key -> new HashSet<>());
        if (containerScope != null && seenIn.stream().anyMatch(other -> !other.equals(scope))) {
            accept.accept(DiagnosticSeverity.WARNING,
                    String.format("Node name '%s' is used in multiple containers.", node.getName()), node, "name");
        }
        seenIn.add(scope);
    }

    /**
     * Warns about pools without any direct element.
     */
    public void checkPoolElements(Pool pool, ValidationAcceptor accept) {
        if (pool.getElements().isEmpty()) {
            accept.accept(DiagnosticSeverity.WARNING, "Pool is empty. Consider adding lanes or elements.", pool, "name");
        }
    }

    /**
     * Warns about lanes without any direct element.
     */
    public void checkLaneElements(Lane lane, ValidationAcceptor accept) {
        if (lane.getElements().isEmpty()) {
            accept.accept(DiagnosticSeverity.WARNING, "Lane is empty. Consider adding elements.", lane, "name");
        }
    }

    /**
     * @return true when at least one diagnostic has error severity
     */
    public static boolean hasErrors(List<Diagnostic> diagnostics) {
        return diagnostics.stream().anyMatch(Diagnostic::isError);
    }
}
