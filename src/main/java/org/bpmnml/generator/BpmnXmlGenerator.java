package org.bpmnml.generator;

import org.bpmnml.language.model.BpmnModel;
import org.bpmnml.language.model.Connection;
import org.bpmnml.language.model.Connector;
import org.bpmnml.language.model.Event;
import org.bpmnml.language.model.Gateway;
import org.bpmnml.language.model.Lane;
import org.bpmnml.language.model.Node;
import org.bpmnml.language.model.NodeReference;
import org.bpmnml.language.model.Pool;
import org.bpmnml.language.model.PoolElement;
import org.bpmnml.language.model.Task;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import static org.bpmnml.generator.BpmnNamespaces.BPMNDI_NS;
import static org.bpmnml.generator.BpmnNamespaces.BPMN_NS;
import static org.bpmnml.generator.BpmnNamespaces.DC_NS;
import static org.bpmnml.generator.BpmnNamespaces.DI_NS;
import static org.bpmnml.generator.BpmnNamespaces.TARGET_NAMESPACE;
import static org.bpmnml.generator.BpmnNamespaces.XMLNS_NS;

/**
 * Generates a BPMN 2.0 document (processes, collaboration and diagram) from a BPMNml model.
 * <p>
 * The generator assumes the model was linked and validated. It does not validate anything
 * itself and degrades instead of failing: unresolved endpoints give empty references and
 * edges collapsed onto the origin.
 * <p>
 * Instances are stateless; every call works on its own {@link GenerationContext}, so
 * repeated calls on the same model produce identical output.
 */
public class BpmnXmlGenerator {
    private final GeneratorOptions options;

    public BpmnXmlGenerator() {
        this(GeneratorOptions.defaults());
    }

    public BpmnXmlGenerator(GeneratorOptions options) {
        this.options = options;
    }

    /**
     * Generates the serialized BPMN document.
     *
     * @param model the linked, validated model
     * @return the XML text
     */
    public String generateXml(BpmnModel model) {
        return BpmnDocumentWriter.toXml(generateDocument(model), options);
    }

    /**
     * Generates the BPMN document as a DOM tree.
     */
    public Document generateDocument(BpmnModel model) {
        GenerationContext ctx = new GenerationContext(newDocument());
        IdRegistry ids = ctx.ids();
        ModelPartition partition = ModelPartitioner.partition(model);
        List<ProcessGroup> groups = partition.groups();

        Element definitions = ctx.bpmn("definitions");
        definitions.setAttributeNS(XMLNS_NS, "xmlns", BPMN_NS);
        definitions.setAttributeNS(XMLNS_NS, "xmlns:bpmndi", BPMNDI_NS);
        definitions.setAttributeNS(XMLNS_NS, "xmlns:dc", DC_NS);
        definitions.setAttributeNS(XMLNS_NS, "xmlns:di", DI_NS);
        definitions.setAttribute("id", ids.nextId("Definitions"));
        definitions.setAttribute("targetNamespace", TARGET_NAMESPACE);
        ctx.document().appendChild(definitions);

        // process and node ids first, so flows never decide the numbering of nodes
        for (ProcessGroup group : groups) {
            processId(group, ids);
            for (Node node : group.nodes()) {
                ids.idFor(node, node.getName());
            }
        }

        List<Element> shapes = new ArrayList<>();
        List<Element> edges = new ArrayList<>();
        Map<ProcessGroup, Bounds> participantBounds = new IdentityHashMap<>();

        for (int i = 0; i < groups.size(); i++) {
            ProcessGroup group = groups.get(i);
            definitions.appendChild(generateProcess(group, ctx));

            Bounds participant = ctx.layout().layoutGroup(group, i);
            if (participant != null) {
                participantBounds.put(group, participant);
            }
        }

        String planeElementId;
        if (!partition.pools().isEmpty() || !partition.messageFlows().isEmpty()) {
            Element collaboration = generateCollaboration(partition, ctx);
            definitions.appendChild(collaboration);
            planeElementId = collaboration.getAttribute("id");
        } else {
            planeElementId = ids.existingId(groups.get(0));
        }

        for (ProcessGroup group : groups) {
            Bounds participant = participantBounds.get(group);
            if (participant != null) {
                Element shape = generateShape(ids.existingId(group.pool()), participant, ctx);
                shape.setAttribute("isHorizontal", "true");
                shapes.add(shape);
            }
            for (Node node : group.nodes()) {
                shapes.add(generateShape(ids.existingId(node), ctx.layout().boundsOf(node), ctx));
            }
        }
        for (ProcessGroup group : groups) {
            for (Connection connection : group.connections()) {
                edges.add(generateEdge(connection, ctx));
            }
        }
        for (Connection messageFlow : partition.messageFlows()) {
            edges.add(generateEdge(messageFlow, ctx));
        }

        if (!shapes.isEmpty() || !edges.isEmpty()) {
            definitions.appendChild(generateDiagram(planeElementId, shapes, edges, ctx));
        }

        return ctx.document();
    }

    private static String processId(ProcessGroup group, IdRegistry ids) {
        return group.isGlobal()
                ? ids.idFor(group, "Process")
                : ids.idFor(group, "Process_" + group.pool().getName());
    }

    private Element generateProcess(ProcessGroup group, GenerationContext ctx) {
        IdRegistry ids = ctx.ids();
        Element process = ctx.bpmn("process");
        process.setAttribute("id", processId(group, ids));
        if (!group.isGlobal()) {
            process.setAttribute("name", group.pool().getName());
        }
        process.setAttribute("isExecutable", "false");

        Map<Node, List<String>> incoming = new IdentityHashMap<>();
        Map<Node, List<String>> outgoing = new IdentityHashMap<>();
        for (Connection connection : group.connections()) {
            String flowId = ids.idFor(connection, FlowKind.of(connection.getConnector()).getIdBase());
            if (connection.getSource() != null && connection.getSource().isResolved()) {
                outgoing.computeIfAbsent(connection.getSource().getRef(), key -> new ArrayList<>()).add(flowId);
            }
            if (connection.getTarget() != null && connection.getTarget().isResolved()) {
                incoming.computeIfAbsent(connection.getTarget().getRef(), key -> new ArrayList<>()).add(flowId);
            }
        }

        if (!group.isGlobal() && hasLanes(group.pool().getElements())) {
            process.appendChild(generateLaneSet("laneSet", group.pool().getElements(), ctx));
        }

        for (Node node : group.nodes()) {
            Element element = ctx.bpmn(elementName(node));
            element.setAttribute("id", ids.idFor(node, node.getName()));
            element.setAttribute("name", node.getName());
            for (String flowId : incoming.getOrDefault(node, List.of())) {
                element.appendChild(ctx.textElement("incoming", flowId));
            }
            for (String flowId : outgoing.getOrDefault(node, List.of())) {
                element.appendChild(ctx.textElement("outgoing", flowId));
            }
            process.appendChild(element);
        }

        // the process schema wants flow elements before artifacts
        for (Connection connection : group.connections()) {
            if (!connection.getConnector().isAssociation()) {
                process.appendChild(generateFlow(connection, ctx));
            }
        }
        for (Connection connection : group.connections()) {
            if (connection.getConnector().isAssociation()) {
                process.appendChild(generateFlow(connection, ctx));
            }
        }

        return process;
    }

    private static boolean hasLanes(List<PoolElement> elements) {
        return elements.stream().anyMatch(element -> element instanceof Lane);
    }

    /**
     * Lane sets only record which nodes belong to which lane; lanes get no diagram shapes.
     */
    private Element generateLaneSet(String elementName, List<PoolElement> elements, GenerationContext ctx) {
        IdRegistry ids = ctx.ids();
        Element laneSet = ctx.bpmn(elementName);
        laneSet.setAttribute("id", ids.nextId("LaneSet"));

        for (PoolElement element : elements) {
            if (!(element instanceof Lane lane)) {
                continue;
            }
            Element laneElement = ctx.bpmn("lane");
            laneElement.setAttribute("id", ids.idFor(lane, lane.getName()));
            laneElement.setAttribute("name", lane.getName());
            for (PoolElement child : lane.getElements()) {
                if (child instanceof Node node) {
                    laneElement.appendChild(ctx.textElement("flowNodeRef", ids.idFor(node, node.getName())));
                }
            }
            if (hasLanes(lane.getElements())) {
                laneElement.appendChild(generateLaneSet("childLaneSet", lane.getElements(), ctx));
            }
            laneSet.appendChild(laneElement);
        }
        return laneSet;
    }

    private Element generateFlow(Connection connection, GenerationContext ctx) {
        FlowKind kind = FlowKind.of(connection.getConnector());
        Element flow = ctx.bpmn(kind.getElementName());
        flow.setAttribute("id", ctx.ids().idFor(connection, kind.getIdBase()));
        flow.setAttribute("sourceRef", endpointId(connection.getSource(), ctx.ids()));
        flow.setAttribute("targetRef", endpointId(connection.getTarget(), ctx.ids()));

        switch (kind) {
            case SEQUENCE_FLOW, MESSAGE_FLOW -> {
                if (connection.hasLabel()) {
                    flow.setAttribute("name", connection.getLabel());
                }
            }
            case ASSOCIATION -> flow.setAttribute("associationDirection",
                    connection.getConnector() == Connector.DIRECTED_ASSOCIATION ? "One" : "None");
        }
        return flow;
    }

    private static String endpointId(NodeReference reference, IdRegistry ids) {
        if (reference == null || !reference.isResolved()) {
            return "";
        }
        Node node = reference.getRef();
        return ids.idFor(node, node.getName());
    }

    /**
     * Every pool gets a participant. Pools without elements have no process, so their
     * participant carries no processRef.
     */
    private Element generateCollaboration(ModelPartition partition, GenerationContext ctx) {
        IdRegistry ids = ctx.ids();
        Element collaboration = ctx.bpmn("collaboration");
        collaboration.setAttribute("id", ids.nextId("Collaboration"));

        Map<Pool, ProcessGroup> groupsByPool = new IdentityHashMap<>();
        for (ProcessGroup group : partition.groups()) {
            if (!group.isGlobal()) {
                groupsByPool.put(group.pool(), group);
            }
        }

        for (Pool pool : partition.pools()) {
            Element participant = ctx.bpmn("participant");
            participant.setAttribute("id", ids.idFor(pool, pool.getName()));
            participant.setAttribute("name", pool.getName());
            ProcessGroup group = groupsByPool.get(pool);
            if (group != null) {
                participant.setAttribute("processRef", ids.existingId(group));
            }
            collaboration.appendChild(participant);
        }
        for (Connection messageFlow : partition.messageFlows()) {
            collaboration.appendChild(generateFlow(messageFlow, ctx));
        }
        return collaboration;
    }

    private Element generateDiagram(String planeElementId, List<Element> shapes, List<Element> edges,
                                    GenerationContext ctx) {
        Element diagram = ctx.bpmndi("BPMNDiagram");
        diagram.setAttribute("id", ctx.ids().nextId("BPMNDiagram"));

        Element plane = ctx.bpmndi("BPMNPlane");
        plane.setAttribute("id", ctx.ids().nextId("BPMNPlane"));
        plane.setAttribute("bpmnElement", planeElementId);
        shapes.forEach(plane::appendChild);
        edges.forEach(plane::appendChild);

        diagram.appendChild(plane);
        return diagram;
    }

    private Element generateShape(String elementId, Bounds bounds, GenerationContext ctx) {
        Element shape = ctx.bpmndi("BPMNShape");
        shape.setAttribute("id", elementId + "_di");
        shape.setAttribute("bpmnElement", elementId);

        Element dcBounds = ctx.dc("Bounds");
        dcBounds.setAttribute("x", String.valueOf(bounds.x()));
        dcBounds.setAttribute("y", String.valueOf(bounds.y()));
        dcBounds.setAttribute("width", String.valueOf(bounds.width()));
        dcBounds.setAttribute("height", String.valueOf(bounds.height()));
        shape.appendChild(dcBounds);
        return shape;
    }

    private Element generateEdge(Connection connection, GenerationContext ctx) {
        String flowId = ctx.ids().existingId(connection);
        Element edge = ctx.bpmndi("BPMNEdge");
        edge.setAttribute("id", flowId + "_di");
        edge.setAttribute("bpmnElement", flowId);
        edge.appendChild(waypoint(ctx.layout().anchorOf(connection.getSource()), ctx));
        edge.appendChild(waypoint(ctx.layout().anchorOf(connection.getTarget()), ctx));
        return edge;
    }

    private static Element waypoint(Waypoint point, GenerationContext ctx) {
        Element waypoint = ctx.di("waypoint");
        waypoint.setAttribute("x", String.valueOf(point.x()));
        waypoint.setAttribute("y", String.valueOf(point.y()));
        return waypoint;
    }

    static String elementName(Node node) {
        return switch (node.kind()) {
            case EVENT -> switch (((Event) node).getEffectiveEventType()) {
                case START -> "startEvent";
                case END -> "endEvent";
                case CATCH -> "intermediateCatchEvent";
                case INTERMEDIATE, THROW -> "intermediateThrowEvent";
            };
            case TASK -> switch (((Task) node).getEffectiveTaskType()) {
                case TASK -> "task";
                case USER -> "userTask";
                case SERVICE -> "serviceTask";
                case MANUAL -> "manualTask";
                case SCRIPT -> "scriptTask";
                case SEND -> "sendTask";
                case RECEIVE -> "receiveTask";
                case BUSINESS_RULE -> "businessRuleTask";
            };
            case GATEWAY -> switch (((Gateway) node).getEffectiveGatewayType()) {
                case EXCLUSIVE -> "exclusiveGateway";
                case PARALLEL -> "parallelGateway";
                case INCLUSIVE -> "inclusiveGateway";
                case EVENT_BASED -> "eventBasedGateway";
                case COMPLEX -> "complexGateway";
            };
            default -> throw new IllegalArgumentException("Not a flow node: " + node);
        };
    }

    private static Document newDocument() {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            return factory.newDocumentBuilder().newDocument();
        } catch (ParserConfigurationException e) {
            throw new RuntimeException("Failed to create XML document builder", e);
        }
    }
}
