package org.bpmnml.generator;

import org.bpmnml.language.model.Connection;
import org.bpmnml.language.model.Connector;
import org.bpmnml.language.model.Event;
import org.bpmnml.language.model.Gateway;
import org.bpmnml.language.model.Node;
import org.bpmnml.language.model.NodeReference;
import org.bpmnml.language.model.Pool;
import org.bpmnml.language.model.Task;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DiagramLayoutTest {

    @Test
    void shouldPlaceNodesLeftToRight() {
        Event start = Event.start("Start");
        Gateway gateway = new Gateway("Check", null);
        Task task = Task.of("Work");
        DiagramLayout layout = new DiagramLayout();

        Bounds participant = layout.layoutGroup(new ProcessGroup(null, List.<Node>of(start, gateway, task), List.of()), 0);

        assertNull(participant);
        assertEquals(new Bounds(100, 80, 36, 36), layout.boundsOf(start));
        assertEquals(new Bounds(280, 80, 50, 50), layout.boundsOf(gateway));
        assertEquals(new Bounds(460, 80, 100, 80), layout.boundsOf(task));
    }

    @Test
    void shouldWrapPoolNodesInPaddedParticipantBox() {
        Event start = Event.start("Start");
        Task task = Task.of("Work");
        Pool pool = Pool.of("P", start, task);
        DiagramLayout layout = new DiagramLayout();

        Bounds participant = layout.layoutGroup(new ProcessGroup(pool, List.<Node>of(start, task), List.of()), 0);

        assertEquals(new Bounds(60, 40, 360, 160), participant);
    }

    @Test
    void shouldPutEachGroupOnItsOwnRow() {
        Task task = Task.of("Work");
        Pool pool = Pool.of("P", task);
        DiagramLayout layout = new DiagramLayout();

        Bounds participant = layout.layoutGroup(new ProcessGroup(pool, List.<Node>of(task), List.of()), 1);

        assertEquals(new Bounds(100, 300, 100, 80), layout.boundsOf(task));
        assertEquals(new Bounds(60, 260, 180, 160), participant);
    }

    @Test
    void shouldNotBoxPoolWithoutNodes() {
        Pool pool = Pool.of("P", Connection.between("A", Connector.SEQUENCE, "B"));

        assertNull(new DiagramLayout().layoutGroup(new ProcessGroup(pool, List.of(), List.of()), 0));
    }

    @Test
    void shouldAnchorEdgesAtRoundedCenters() {
        Event start = Event.start("Start");
        Gateway gateway = new Gateway("Check", null);
        DiagramLayout layout = new DiagramLayout();
        layout.layoutGroup(new ProcessGroup(null, List.<Node>of(start, gateway), List.of()), 0);

        assertEquals(new Waypoint(118, 98), layout.anchorOf(NodeReference.to(start)));
        assertEquals(new Waypoint(305, 105), layout.anchorOf(NodeReference.to(gateway)));
        assertEquals(Waypoint.ORIGIN, layout.anchorOf(new NodeReference("Missing")));
        assertEquals(Waypoint.ORIGIN, layout.anchorOf(null));
        assertEquals(Waypoint.ORIGIN, layout.anchorOf(NodeReference.to(Task.of("Elsewhere"))));
    }

    @Test
    void shouldRoundHalfCentersUp() {
        assertEquals(new Waypoint(3, 3), new Bounds(0, 0, 5, 5).center());
    }
}
