package org.bpmnml.language.scope;

import org.bpmnml.language.model.BpmnModel;
import org.bpmnml.language.model.Connection;
import org.bpmnml.language.model.Connector;
import org.bpmnml.language.model.Event;
import org.bpmnml.language.model.Lane;
import org.bpmnml.language.model.NodeReference;
import org.bpmnml.language.model.Pool;
import org.bpmnml.language.model.Task;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ModelLinkerTest {
    private final ModelLinker linker = new ModelLinker(new BpmnScopeProvider());

    @Test
    void shouldResolveGlobalConnection() {
        Event start = Event.start("Start");
        Event end = Event.end("End");
        Connection connection = Connection.between("Start", Connector.SEQUENCE, "End");
        BpmnModel model = BpmnModel.of(start, end, connection);

        int unresolved = linker.link(model);

        assertEquals(0, unresolved);
        assertSame(start, connection.getSource().getRef());
        assertSame(end, connection.getTarget().getRef());
    }

    @Test
    void shouldResolveAcrossLanesOfTheSamePool() {
        Task a = Task.of("A");
        Task b = Task.of("B");
        Connection connection = Connection.between("A", Connector.SEQUENCE, "B");
        BpmnModel model = BpmnModel.of(Pool.of("P", Lane.of("L1", a, connection), Lane.of("L2", b)));

        assertEquals(0, linker.link(model));
        assertSame(b, connection.getTarget().getRef());
    }

    @Test
    void shouldLeaveReferenceIntoOtherPoolUnresolved() {
        Task a = Task.of("A");
        Connection connection = Connection.between("A", Connector.SEQUENCE, "B");
        BpmnModel model = BpmnModel.of(Pool.of("P1", a, connection), Pool.of("P2", Task.of("B")));

        int unresolved = linker.link(model);

        assertEquals(1, unresolved);
        assertTrue(connection.getSource().isResolved());
        assertFalse(connection.getTarget().isResolved());
    }

    @Test
    void shouldCountMissingReferencesAsUnresolved() {
        Task a = Task.of("A");
        Connection connection = new Connection(new NodeReference("A"), Connector.SEQUENCE, null, null);
        BpmnModel model = BpmnModel.of(a, connection);

        assertEquals(1, linker.link(model));
        assertSame(a, connection.getSource().getRef());
    }

    @Test
    void shouldKeepAlreadyResolvedReferences() {
        Task a = Task.of("A");
        Task b = Task.of("B");
        Connection connection = Connection.linking(a, Connector.SEQUENCE, b);
        BpmnModel model = BpmnModel.of(Pool.of("P1", a, connection), Pool.of("P2", b));

        assertEquals(0, linker.link(model));
        assertSame(b, connection.getTarget().getRef());
    }
}
