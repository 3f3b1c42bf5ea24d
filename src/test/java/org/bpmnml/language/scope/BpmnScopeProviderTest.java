package org.bpmnml.language.scope;

import org.bpmnml.language.model.BpmnModel;
import org.bpmnml.language.model.Connection;
import org.bpmnml.language.model.Connector;
import org.bpmnml.language.model.Event;
import org.bpmnml.language.model.Lane;
import org.bpmnml.language.model.Node;
import org.bpmnml.language.model.Pool;
import org.bpmnml.language.model.Task;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BpmnScopeProviderTest {
    private final BpmnScopeProvider provider = new BpmnScopeProvider();

    @Test
    @SuppressWarnings("deprecation")
    void shouldDefaultToPoolWideMode() {
        assertEquals(ScopeMode.POOL_WIDE, provider.getMode());
        assertEquals(ScopeMode.LANE_LOCAL, new BpmnScopeProvider(ScopeMode.LANE_LOCAL).getMode());
    }

    @Test
    void shouldOnlySeeRootNodesFromGlobalConnection() {
        Event start = Event.start("Start");
        Task pooled = Task.of("Pooled");
        Connection connection = Connection.between("Start", Connector.SEQUENCE, "Pooled");
        BpmnModel.of(start, Pool.of("P", pooled), connection);

        NodeScope scope = provider.getScope(connection, ReferenceProperty.TARGET);

        assertEquals(List.of(start), scope.getCandidates());
        assertTrue(scope.lookup("Pooled").isEmpty());
    }

    @Test
    void shouldSeeWholePoolIncludingNestedLanes() {
        Task a = Task.of("A");
        Task b = Task.of("B");
        Task c = Task.of("C");
        Connection connection = Connection.between("A", Connector.SEQUENCE, "C");
        Pool pool = Pool.of("P", a, connection, Lane.of("L1", b, Lane.of("L2", c)));
        BpmnModel.of(Event.start("Global"), pool, Pool.of("Other", Task.of("D")));

        NodeScope scope = provider.getScope(connection, ReferenceProperty.SOURCE);

        assertEquals(List.of(a, b, c), scope.getCandidates());
    }

    @Test
    void shouldSeeSiblingLanesFromInsideALane() {
        Task a = Task.of("A");
        Task b = Task.of("B");
        Connection connection = Connection.between("A", Connector.SEQUENCE, "B");
        Pool pool = Pool.of("P", Lane.of("L1", a, connection), Lane.of("L2", b));
        BpmnModel.of(pool);

        NodeScope scope = provider.getScope(connection, ReferenceProperty.TARGET);

        assertTrue(scope.contains(a));
        assertTrue(scope.contains(b));
        assertSame(b, scope.lookup("B").orElseThrow());
    }

    @Test
    void shouldSeeAllPooledNodesForMessageFlow() {
        Task a = Task.of("A");
        Task b = Task.of("B");
        Task c = Task.of("C");
        Event global = Event.start("Global");
        Connection messageFlow = Connection.between("A", Connector.MESSAGE, "B");
        BpmnModel.of(global, Pool.of("P1", a), Pool.of("P2", Lane.of("L", b)), Pool.of("P3", c), messageFlow);

        NodeScope scope = provider.getScope(messageFlow, ReferenceProperty.TARGET);

        assertEquals(List.of(a, b, c), scope.getCandidates());
        assertFalse(scope.contains(global));
    }

    @Test
    void shouldSeeAllPooledNodesForMessageFlowDeclaredInsideAPool() {
        Task a = Task.of("A");
        Task b = Task.of("B");
        Connection messageFlow = Connection.between("A", Connector.MESSAGE, "B");
        BpmnModel.of(Pool.of("P1", a, messageFlow), Pool.of("P2", b));

        NodeScope scope = provider.getScope(messageFlow, ReferenceProperty.TARGET);

        assertSame(b, scope.lookup("B").orElseThrow());
    }

    @Test
    void shouldKeepDuplicateNamesAsSeparateCandidates() {
        Task first = Task.of("A");
        Task second = Task.of("A");
        Connection connection = Connection.between("A", Connector.SEQUENCE, "A");
        BpmnModel.of(Pool.of("P", Lane.of("L1", first), Lane.of("L2", second), connection));

        NodeScope scope = provider.getScope(connection, ReferenceProperty.SOURCE);

        assertEquals(2, scope.size());
        assertSame(first, scope.lookup("A").orElseThrow());
    }

    @Test
    @SuppressWarnings("deprecation")
    void shouldRestrictToLaneInLaneLocalMode() {
        BpmnScopeProvider legacy = new BpmnScopeProvider(ScopeMode.LANE_LOCAL);
        Task a = Task.of("A");
        Task b = Task.of("B");
        Connection connection = Connection.between("A", Connector.SEQUENCE, "B");
        BpmnModel.of(Pool.of("P", Lane.of("L1", a, connection), Lane.of("L2", b)));

        NodeScope scope = legacy.getScope(connection, ReferenceProperty.TARGET);

        assertEquals(List.<Node>of(a), scope.getCandidates());
    }

    @Test
    @SuppressWarnings("deprecation")
    void shouldTreatMessageFlowLikeAnyConnectionInLaneLocalMode() {
        BpmnScopeProvider legacy = new BpmnScopeProvider(ScopeMode.LANE_LOCAL);
        Task a = Task.of("A");
        Task b = Task.of("B");
        Connection messageFlow = Connection.between("A", Connector.MESSAGE, "B");
        BpmnModel.of(Pool.of("P1", a, messageFlow), Pool.of("P2", b));

        NodeScope scope = legacy.getScope(messageFlow, ReferenceProperty.TARGET);

        assertTrue(scope.lookup("B").isEmpty());
    }
}
