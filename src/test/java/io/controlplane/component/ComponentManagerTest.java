package io.controlplane.component;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Tests for ComponentManager.
 */
class ComponentManagerTest {

    @Mock
    private Component certs;

    @Mock
    private Component storage;

    @Mock
    private Component apiServer;

    @Mock
    private Component scheduler;

    private ComponentManager manager;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        manager = new ComponentManager();
    }

    @Test
    void testInitRunsSyncGroupBeforeAsyncGroup() throws Exception {
        manager.add(storage);
        manager.addSync(certs);
        manager.add(apiServer);

        manager.init();

        InOrder order = inOrder(certs, storage, apiServer);
        order.verify(certs).init();
        order.verify(storage).init();
        order.verify(apiServer).init();
    }

    @Test
    void testInitFailsFast() throws Exception {
        manager.addSync(certs);
        manager.add(storage);
        manager.add(apiServer);
        doThrow(new ComponentException("disk full")).when(storage).init();

        assertThatThrownBy(() -> manager.init())
            .isInstanceOf(ComponentException.class)
            .hasMessage("disk full");

        verify(certs).init();
        verify(apiServer, never()).init();
    }

    @Test
    void testInitWrapsRuntimeFailure() throws Exception {
        manager.add(storage);
        doThrow(new IllegalStateException("boom")).when(storage).init();

        assertThatThrownBy(() -> manager.init())
            .isInstanceOf(ComponentException.class)
            .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void testStartIsBestEffortAndReportsFirstError() throws Exception {
        manager.add(storage);
        manager.add(apiServer);
        manager.add(scheduler);
        manager.init();
        doThrow(new ComponentException("storage down")).when(storage).run();
        doThrow(new ComponentException("api down")).when(apiServer).run();

        assertThatThrownBy(() -> manager.start())
            .isInstanceOf(ComponentException.class)
            .hasMessage("storage down");

        verify(scheduler).run();
    }

    @Test
    void testStartOnlyRunsInitializedComponents() throws Exception {
        manager.add(storage);
        manager.add(apiServer);
        doThrow(new ComponentException("bad")).when(apiServer).init();
        assertThatThrownBy(() -> manager.init()).isInstanceOf(ComponentException.class);

        manager.start();

        verify(storage).run();
        verify(apiServer, never()).run();
    }

    @Test
    void testStopRunsInReverseOrderAndContinuesOnFailure() throws Exception {
        manager.addSync(certs);
        manager.add(storage);
        manager.add(apiServer);
        doThrow(new ComponentException("stuck")).when(storage).stop();

        assertThatThrownBy(() -> manager.stop())
            .isInstanceOf(ComponentException.class)
            .hasMessageContaining("1 component(s)");

        InOrder order = inOrder(apiServer, storage, certs);
        order.verify(apiServer).stop();
        order.verify(storage).stop();
        order.verify(certs).stop();
    }

    @Test
    void testComponentAddedAfterInitIsStoppedFirst() throws Exception {
        manager.add(storage);
        manager.init();
        manager.start();

        manager.add(scheduler);
        manager.stop();

        InOrder order = inOrder(scheduler, storage);
        order.verify(scheduler).stop();
        order.verify(storage).stop();
        verify(scheduler, never()).init();
        verify(scheduler, never()).run();
    }

    @Test
    void testAddSyncAfterInitIsRejected() throws Exception {
        manager.init();

        assertThatThrownBy(() -> manager.addSync(certs))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testGetComponentsReturnsCombinedOrder() {
        manager.add(storage);
        manager.addSync(certs);

        List<Component> components = manager.getComponents();

        assertThat(components).containsExactly(certs, storage);
        assertThat(manager.getSyncComponents()).containsExactly(certs);
    }
}
