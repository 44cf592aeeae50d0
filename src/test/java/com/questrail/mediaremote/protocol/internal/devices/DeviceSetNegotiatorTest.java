package com.questrail.mediaremote.protocol.internal.devices;

import com.questrail.mediaremote.protocol.model.ModifyOutputContextRequest;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DeviceSetNegotiatorTest {

    @Test
    void setThenAddInOneRequest() {
        DeviceSetNegotiator negotiator = new DeviceSetNegotiator();

        NegotiationResult result = negotiator.apply(ModifyOutputContextRequest.builder()
                .setting("A", "B")
                .adding("C")
                .build());

        DeviceSetChange endpoint = result.endpoint();
        assertEquals(Set.of("A", "B", "C"), endpoint.members());
        assertEquals(Set.of("C"), endpoint.added());
        assertTrue(endpoint.removed().isEmpty());
        assertTrue(endpoint.replaced());
        assertEquals(Set.of("A", "B", "C"), endpoint.netAdded());
        assertEquals(Set.of("A", "B", "C"), negotiator.endpointDevices());
    }

    @Test
    void replaceMeasuresDeltasAgainstTheReplacement() {
        DeviceSetNegotiator negotiator = new DeviceSetNegotiator();
        negotiator.apply(ModifyOutputContextRequest.builder().setting("A", "B").build());

        DeviceSetChange change = negotiator.apply(ModifyOutputContextRequest.builder()
                .setting("B", "C")
                .removing("C")
                .build()).endpoint();

        assertEquals(Set.of("B"), change.members());
        assertTrue(change.added().isEmpty());
        assertEquals(Set.of("C"), change.removed());
        assertTrue(change.netAdded().isEmpty());
        assertEquals(Set.of("A"), change.netRemoved());
    }

    @Test
    void removeWinsOverAddInTheSameRequest() {
        DeviceSetNegotiator negotiator = new DeviceSetNegotiator();

        DeviceSetChange change = negotiator.apply(ModifyOutputContextRequest.builder()
                .adding("A", "B")
                .removing("B")
                .build()).endpoint();

        assertEquals(Set.of("A"), change.members());
        assertFalse(change.replaced());
    }

    @Test
    void addIsIdempotentAndUnknownRemoveIsIgnored() {
        DeviceSetNegotiator negotiator = new DeviceSetNegotiator();
        negotiator.apply(ModifyOutputContextRequest.builder().adding("A").build());

        NegotiationResult again = negotiator.apply(ModifyOutputContextRequest.builder()
                .adding("A")
                .removing("Z")
                .build());

        assertFalse(again.changed());
        assertTrue(again.endpoint().added().isEmpty());
        assertEquals(Set.of("A"), negotiator.endpointDevices());
    }

    @Test
    void membershipKeepsFirstInsertionOrder() {
        DeviceSetNegotiator negotiator = new DeviceSetNegotiator();
        negotiator.apply(ModifyOutputContextRequest.builder().adding("C", "A").build());
        negotiator.apply(ModifyOutputContextRequest.builder().adding("B", "A").build());

        assertEquals(List.of("C", "A", "B"), List.copyOf(negotiator.endpointDevices()));
    }

    @Test
    void clusterSetIsIndependentOfEndpointSet() {
        DeviceSetNegotiator negotiator = new DeviceSetNegotiator();

        NegotiationResult result = negotiator.apply(ModifyOutputContextRequest.builder()
                .adding("A")
                .clusterAwareSetting("X", "Y")
                .build());

        assertEquals(Set.of("A"), negotiator.devices(DeviceScope.ENDPOINT));
        assertEquals(Set.of("X", "Y"), negotiator.devices(DeviceScope.CLUSTER));
        assertEquals(DeviceScope.CLUSTER, result.change(DeviceScope.CLUSTER).scope());
        assertTrue(result.cluster().replaced());

        NegotiationResult second = negotiator.apply(ModifyOutputContextRequest.builder()
                .clusterAwareRemoving("X")
                .build());

        assertFalse(second.endpoint().changed());
        assertEquals(Set.of("X"), second.cluster().removed());
        assertEquals(Set.of("A"), negotiator.endpointDevices());
    }

    @Test
    void convenienceFactoriesAddressBothScopes() {
        DeviceSetNegotiator negotiator = new DeviceSetNegotiator();

        negotiator.apply(ModifyOutputContextRequest.addDevices("A", "B"));
        negotiator.apply(ModifyOutputContextRequest.removeDevices("A"));

        assertEquals(Set.of("B"), negotiator.endpointDevices());
        assertEquals(Set.of("B"), negotiator.clusterDevices());
    }

    @Test
    void emptyRequestChangesNothing() {
        DeviceSetNegotiator negotiator = new DeviceSetNegotiator();
        negotiator.apply(ModifyOutputContextRequest.setDevices("A"));

        NegotiationResult result = negotiator.apply(ModifyOutputContextRequest.builder().build());

        assertFalse(result.changed());
        assertEquals(Set.of("A"), result.endpoint().members());
    }
}
