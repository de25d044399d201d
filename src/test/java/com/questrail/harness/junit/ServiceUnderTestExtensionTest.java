package com.questrail.harness.junit;

import com.questrail.harness.api.ServiceEndpoint;
import com.questrail.harness.fake.FakeServers;
import com.questrail.harness.process.ManagedProcess;
import com.questrail.harness.runtime.ServiceSupervisor;
import io.grpc.ManagedChannel;
import io.grpc.health.v1.HealthCheckRequest;
import io.grpc.health.v1.HealthCheckResponse;
import io.grpc.health.v1.HealthGrpc;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ServiceUnderTestExtensionTest {

    private static final List<ManagedProcess> SEEN = new ArrayList<>();
    private static final List<ManagedChannel> CHANNELS = new ArrayList<>();

    @RegisterExtension
    static final ServiceUnderTestExtension server = new ServiceUnderTestExtension(() ->
            ServiceSupervisor.builder(FakeServers.config("serve").build()).build());

    @AfterAll
    static void everythingWasTornDown() {
        assertFalse(SEEN.isEmpty());
        for (ManagedProcess process : SEEN) {
            assertTrue(process.isStopped(), process.toString());
            assertFalse(process.isAlive(), process.toString());
        }
        for (ManagedChannel channel : CHANNELS) {
            assertTrue(channel.isShutdown());
        }
    }

    @Test
    void endpointAndProcessBelongToTheSameRun(ManagedProcess process, ServiceEndpoint endpoint) {
        SEEN.add(process);

        assertTrue(process.isAlive());
        assertEquals(process.endpoint(), endpoint);
    }

    @Test
    void channelTalksToTheReadyService(ManagedChannel channel, ManagedProcess process) {
        SEEN.add(process);
        CHANNELS.add(channel);

        HealthCheckResponse response = HealthGrpc.newBlockingStub(channel)
                .withDeadlineAfter(5, TimeUnit.SECONDS)
                .check(HealthCheckRequest.getDefaultInstance());

        assertEquals(HealthCheckResponse.ServingStatus.SERVING, response.getStatus());
    }
}
