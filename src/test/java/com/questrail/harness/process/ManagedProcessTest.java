package com.questrail.harness.process;

import com.questrail.harness.api.ProcessTerminationException;
import com.questrail.harness.api.ServiceEndpoint;
import com.questrail.harness.config.ReadinessTimingPolicy;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ManagedProcessTest {

    private static ManagedProcess manage(FakeLaunchedProcess process) {
        return new ManagedProcess(process, ServiceEndpoint.loopback(50_200), ReadinessTimingPolicy.defaults());
    }

    @Test
    void cooperativeProcessStopsOnTerminationRequest() {
        FakeLaunchedProcess fake = FakeLaunchedProcess.running();
        ManagedProcess managed = manage(fake);

        managed.stop();

        assertTrue(managed.isStopped());
        assertFalse(managed.isAlive());
        assertEquals(1, fake.terminationRequests());
        assertEquals(0, fake.forcedTerminations());
        assertEquals(143, managed.exitCode().getAsInt());
    }

    @Test
    void secondStopIsANoOp() {
        FakeLaunchedProcess fake = FakeLaunchedProcess.running();
        ManagedProcess managed = manage(fake);

        managed.stop();
        managed.stop();

        assertEquals(1, fake.terminationRequests());
        assertEquals(0, fake.forcedTerminations());
    }

    @Test
    void stubbornProcessIsKilled() {
        FakeLaunchedProcess fake = FakeLaunchedProcess.running().ignoreTermination();
        ManagedProcess managed = manage(fake);

        managed.stop();

        assertTrue(managed.isStopped());
        assertEquals(1, fake.forcedTerminations());
        assertEquals(137, managed.exitCode().getAsInt());
    }

    @Test
    void alreadyExitedProcessNeedsNoSignal() {
        FakeLaunchedProcess fake = FakeLaunchedProcess.exited(4, "config parse error\n");
        ManagedProcess managed = manage(fake);

        managed.stop();

        assertTrue(managed.isStopped());
        assertEquals(0, fake.terminationRequests());
        assertEquals("config parse error\n", managed.output().stderr());
    }

    @Test
    void unkillableProcessIsReportedAndStopCanBeRetried() {
        FakeLaunchedProcess fake = FakeLaunchedProcess.running().unkillable();
        ManagedProcess managed = manage(fake);

        ProcessTerminationException e = assertThrows(ProcessTerminationException.class, managed::stop);
        assertEquals(fake.pid(), e.pid());
        assertFalse(managed.isStopped());

        fake.killable();
        managed.stop();

        assertTrue(managed.isStopped());
        assertFalse(managed.isAlive());
    }

    @Test
    void closeStopsTheProcess() {
        FakeLaunchedProcess fake = FakeLaunchedProcess.running();
        try (ManagedProcess managed = manage(fake)) {
            assertTrue(managed.isAlive());
        }
        assertFalse(fake.isAlive());
    }

    @Test
    void closeStopsTheProcessWhenTheBodyThrows() {
        FakeLaunchedProcess fake = FakeLaunchedProcess.running();
        ManagedProcess[] held = new ManagedProcess[1];

        IllegalStateException thrown = assertThrows(IllegalStateException.class, () -> {
            try (ManagedProcess managed = manage(fake)) {
                held[0] = managed;
                throw new IllegalStateException("signal store rejected write");
            }
        });

        assertEquals("signal store rejected write", thrown.getMessage());
        assertTrue(held[0].isStopped());
        assertFalse(fake.isAlive());
        assertEquals(1, fake.terminationRequests());
    }

    @Test
    void teardownFailureIsSuppressedBehindTheBodyFailure() {
        FakeLaunchedProcess fake = FakeLaunchedProcess.running().unkillable();

        IllegalStateException thrown = assertThrows(IllegalStateException.class, () -> {
            try (ManagedProcess ignored = manage(fake)) {
                throw new IllegalStateException("endpoint call failed");
            }
        });

        assertEquals(1, thrown.getSuppressed().length);
        assertInstanceOf(ProcessTerminationException.class, thrown.getSuppressed()[0]);
        fake.killable().forceTermination();
    }

    @Test
    void outputIsLiveUntilStoppedThenFinal() {
        FakeLaunchedProcess fake = FakeLaunchedProcess.running();
        ManagedProcess managed = manage(fake);

        fake.writeStdout("listening on 127.0.0.1:50200\n");
        assertEquals("listening on 127.0.0.1:50200\n", managed.output().stdout());

        managed.stop();
        fake.writeStdout("late line\n");

        assertEquals("listening on 127.0.0.1:50200\n", managed.output().stdout());
    }
}
