package com.libragraph.workqueue.test;

import com.libragraph.workqueue.core.service.ManagedService;
import com.libragraph.workqueue.core.service.ServiceStateChangedEvent;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

@QuarkusTest
class ServiceStateEventTest {

    @Inject
    TestService testService;

    @Inject
    EventCollector eventCollector;

    @BeforeEach
    void setUp() throws Exception {
        testService.stop();
        eventCollector.clear();
    }

    @AfterEach
    void tearDown() throws Exception {
        testService.stop();
    }

    @Test
    void startingServiceFiresEvents() throws Exception {
        testService.start();

        assertThat(eventCollector.eventsFor("test-service"))
                .extracting(ServiceStateChangedEvent::newState)
                .containsExactly(ManagedService.State.STARTING, ManagedService.State.RUNNING);
    }

    @Test
    void stoppingServiceFiresEvents() throws Exception {
        testService.start();
        eventCollector.clear();

        testService.stop();

        assertThat(eventCollector.eventsFor("test-service"))
                .extracting(ServiceStateChangedEvent::newState)
                .containsExactly(ManagedService.State.STOPPING, ManagedService.State.STOPPED);
    }

    @Test
    void failingServiceRecordsCause() throws Exception {
        testService.start();
        eventCollector.clear();

        testService.fail(new RuntimeException("boom"));

        assertThat(eventCollector.eventsFor("test-service"))
                .extracting(ServiceStateChangedEvent::newState)
                .containsExactly(ManagedService.State.FAILED);
        assertThat(testService.lastFailure()).hasValueSatisfying(t -> assertThat(t).hasMessage("boom"));
    }

    @Test
    void restartClearsFailure() throws Exception {
        testService.start();
        testService.fail(new RuntimeException("boom"));

        testService.start();

        assertThat(testService.state()).isEqualTo(ManagedService.State.RUNNING);
        assertThat(testService.lastFailure()).isEmpty();
    }

    /** Collects all {@link ServiceStateChangedEvent}s for assertions. */
    @ApplicationScoped
    public static class EventCollector {

        private final List<ServiceStateChangedEvent> events = new CopyOnWriteArrayList<>();

        void onEvent(@Observes ServiceStateChangedEvent event) {
            events.add(event);
        }

        List<ServiceStateChangedEvent> eventsFor(String serviceId) {
            return events.stream()
                    .filter(e -> e.serviceId().equals(serviceId))
                    .toList();
        }

        void clear() {
            events.clear();
        }
    }
}
