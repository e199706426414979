package me.golemcore.agent.domain.event;

import me.golemcore.agent.domain.model.RunCancellation;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HumanInputTest {

    private DefaultEventCoordinator coordinator;

    @BeforeEach
    void setUp() {
        coordinator = new DefaultEventCoordinator();
    }

    @AfterEach
    void tearDown() {
        coordinator.close();
    }

    @Test
    void shouldAskClarificationThroughAmbientCoordinator() {
        coordinator.addListener(event -> {
            if (event instanceof CoordinationRequest request && request.kind() == CoordinationKind.CLARIFICATION) {
                coordinator.resolve(request.id(), CoordinationResponse.answer(request.id(), "use staging"));
            }
        });

        CoordinationOutcome outcome;
        try (AmbientEventCoordinator.Scope ignored = AmbientEventCoordinator.open(coordinator)) {
            outcome = HumanInput.askClarification("deploy", "Which environment?", Duration.ofSeconds(5),
                    RunCancellation.none());
        }

        assertEquals("use staging", outcome.response().answer());
    }

    @Test
    void shouldRequestPermissionWithPayload() {
        coordinator.addListener(event -> {
            if (event instanceof CoordinationRequest request && request.kind() == CoordinationKind.PERMISSION) {
                boolean safe = !"prod".equals(((Map<?, ?>) request.payload().get("arguments")).get("target"));
                coordinator.resolve(request.id(), safe
                        ? CoordinationResponse.approve(request.id())
                        : CoordinationResponse.deny(request.id()));
            }
        });

        try (AmbientEventCoordinator.Scope ignored = AmbientEventCoordinator.open(coordinator)) {
            assertTrue(HumanInput.requestPermission("deploy", "Deploy?", Map.of("target", "dev"),
                    Duration.ofSeconds(5), RunCancellation.none()).isApproved());
            assertTrue(HumanInput.requestPermission("deploy", "Deploy?", Map.of("target", "prod"),
                    Duration.ofSeconds(5), RunCancellation.none()).isResolved());
        }
    }

    @Test
    void shouldReportProgress() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);
        coordinator.addListener(event -> {
            if (event instanceof ProgressEvent progress && "50%".equals(progress.message())) {
                latch.countDown();
            }
        });

        try (AmbientEventCoordinator.Scope ignored = AmbientEventCoordinator.open(coordinator)) {
            HumanInput.reportProgress("indexer", "50%");
        }

        assertTrue(latch.await(2, TimeUnit.SECONDS));
    }

    @Test
    void shouldFailWithoutActiveCoordinator() {
        assertThrows(IllegalStateException.class, () -> HumanInput.askClarification("deploy", "?",
                Duration.ofMillis(10), RunCancellation.none()));
    }
}
