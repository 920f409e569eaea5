package com.mrpsimulator.service;

import com.mrpsimulator.dto.ScenarioJobResponse;
import com.mrpsimulator.dto.ScenarioJobStatus;
import com.mrpsimulator.dto.ScenarioRequest;
import com.mrpsimulator.dto.ScenarioResponse;
import com.mrpsimulator.exception.JobNotFoundException;
import com.mrpsimulator.exception.ScenarioCancelledException;
import com.mrpsimulator.exception.SnapshotNotLoadedException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ScenarioJobServiceTest {

    @Mock ScenarioOrchestrator orchestrator;
    @InjectMocks ScenarioJobService jobService;

    private final ScenarioRequest params = ScenarioRequest.builder().horizonDays(14).build();

    @BeforeEach
    void setUp() {
        ReflectionTestUtils.setField(jobService, "poolSize", 1);
        ReflectionTestUtils.setField(jobService, "maxRetained", 10);
        jobService.init();
    }

    @AfterEach
    void tearDown() {
        jobService.shutdown();
    }

    private ScenarioJobResponse awaitFinished(UUID jobId) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        ScenarioJobResponse job = jobService.getJob(jobId);
        while (System.currentTimeMillis() < deadline
                && (job.getStatus() == ScenarioJobStatus.QUEUED || job.getStatus() == ScenarioJobStatus.RUNNING)) {
            Thread.sleep(10);
            job = jobService.getJob(jobId);
        }
        return job;
    }

    @Test
    void submit_runsScenarioAndKeepsResult() throws Exception {
        ScenarioResponse result = ScenarioResponse.builder()
            .generatedAt(Instant.now()).snapshotVersion(3).sequence(List.of()).saturation(List.of())
            .bottlenecks(List.of()).build();
        when(orchestrator.calculateScenario(any())).thenReturn(result);

        UUID jobId = jobService.submit(params, "req-1");
        ScenarioJobResponse job = awaitFinished(jobId);

        assertThat(job.getStatus()).isEqualTo(ScenarioJobStatus.COMPLETED);
        assertThat(job.getResult()).isSameAs(result);
        assertThat(job.getRequestId()).isEqualTo("req-1");
        assertThat(job.getParameters().getHorizonDays()).isEqualTo(14);
    }

    @Test
    void submit_failingScenarioIsReportedOnJob() throws Exception {
        when(orchestrator.calculateScenario(any())).thenThrow(new SnapshotNotLoadedException());

        ScenarioJobResponse job = awaitFinished(jobService.submit(params, "req-2"));

        assertThat(job.getStatus()).isEqualTo(ScenarioJobStatus.FAILED);
        assertThat(job.getMessage()).contains("No planning snapshot loaded");
        assertThat(job.getResult()).isNull();
    }

    @Test
    void cancel_interruptsRunningScenario() throws Exception {
        CountDownLatch running = new CountDownLatch(1);
        CountDownLatch interrupted = new CountDownLatch(1);
        when(orchestrator.calculateScenario(any())).thenAnswer(invocation -> {
            running.countDown();
            try {
                new CountDownLatch(1).await();
            } catch (InterruptedException ex) {
                interrupted.countDown();
                throw new ScenarioCancelledException(1);
            }
            return null;
        });

        UUID jobId = jobService.submit(params, "req-3");
        assertThat(running.await(5, TimeUnit.SECONDS)).isTrue();
        ScenarioJobResponse cancelled = jobService.cancel(jobId);

        assertThat(cancelled.getStatus()).isEqualTo(ScenarioJobStatus.CANCELLED);
        assertThat(interrupted.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(jobService.getJob(jobId).getStatus()).isEqualTo(ScenarioJobStatus.CANCELLED);
    }

    @Test
    void getJob_unknownId_fails() {
        assertThatThrownBy(() -> jobService.getJob(UUID.randomUUID())).isInstanceOf(JobNotFoundException.class);
    }
}
