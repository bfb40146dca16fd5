package com.harvey.backend.service.training;

import com.harvey.backend.config.TrainingProperties;
import com.harvey.backend.dto.PipelineRunSummary;
import com.harvey.backend.exception.RollbackFailureException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.context.ConfigurableApplicationContext;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class TrainingCommandRunnerTest {

    private TrainingProperties properties;
    private TrainingPipeline pipeline;
    private TrainingCommandRunner runner;

    @BeforeEach
    void setUp() {
        properties = new TrainingProperties();
        properties.setExitAfterRun(false);
        pipeline = mock(TrainingPipeline.class);
        runner = new TrainingCommandRunner(properties, pipeline, mock(ConfigurableApplicationContext.class));
    }

    @Test
    void exitCodeFollowsRunStatus() {
        assertThat(runner.execute(() -> summary(RunStatus.HEALTHY))).isEqualTo(TrainingCommandRunner.EXIT_OK);
        assertThat(runner.execute(() -> summary(RunStatus.ROLLED_BACK)))
                .isEqualTo(TrainingCommandRunner.EXIT_NEEDS_ATTENTION);
        assertThat(runner.execute(() -> summary(RunStatus.PREREQUISITES_FAILED)))
                .isEqualTo(TrainingCommandRunner.EXIT_NEEDS_ATTENTION);
        assertThat(runner.execute(() -> {
            throw new RollbackFailureException("copy failed");
        })).isEqualTo(TrainingCommandRunner.EXIT_ROLLBACK_FAILED);
    }

    @Test
    void onceModeRunsForcedFullPipeline() {
        properties.setMode(TrainingProperties.Mode.ONCE);
        properties.setForce(true);
        when(pipeline.runFull(true)).thenReturn(summary(RunStatus.HEALTHY));

        runner.run(new DefaultApplicationArguments());

        verify(pipeline).runFull(true);
        verify(pipeline, never()).runIncremental();
    }

    @Test
    void incrementalModeRunsIncrementalPipeline() {
        properties.setMode(TrainingProperties.Mode.INCREMENTAL);
        when(pipeline.runIncremental()).thenReturn(summary(RunStatus.HEALTHY));

        runner.run(new DefaultApplicationArguments());

        verify(pipeline).runIncremental();
    }

    @Test
    void serverModeDoesNothing() {
        runner.run(new DefaultApplicationArguments());

        verifyNoInteractions(pipeline);
    }

    private PipelineRunSummary summary(RunStatus status) {
        return PipelineRunSummary.builder()
                .runId("run-1")
                .mode(PipelineMode.FULL)
                .status(status)
                .build();
    }
}
