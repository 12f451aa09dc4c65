package com.realtime.ingest.simulator;

import com.realtime.ingest.config.SimulatorConfig;
import com.realtime.ingest.ingest.BatchIngestResult;
import com.realtime.ingest.ingest.IngestResult;
import com.realtime.ingest.ingest.MeasurementIngestionService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Clock;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

class SimulatorRunnerTest {

    private final MeasurementIngestionService service = mock(MeasurementIngestionService.class);
    private final SimulatorConfig config = SimulatorConfig.builder().enabled(true).intervalMs(20).build();

    @Test
    @Timeout(10)
    void testFeedsBatchesUntilStopped() {
        when(service.ingestBatch(anyList())).thenReturn(BatchIngestResult.builder()
                .processed(3)
                .results(List.of(IngestResult.stored("fermenter_temp", 1L, false)))
                .build());
        SimulatorRunner runner = new SimulatorRunner(config, new SensorSimulator(new Random(1), Clock.systemUTC()), service);

        runner.start();
        verify(service, timeout(2000).atLeast(3)).ingestBatch(anyList());
        runner.stop();

        assertThat(runner.isRunning()).isFalse();
    }

    @Test
    void testTickSurvivesServiceFailure() {
        when(service.ingestBatch(anyList())).thenThrow(new IllegalStateException("boom"));
        SimulatorRunner runner = new SimulatorRunner(config, new SensorSimulator(), service);

        assertThatCode(runner::tick).doesNotThrowAnyException();
        verify(service).ingestBatch(anyList());
    }

    @Test
    void testStopWithoutStartIsSafe() {
        SimulatorRunner runner = new SimulatorRunner(config, new SensorSimulator(), service);
        assertThatCode(runner::stop).doesNotThrowAnyException();
        assertThatThrownBy(() -> new SimulatorRunner(null, new SensorSimulator(), service))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
