package br.com.analytics.pipeline.warehouse_etl_batch.tasklet;

import br.com.analytics.pipeline.warehouse_etl_batch.coordinator.TransformCoordinator;
import br.com.analytics.pipeline.warehouse_etl_batch.coordinator.TransformReport;
import br.com.analytics.pipeline.warehouse_etl_batch.exception.TransformException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.step.StepContribution;
import org.springframework.batch.core.step.tasklet.Tasklet;
import org.springframework.batch.infrastructure.repeat.RepeatStatus;

public class TransformTasklet implements Tasklet {

    private static final Logger log = LoggerFactory.getLogger(TransformTasklet.class);

    private final TransformCoordinator coordinator;
    private final boolean failOnError;

    public TransformTasklet(TransformCoordinator coordinator, boolean failOnError) {
        this.coordinator = coordinator;
        this.failOnError = failOnError;
    }

    @Override
    public RepeatStatus execute(StepContribution contribution, ChunkContext chunkContext) throws Exception {
        TransformReport report = coordinator.runAll();
        report.rowCounts().forEach((entity, rows) -> log.info("{}: {} rows", entity, rows));
        coordinator.describe();

        if (report.hasFailures()) {
            log.warn("Entities failed during transformation: {}", report.failures().keySet());
            if (failOnError) {
                throw new TransformException("Transformation failed for " + report.failures().keySet());
            }
        }
        return RepeatStatus.FINISHED;
    }
}
