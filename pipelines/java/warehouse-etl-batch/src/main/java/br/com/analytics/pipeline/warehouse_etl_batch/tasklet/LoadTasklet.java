package br.com.analytics.pipeline.warehouse_etl_batch.tasklet;

import br.com.analytics.pipeline.warehouse_etl_batch.coordinator.TransformCoordinator;
import br.com.analytics.pipeline.warehouse_etl_batch.coordinator.TransformReport;
import br.com.analytics.pipeline.warehouse_etl_batch.exception.LoadException;
import br.com.analytics.pipeline.warehouse_etl_batch.exception.WarehouseEtlException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.step.StepContribution;
import org.springframework.batch.core.step.tasklet.Tasklet;
import org.springframework.batch.infrastructure.repeat.RepeatStatus;

public class LoadTasklet implements Tasklet {

    private static final Logger log = LoggerFactory.getLogger(LoadTasklet.class);

    private final TransformCoordinator coordinator;
    private final boolean failOnError;

    public LoadTasklet(TransformCoordinator coordinator, boolean failOnError) {
        this.coordinator = coordinator;
        this.failOnError = failOnError;
    }

    @Override
    public RepeatStatus execute(StepContribution contribution, ChunkContext chunkContext) throws Exception {
        TransformReport report = coordinator.loadAll();

        if (report.hasFailures()) {
            log.warn("Tables not merged into the warehouse: {}", report.failures().keySet());
            if (failOnError) {
                Throwable first = report.failures().values().iterator().next();
                throw first instanceof LoadException load ? load : new WarehouseEtlException(
                        "Warehouse load failed for " + report.failures().keySet(), first);
            }
        } else {
            log.info("All {} tables merged into the warehouse", report.rowCounts().size());
        }
        return RepeatStatus.FINISHED;
    }
}
