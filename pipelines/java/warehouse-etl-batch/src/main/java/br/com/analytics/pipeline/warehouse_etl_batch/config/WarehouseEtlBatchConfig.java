package br.com.analytics.pipeline.warehouse_etl_batch.config;

import br.com.analytics.pipeline.warehouse_etl_batch.coordinator.TransformCoordinator;
import br.com.analytics.pipeline.warehouse_etl_batch.processor.DimensionBuilder;
import br.com.analytics.pipeline.warehouse_etl_batch.processor.FactBuilder;
import br.com.analytics.pipeline.warehouse_etl_batch.reader.ParquetSnapshotReader;
import br.com.analytics.pipeline.warehouse_etl_batch.reader.SnapshotReader;
import br.com.analytics.pipeline.warehouse_etl_batch.tasklet.LoadTasklet;
import br.com.analytics.pipeline.warehouse_etl_batch.tasklet.TransformTasklet;
import br.com.analytics.pipeline.warehouse_etl_batch.writer.MergeLoader;
import br.com.analytics.pipeline.warehouse_etl_batch.writer.StarTableStore;
import org.springframework.batch.core.configuration.annotation.EnableBatchProcessing;
import org.springframework.batch.core.job.Job;
import org.springframework.batch.core.job.builder.JobBuilder;
import org.springframework.batch.core.job.parameters.RunIdIncrementer;
import org.springframework.batch.core.repository.JobRepository;
import org.springframework.batch.core.step.Step;
import org.springframework.batch.core.step.builder.StepBuilder;
import org.springframework.batch.infrastructure.support.transaction.ResourcelessTransactionManager;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.time.Clock;

@Configuration
@EnableBatchProcessing
@EnableConfigurationProperties(WarehouseEtlProperties.class)
public class WarehouseEtlBatchConfig {

    private final JobRepository jobRepository;
    private final PlatformTransactionManager transactionManager;
    private final WarehouseEtlProperties properties;

    public WarehouseEtlBatchConfig(JobRepository jobRepository,
                                   @Qualifier("warehouseTransactionManager") PlatformTransactionManager transactionManager,
                                   WarehouseEtlProperties properties) {
        this.jobRepository = jobRepository;
        this.transactionManager = transactionManager;
        this.properties = properties;
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public SnapshotReader snapshotReader() {
        return new ParquetSnapshotReader(Path.of(properties.bronzeDir()));
    }

    @Bean
    public DimensionBuilder dimensionBuilder(SnapshotReader snapshotReader, Clock clock) {
        return new DimensionBuilder(snapshotReader, properties.calendar(), clock);
    }

    @Bean
    public FactBuilder factBuilder(SnapshotReader snapshotReader, Clock clock) {
        return new FactBuilder(snapshotReader, properties.sales().itemCostField(), clock);
    }

    @Bean
    public StarTableStore starTableStore() {
        return new StarTableStore(Path.of(properties.silverDir()), properties.compression());
    }

    @Bean
    public MergeLoader mergeLoader(@Qualifier("warehouseDataSource") DataSource warehouseDataSource) {
        return new MergeLoader(warehouseDataSource, transactionManager,
                properties.merge().schema(), properties.merge().batchSize());
    }

    @Bean
    public TransformCoordinator transformCoordinator(DimensionBuilder dimensionBuilder, FactBuilder factBuilder,
                                                     StarTableStore starTableStore, MergeLoader mergeLoader) {
        return new TransformCoordinator(
                TransformCoordinator.standardHandlers(dimensionBuilder, factBuilder),
                starTableStore,
                mergeLoader,
                properties.mergeOnTransform());
    }

    /**
     * The tasklets hold no transactional resources of their own. Merges commit batch by batch on the warehouse
     * transaction manager, so the step must not wrap them in a warehouse transaction.
     */
    @Bean
    public PlatformTransactionManager stepTransactionManager() {
        return new ResourcelessTransactionManager();
    }

    @Bean
    public Step transformStep(TransformCoordinator transformCoordinator,
                              @Qualifier("stepTransactionManager") PlatformTransactionManager stepTransactionManager) {
        return new StepBuilder("transformStep", jobRepository)
                .tasklet(new TransformTasklet(transformCoordinator, properties.failStepOnError()), stepTransactionManager)
                .build();
    }

    @Bean
    public Step loadStep(TransformCoordinator transformCoordinator,
                         @Qualifier("stepTransactionManager") PlatformTransactionManager stepTransactionManager) {
        return new StepBuilder("loadStep", jobRepository)
                .tasklet(new LoadTasklet(transformCoordinator, properties.failStepOnError()), stepTransactionManager)
                .build();
    }

    @Bean
    public Job warehouseEtlJob(@Qualifier("transformStep") Step transformStep, @Qualifier("loadStep") Step loadStep) {
        return new JobBuilder("warehouseEtlJob", jobRepository)
                .incrementer(new RunIdIncrementer())
                .start(transformStep)
                .next(loadStep)
                .build();
    }

}
