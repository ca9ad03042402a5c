package fun.fengwk.snow.core.configuration;

import fun.fengwk.snow.core.service.pipeline.PacingSleeper;
import fun.fengwk.snow.core.service.pipeline.PipelineProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * @author fengwk
 */
@Configuration
public class PipelineConfiguration {

    @Bean(name = "extractionExecutor", destroyMethod = "shutdownNow")
    public ExecutorService extractionExecutor(PipelineProperties pipelineProperties) {
        int threads = pipelineProperties.resolveExtractionSubBatchSize();
        AtomicInteger sequence = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, runnable -> {
            Thread thread = new Thread(runnable, "snow-extract-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    @ConditionalOnMissingBean
    public PacingSleeper pacingSleeper() {
        return PacingSleeper.threadSleep();
    }

}
