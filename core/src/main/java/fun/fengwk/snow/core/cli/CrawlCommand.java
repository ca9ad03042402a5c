package fun.fengwk.snow.core.cli;

import fun.fengwk.snow.core.service.pipeline.PipelineProperties;
import fun.fengwk.snow.core.service.pipeline.SnowReportRunLoop;
import fun.fengwk.snow.core.service.pipeline.model.PipelineRunSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Runs the pipeline once at startup. Setup faults propagate and fail the application.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CrawlCommand implements ApplicationRunner {

    private final SnowReportRunLoop snowReportRunLoop;
    private final PipelineProperties pipelineProperties;

    @Override
    public void run(ApplicationArguments args) {
        if (!pipelineProperties.isRunOnStartup()) {
            log.info("run on startup disabled");
            return;
        }
        PipelineRunSummary summary = snowReportRunLoop.run();
        log.info("crawl finished, urls={}, extracted={}, failures={}, saved={}, saveFailures={}, elapsed={}",
            summary.getTotalUrls(), summary.getExtracted(), summary.getFailures(),
            summary.getSaved(), summary.getSaveFailures(), summary.elapsed());
    }

}
