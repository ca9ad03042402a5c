package fun.fengwk.snow.core.scheduler;

import fun.fengwk.snow.core.service.pipeline.SnowReportRunLoop;
import fun.fengwk.snow.core.service.pipeline.model.PipelineRunSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Runs the pipeline twice a day, at 01:00 and 13:00 UTC unless {@code snow.schedule.cron} says
 * otherwise. A trigger that fires while a run is in progress is skipped.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "snow.schedule", name = "enabled", havingValue = "true")
public class SnowReportScheduler {

    private final SnowReportRunLoop snowReportRunLoop;

    @Scheduled(cron = "${snow.schedule.cron:0 0 1,13 * * *}", zone = "UTC")
    public void scheduledRun() {
        if (snowReportRunLoop.isRunning()) {
            log.warn("scheduled run skipped, previous run still in progress");
            return;
        }
        log.info("scheduled run triggered");
        try {
            PipelineRunSummary summary = snowReportRunLoop.run();
            log.info("scheduled run finished, runId={}, extracted={}, saved={}",
                summary.getRunId(), summary.getExtracted(), summary.getSaved());
        } catch (Exception ex) {
            log.error("scheduled run failed: {}", ex.getMessage(), ex);
        }
    }

}
