package fun.fengwk.snow.core.service.pipeline;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import fun.fengwk.snow.core.facade.store.StoreFacade;
import fun.fengwk.snow.core.facade.store.model.StoreResponse;
import fun.fengwk.snow.core.model.ItemOutcome;
import fun.fengwk.snow.core.model.SnowReport;
import fun.fengwk.snow.core.service.pipeline.model.PersistSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes extracted reports keyed by resort name: delete the previous rows, then insert.
 *
 * <p>The two calls are not atomic. A reader between them sees no row for the resort, and a failed
 * insert leaves the resort without a row until the next run. The resort display name is the only
 * key, so a renamed resort leaves its old row behind.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SnowReportPersister {

    private static final TypeReference<LinkedHashMap<String, Object>> ROW_TYPE = new TypeReference<>() {};

    private final StoreFacade storeFacade;
    private final PipelineProperties pipelineProperties;
    private final ObjectMapper objectMapper;

    /**
     * Persist every successful outcome in order. A failure of one record never stops the others.
     */
    public PersistSummary persist(List<ItemOutcome> outcomes) {
        int saved = 0;
        int skipped = 0;
        int failed = 0;
        if (outcomes == null) {
            return new PersistSummary(0, 0, 0);
        }

        for (ItemOutcome outcome : outcomes) {
            if (outcome == null || !outcome.isSuccess()) {
                skipped++;
                continue;
            }
            SnowReport report = outcome.getReport();
            if (report == null || !StringUtils.hasText(report.getResortName())) {
                log.warn("skip report without resort name, url={}", outcome.getUrl());
                skipped++;
                continue;
            }

            try {
                if (save(outcome.getUrl(), report)) {
                    saved++;
                } else {
                    failed++;
                }
            } catch (RuntimeException ex) {
                log.error("error saving report, url={}, resort={}, error={}",
                    outcome.getUrl(), report.getResortName(), ex.getMessage(), ex);
                failed++;
            }
        }
        return new PersistSummary(saved, skipped, failed);
    }

    private boolean save(String url, SnowReport report) {
        String table = pipelineProperties.getTable();
        String resortName = report.getResortName();
        Map<String, Object> row = objectMapper.convertValue(report, ROW_TYPE);

        StoreResponse deleted = storeFacade.delete(table, SnowReport.RESORT_NAME_FIELD, resortName);
        if (deleted == null || !deleted.isSuccess()) {
            log.warn("error deleting previous report, url={}, resort={}, error={}, row={}",
                url, resortName, deleted == null ? "no response" : deleted.getError(), row);
            return false;
        }

        StoreResponse inserted = storeFacade.insert(table, row);
        if (inserted == null || !inserted.isSuccess()) {
            log.warn("error inserting report, url={}, resort={}, error={}, row={}",
                url, resortName, inserted == null ? "no response" : inserted.getError(), row);
            return false;
        }

        log.info("saved report, url={}, resort={}", url, resortName);
        return true;
    }

}
