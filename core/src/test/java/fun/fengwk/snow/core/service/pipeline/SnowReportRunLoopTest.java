package fun.fengwk.snow.core.service.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import fun.fengwk.snow.core.facade.completion.openai.OpenAiProperties;
import fun.fengwk.snow.core.facade.store.supabase.SupabaseProperties;
import fun.fengwk.snow.core.service.pipeline.model.PipelineRunSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.DefaultResourceLoader;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * @author fengwk
 */
public class SnowReportRunLoopTest {

    @TempDir
    Path tempDir;

    private FakePageFetchService fetchService;
    private FakeSnowReportExtractor extractor;
    private InMemoryStoreFacade store;
    private RecordingPacingSleeper sleeper;
    private PipelineProperties pipelineProperties;
    private OpenAiProperties openAiProperties;
    private SupabaseProperties supabaseProperties;
    private SnowReportRunLoop runLoop;

    @BeforeEach
    public void setUp() {
        fetchService = new FakePageFetchService();
        extractor = new FakeSnowReportExtractor();
        store = new InMemoryStoreFacade();
        sleeper = new RecordingPacingSleeper();

        pipelineProperties = new PipelineProperties();
        pipelineProperties.setBatchSize(3);
        pipelineProperties.setExtractionSubBatchSize(2);
        pipelineProperties.setSubBatchDelayMs(1000);
        pipelineProperties.setBatchDelayMs(2000);
        openAiProperties = new OpenAiProperties();
        openAiProperties.setApiKey("sk-test");
        supabaseProperties = new SupabaseProperties();
        supabaseProperties.setUrl("https://project.supabase.co");
        supabaseProperties.setServiceKey("service-key");

        runLoop = new SnowReportRunLoop(
            new UrlListLoader(new DefaultResourceLoader()),
            new BatchRunner(fetchService, extractor, pipelineProperties, sleeper),
            new SnowReportPersister(store, pipelineProperties, new ObjectMapper()),
            pipelineProperties,
            openAiProperties,
            supabaseProperties,
            sleeper
        );
    }

    @Test
    public void shouldRunBatchesInSequenceWithPacing() throws Exception {
        useUrls("https://s/vail", "https://s/aspen", "https://s/broken-taos", "\n", "https://s/whistler");

        PipelineRunSummary summary = runLoop.run();

        assertThat(fetchService.openedConcurrency).containsExactly(3, 1);
        assertThat(fetchService.closedSessions).isEqualTo(2);
        assertThat(extractor.subBatches).containsExactly(
            List.of("https://s/vail", "https://s/aspen"),
            List.of("https://s/whistler"));
        // batch 1 has two fetched pages in one sub-batch of 2, so no sub-batch pause inside it
        assertThat(sleeper.sleeps).containsExactly(Duration.ofMillis(2000), Duration.ofMillis(2000));

        assertThat(summary.getTotalUrls()).isEqualTo(4);
        assertThat(summary.getTotalBatches()).isEqualTo(2);
        assertThat(summary.getCompletedBatches()).isEqualTo(2);
        assertThat(summary.getOutcomes()).isEqualTo(4);
        assertThat(summary.getExtracted()).isEqualTo(3);
        assertThat(summary.getFetchFailures()).isEqualTo(1);
        assertThat(summary.getRetryableFailures()).isEqualTo(1);
        assertThat(summary.getSaved()).isEqualTo(3);
        assertThat(summary.getSkipped()).isEqualTo(1);
        assertThat(store.rows("onthesnow")).extracting(row -> row.get("Ski Resort"))
            .containsExactly("vail", "aspen", "whistler");
    }

    @Test
    public void shouldPaceSubBatchesInFirstBatchOnly() throws Exception {
        useUrls("https://s/a", "https://s/b", "https://s/c", "https://s/d");

        runLoop.run();

        assertThat(extractor.subBatches).containsExactly(
            List.of("https://s/a", "https://s/b"),
            List.of("https://s/c"),
            List.of("https://s/d"));
        assertThat(sleeper.sleeps)
            .containsExactly(Duration.ofMillis(1000), Duration.ofMillis(2000), Duration.ofMillis(2000));
    }

    @Test
    public void shouldCountParseFailuresWithoutSaving() throws Exception {
        useUrls("https://s/garbled-a", "https://s/b");

        PipelineRunSummary summary = runLoop.run();

        assertThat(summary.getParseFailures()).isEqualTo(1);
        assertThat(summary.getRetryableFailures()).isZero();
        assertThat(summary.getSaved()).isEqualTo(1);
        assertThat(sleeper.sleeps).containsExactly(Duration.ofMillis(2000));
    }

    @Test
    public void shouldDoNothingForEmptyList() throws Exception {
        useUrls();

        PipelineRunSummary summary = runLoop.run();

        assertThat(summary.getTotalBatches()).isZero();
        assertThat(fetchService.openedConcurrency).isEmpty();
        assertThat(sleeper.sleeps).isEmpty();
    }

    @Test
    public void shouldRefuseToRunWithoutCredentials() throws Exception {
        useUrls("https://s/a");
        openAiProperties.setApiKey("");
        supabaseProperties.setServiceKey(" ");

        assertThatThrownBy(() -> runLoop.run())
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("snow.completion.openai.api-key")
            .hasMessageContaining("snow.store.supabase.service-key");
        assertThat(fetchService.openedConcurrency).isEmpty();
        assertThat(runLoop.isRunning()).isFalse();
    }

    @Test
    public void shouldFailWhenUrlListMissing() {
        pipelineProperties.setUrlListLocation(tempDir.resolve("missing.txt").toAbsolutePath().toString());

        assertThatThrownBy(() -> runLoop.run())
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("url list not found");
    }

    private void useUrls(String... lines) throws Exception {
        Path file = tempDir.resolve("USACANADA.txt");
        Files.writeString(file, String.join("\n", lines));
        pipelineProperties.setUrlListLocation("file:" + file.toAbsolutePath());
    }

}
