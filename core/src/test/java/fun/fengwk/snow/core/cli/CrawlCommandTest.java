package fun.fengwk.snow.core.cli;

import fun.fengwk.snow.core.service.pipeline.PipelineProperties;
import fun.fengwk.snow.core.service.pipeline.SnowReportRunLoop;
import fun.fengwk.snow.core.service.pipeline.model.PipelineRunSummary;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * @author fengwk
 */
@ExtendWith(MockitoExtension.class)
public class CrawlCommandTest {

    @Mock
    private SnowReportRunLoop runLoop;

    @Test
    public void shouldRunOnceOnStartup() {
        when(runLoop.run()).thenReturn(PipelineRunSummary.builder().runId("r1").build());

        new CrawlCommand(runLoop, new PipelineProperties()).run(new DefaultApplicationArguments());

        verify(runLoop).run();
    }

    @Test
    public void shouldStayIdleWhenRunOnStartupDisabled() {
        PipelineProperties properties = new PipelineProperties();
        properties.setRunOnStartup(false);

        new CrawlCommand(runLoop, properties).run(new DefaultApplicationArguments());

        verify(runLoop, never()).run();
    }

    @Test
    public void shouldPropagateSetupFault() {
        when(runLoop.run()).thenThrow(new IllegalStateException("url list not found: file:USACANADA.txt"));
        CrawlCommand command = new CrawlCommand(runLoop, new PipelineProperties());

        assertThatThrownBy(() -> command.run(new DefaultApplicationArguments()))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("url list not found");
    }

}
