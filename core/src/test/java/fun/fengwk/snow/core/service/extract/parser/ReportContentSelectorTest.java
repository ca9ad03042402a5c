package fun.fengwk.snow.core.service.extract.parser;

import fun.fengwk.snow.core.service.extract.ExtractProperties;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
public class ReportContentSelectorTest {

    @Test
    public void shouldJoinTextNodesOfReportRegion() {
        ReportContentSelector selector = new ReportContentSelector(new ExtractProperties());
        String html = "<html><body><nav>Menu</nav>"
            + "<div class=\"skireport_reportContent__Abc12\">"
            + "<h1>  Aspen   Snowmass </h1><p>Snowfall <b>4\"</b></p>"
            + "<script>var x = 1;</script><style>.a{}</style>"
            + "<span>5/8 Lifts Open</span></div>"
            + "<footer>Footer</footer></body></html>";

        String content = selector.select(html);

        assertThat(content).isEqualTo("Aspen Snowmass Snowfall 4\" 5/8 Lifts Open");
    }

    @Test
    public void shouldUseFirstMatchingSelector() {
        ExtractProperties properties = new ExtractProperties();
        properties.setReportSelectors(List.of("#missing", "section.report", "div.other"));
        ReportContentSelector selector = new ReportContentSelector(properties);

        String content = selector.select("<div class=\"other\">other</div><section class=\"report\">report</section>");

        assertThat(content).isEqualTo("report");
    }

    @Test
    public void shouldReturnInputWhenNoSelectorMatches() {
        ReportContentSelector selector = new ReportContentSelector(new ExtractProperties());
        String html = "<html><body><p>Unrelated page</p></body></html>";

        assertThat(selector.select(html)).isEqualTo(html);
    }

    @Test
    public void shouldReturnInputWhenRegionHasNoText() {
        ReportContentSelector selector = new ReportContentSelector(new ExtractProperties());
        String html = "<div class=\"skireport_reportContent__x\"><script>1</script></div>";

        assertThat(selector.select(html)).isEqualTo(html);
    }

    @Test
    public void shouldSkipInvalidSelector() {
        ExtractProperties properties = new ExtractProperties();
        properties.setReportSelectors(List.of("div[", "p.report"));
        ReportContentSelector selector = new ReportContentSelector(properties);

        assertThat(selector.select("<p class=\"report\">ok</p>")).isEqualTo("ok");
    }

    @Test
    public void shouldHandleBlankAndNullInput() {
        ReportContentSelector selector = new ReportContentSelector(new ExtractProperties());

        assertThat(selector.select(null)).isEmpty();
        assertThat(selector.select("   ")).isEqualTo("   ");
    }

}
