package fun.fengwk.snow.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Snow report extracted from one resort page.
 *
 * <p>Json property names are the column names of the report table, so the same object is used
 * to parse the completion response and to build the inserted row. Every field may be null,
 * but a report without {@link #getResortName() resort name} is never persisted.
 *
 * @author fengwk
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({
    SnowReport.RESORT_NAME_FIELD,
    "Snowfall 6 days ago",
    "Snowfall 5 days ago",
    "Snowfall 4 days ago",
    "Snowfall 3 days ago",
    "Snowfall 2 days ago",
    "Snowfall 1 day ago",
    "Snowfall forecasted today",
    "Snowfall forecasted in 1 day",
    "Snowfall forecasted in 2 days",
    "Snowfall forecasted in 3 days",
    "Snowfall forecasted in 4 days",
    "Snowfall forecasted in 5 days",
    "Mid Mountain Snow",
    "Lifts Open",
    "Runs Open"
})
public class SnowReport {

    /**
     * Column holding the resort name, used as the natural key of the table.
     */
    public static final String RESORT_NAME_FIELD = "Ski Resort";

    @JsonProperty(RESORT_NAME_FIELD)
    String resortName;

    @JsonProperty("Snowfall 6 days ago")
    Integer snowfall6DaysAgo;

    @JsonProperty("Snowfall 5 days ago")
    Integer snowfall5DaysAgo;

    @JsonProperty("Snowfall 4 days ago")
    Integer snowfall4DaysAgo;

    @JsonProperty("Snowfall 3 days ago")
    Integer snowfall3DaysAgo;

    @JsonProperty("Snowfall 2 days ago")
    Integer snowfall2DaysAgo;

    @JsonProperty("Snowfall 1 day ago")
    Integer snowfall1DayAgo;

    @JsonProperty("Snowfall forecasted today")
    Integer snowfallForecastToday;

    @JsonProperty("Snowfall forecasted in 1 day")
    Integer snowfallForecastIn1Day;

    @JsonProperty("Snowfall forecasted in 2 days")
    Integer snowfallForecastIn2Days;

    @JsonProperty("Snowfall forecasted in 3 days")
    Integer snowfallForecastIn3Days;

    @JsonProperty("Snowfall forecasted in 4 days")
    Integer snowfallForecastIn4Days;

    @JsonProperty("Snowfall forecasted in 5 days")
    Integer snowfallForecastIn5Days;

    /**
     * Mid mountain snow depth in inches.
     */
    @JsonProperty("Mid Mountain Snow")
    Integer midMountainSnow;

    /**
     * Free text such as "5/8 Lifts Open".
     */
    @JsonProperty("Lifts Open")
    String liftsOpen;

    /**
     * Free text such as "20/35 Runs Open".
     */
    @JsonProperty("Runs Open")
    String runsOpen;

}
