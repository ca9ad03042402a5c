package fun.fengwk.snow.core.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Objects;

/**
 * Terminal result of one url in a run: either a report or a failure, never both.
 *
 * @author fengwk
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ItemOutcome {

    String url;
    SnowReport report;
    ItemFailure failure;

    public static ItemOutcome success(String url, SnowReport report) {
        return new ItemOutcome(url, Objects.requireNonNull(report, "report"), null);
    }

    public static ItemOutcome failure(String url, FailureKind kind, String message) {
        return new ItemOutcome(url, null, ItemFailure.of(kind, message));
    }

    public boolean isSuccess() {
        return failure == null;
    }

}
