package fun.fengwk.snow.core.service.extract.model;

import fun.fengwk.snow.core.model.FailureKind;
import fun.fengwk.snow.core.model.ItemOutcome;
import fun.fengwk.snow.core.model.PageContent;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of extracting one sub-batch.
 *
 * <p>Always holds one outcome per input page, in input order. When the sub-batch could not be
 * dispatched at all, {@link #getDispatchError()} carries the cause and every outcome is an
 * {@link FailureKind#EXTRACTION_DISPATCH} failure.
 *
 * @author fengwk
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ExtractionBatch {

    List<ItemOutcome> outcomes;
    String dispatchError;

    public static ExtractionBatch completed(List<ItemOutcome> outcomes) {
        return new ExtractionBatch(List.copyOf(outcomes), null);
    }

    public static ExtractionBatch dispatchFailed(List<PageContent> pages, String dispatchError) {
        List<ItemOutcome> outcomes = new ArrayList<>(pages.size());
        for (PageContent page : pages) {
            outcomes.add(ItemOutcome.failure(page.getUrl(), FailureKind.EXTRACTION_DISPATCH, dispatchError));
        }
        return new ExtractionBatch(List.copyOf(outcomes), dispatchError);
    }

    public boolean isDispatched() {
        return dispatchError == null;
    }

}
