package fun.fengwk.snow.core.facade.completion;

import fun.fengwk.snow.core.facade.completion.model.CompletionRequest;
import fun.fengwk.snow.core.facade.completion.model.CompletionResponse;

/**
 * @author fengwk
 */
public interface CompletionFacade {

    /**
     * Execute one completion, never throws.
     */
    CompletionResponse complete(CompletionRequest request);

}
