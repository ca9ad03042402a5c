package fun.fengwk.snow.core.model;

/**
 * Pipeline stage an item failed at.
 *
 * @author fengwk
 */
public enum FailureKind {

    /**
     * Page could not be rendered: network, navigation, timeout or engine error.
     */
    FETCH,

    /**
     * Completion backend answered, but not with a report json object.
     */
    EXTRACTION_PARSE,

    /**
     * Completion request never got a usable answer: backend unreachable, non-2xx status,
     * or the sub-batch could not be dispatched at all.
     */
    EXTRACTION_DISPATCH,

    ;

    /**
     * Whether the same item may succeed when simply tried again later.
     */
    public boolean isTransient() {
        return this != EXTRACTION_PARSE;
    }

}
