package fun.fengwk.snow.core.service.fetch;

/**
 * @author fengwk
 */
public interface PageFetchService {

    /**
     * Acquire a rendering engine able to run {@code concurrency} fetches in parallel.
     */
    FetchSession openSession(int concurrency);

}
