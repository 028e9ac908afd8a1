package com.yuzhi.spl.common.service;

import com.yuzhi.spl.common.config.GuardrailConfig;
import com.yuzhi.spl.common.domain.ResultPage;
import com.yuzhi.spl.common.transport.SearchTransport;
import java.util.Iterator;
import java.util.NoSuchElementException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the result set of a readable job page by page.
 *
 * <p>Paging stops on an empty page, on a page shorter than the requested size, or once the
 * running record count reaches {@code maxRows} (0 means unlimited). The row cap only stops new
 * requests; a page that crosses it is delivered whole.
 */
public class ResultPaginator {

    private static final Logger log = LoggerFactory.getLogger(ResultPaginator.class);

    private final SearchTransport transport;
    private final int pageSize;
    private final int maxRows;
    private final QueryCancellation cancellation;

    public ResultPaginator(SearchTransport transport, int pageSize, int maxRows, QueryCancellation cancellation) {
        this.transport = transport;
        this.pageSize = Math.max(1, Math.min(pageSize, GuardrailConfig.MAX_PAGE_SIZE));
        this.maxRows = Math.max(0, maxRows);
        this.cancellation = cancellation != null ? cancellation : QueryCancellation.create();
    }

    public static ResultPaginator from(SearchTransport transport, GuardrailConfig config, QueryCancellation cancellation) {
        return new ResultPaginator(transport, config.pageSize(), config.maxRows(), cancellation);
    }

    public int pageSize() {
        return pageSize;
    }

    public int maxRows() {
        return maxRows;
    }

    /**
     * Opens a lazy cursor over the job's pages. Nothing is fetched until the first
     * {@link PageCursor#hasNext()}.
     */
    public PageCursor open(String sid) {
        return new PageCursor(sid);
    }

    /**
     * Fetches a single page at offset 0, ignoring the row cap.
     */
    public ResultPage firstPage(String sid, int count) {
        cancellation.throwIfCancelled();
        return transport.fetchResults(sid, Math.max(1, Math.min(count, GuardrailConfig.MAX_PAGE_SIZE)), 0);
    }

    /**
     * Single-use iterator over result pages. Every returned page is non-empty.
     */
    public final class PageCursor implements Iterator<ResultPage> {

        private final String sid;
        private int offset;
        private int fetched;
        private int pages;
        private boolean finished;
        private ResultPage buffered;

        private PageCursor(String sid) {
            this.sid = sid;
        }

        @Override
        public boolean hasNext() {
            if (buffered != null) {
                return true;
            }
            if (finished) {
                return false;
            }
            cancellation.throwIfCancelled();
            ResultPage page = transport.fetchResults(sid, pageSize, offset);
            pages++;
            if (page.isEmpty()) {
                finished = true;
                log.debug("Result paging finished on empty page. sid={}, offset={}, records={}", sid, offset, fetched);
                return false;
            }
            fetched += page.size();
            offset += page.size();
            if (maxRows > 0 && fetched >= maxRows) {
                finished = true;
                log.debug("Result paging stopped at row cap. sid={}, records={}, maxRows={}", sid, fetched, maxRows);
            } else if (page.size() < pageSize) {
                finished = true;
            }
            buffered = page;
            return true;
        }

        @Override
        public ResultPage next() {
            if (!hasNext()) {
                throw new NoSuchElementException("no more result pages for job " + sid);
            }
            ResultPage page = buffered;
            buffered = null;
            return page;
        }

        public int recordsFetched() {
            return fetched;
        }

        public int pagesFetched() {
            return pages;
        }

        public boolean isFinished() {
            return finished && buffered == null;
        }
    }
}
