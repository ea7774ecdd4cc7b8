package org.iceforge.ullr.logs;

import org.iceforge.ullr.query.QueryModels;

import java.util.List;

/**
 * The log-analytics service the core talks to.
 * <p>
 * Implementations translate their client's faults into {@link LogsBackendException} so the core never
 * sees a vendor exception type.
 */
public interface LogInsightsBackend {

    /**
     * Starts one query spanning all {@code sources}.
     *
     * @return the backend query id
     */
    String submitQuery(List<String> sources, String queryText, QueryModels.TimeWindow window);

    LogModels.QueryPoll pollQuery(String queryId);

    /**
     * Final row fetch for backends whose status check does not carry the rows.
     * The default re-polls and returns whatever rows the terminal poll holds.
     */
    default List<LogModels.RawRow> fetchResults(String queryId) {
        LogModels.QueryPoll poll = pollQuery(queryId);
        return poll.rows() == null ? List.of() : poll.rows();
    }

    boolean sourceExists(String sourceName);

    List<LogModels.LogSource> listSources(String namePrefix);

    List<LogModels.SavedQuery> listSavedQueries();
}
