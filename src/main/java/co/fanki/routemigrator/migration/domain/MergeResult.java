package co.fanki.routemigrator.migration.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The canonical route table produced by {@link RouteMerger}.
 *
 * @param table one record per resolved destination
 * @param retained destinations kept from the existing configuration
 *      that no current call site navigates to
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record MergeResult(Map<Destination, CallRecord> table,
        List<Destination> retained) {

    public MergeResult {
        table = Collections.unmodifiableMap(new LinkedHashMap<>(table));
        retained = List.copyOf(retained);
    }

    /**
     * Returns how many destinations were retained without a matching
     * call site.
     *
     * @return the retained-unmatched count
     */
    public int retainedCount() {
        return retained.size();
    }

}
