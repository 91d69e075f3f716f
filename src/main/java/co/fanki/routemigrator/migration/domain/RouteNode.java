package co.fanki.routemigrator.migration.domain;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A node of the route tree: one path segment, the record bound to it if
 * any, and its children in insertion order.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class RouteNode {

    private final String segment;
    private final Map<String, RouteNode> children = new LinkedHashMap<>();
    private CallRecord record;

    RouteNode(final String theSegment) {
        this.segment = theSegment;
    }

    RouteNode child(final String childSegment) {
        return children.computeIfAbsent(childSegment, RouteNode::new);
    }

    void bind(final CallRecord theRecord) {
        this.record = theRecord;
    }

    public String segment() {
        return segment;
    }

    /** The bound record, null for intermediate nodes. */
    public CallRecord record() {
        return record;
    }

    public Collection<RouteNode> children() {
        return Collections.unmodifiableCollection(children.values());
    }

    /**
     * Returns the child owning a segment.
     *
     * @param childSegment the segment
     * @return the child, null if there is none
     */
    public RouteNode childAt(final String childSegment) {
        return children.get(childSegment);
    }

    public boolean hasChildren() {
        return !children.isEmpty();
    }

}
