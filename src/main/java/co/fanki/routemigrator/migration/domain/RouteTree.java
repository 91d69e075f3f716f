package co.fanki.routemigrator.migration.domain;

import co.fanki.routemigrator.shared.Preconditions;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The canonical route table arranged by path segments.
 *
 * <p>Destinations are inserted in sorted order so that the emitted
 * configuration does not depend on discovery order. Intermediate nodes
 * are shared and created only on the way to a bound record. The root
 * destination {@code /} has no segment; its record is kept apart and
 * emitted as the first top-level route.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class RouteTree {

    private final RouteNode root = new RouteNode("");
    private CallRecord rootRecord;

    private RouteTree() {
    }

    /**
     * Builds the tree of a route table.
     *
     * @param table one record per resolved destination
     * @return the tree
     */
    public static RouteTree build(final Map<Destination, CallRecord> table) {
        Preconditions.requireNonNull(table, "Route table is required");
        final RouteTree tree = new RouteTree();
        final List<Destination> destinations = new ArrayList<>(table.keySet());
        destinations.sort(null);
        for (final Destination destination : destinations) {
            Preconditions.requireDomain(destination.isResolved(),
                    "Only resolved destinations belong in the tree: "
                            + destination);
            if (destination.isRoot()) {
                tree.rootRecord = table.get(destination);
                continue;
            }
            RouteNode node = tree.root;
            for (final String segment : destination.segments()) {
                node = node.child(segment);
            }
            node.bind(table.get(destination));
        }
        return tree;
    }

    /** The nodes directly under the root, in sorted order. */
    public Collection<RouteNode> topLevel() {
        return root.children();
    }

    /** The record of the {@code /} destination, if any. */
    public Optional<CallRecord> rootRecord() {
        return Optional.ofNullable(rootRecord);
    }

    /**
     * Finds the node of a destination.
     *
     * @param destination the destination
     * @return the node, empty if the tree has no such path
     */
    public Optional<RouteNode> find(final Destination destination) {
        RouteNode node = root;
        for (final String segment : destination.segments()) {
            node = node.childAt(segment);
            if (node == null) {
                return Optional.empty();
            }
        }
        return node == root ? Optional.empty() : Optional.of(node);
    }

    public boolean isEmpty() {
        return rootRecord == null && !root.hasChildren();
    }

}
