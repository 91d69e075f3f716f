package co.fanki.routemigrator.migration.domain;

import co.fanki.routemigrator.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges fresh call-site records with the routes of the existing
 * configuration into one record per destination.
 *
 * <p>When both sides know a destination, the fresh fields win, except
 * that a missing page falls back to the imported one, and the imported
 * declaration text is always kept so hand-edited routes survive.
 * Imported destinations no call site mentions are carried through
 * unchanged. Unresolved and non-navigating records never enter the
 * table.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
public class RouteMerger {

    private static final Logger LOG = LoggerFactory.getLogger(
            RouteMerger.class);

    /**
     * Merges two record lists.
     *
     * @param fresh the records classified from call sites
     * @param imported the records read from the configuration
     * @return the canonical table
     */
    public MergeResult merge(final List<CallRecord> fresh,
            final List<CallRecord> imported) {
        Preconditions.requireNonNull(fresh, "Fresh records are required");
        Preconditions.requireNonNull(imported,
                "Imported records are required");

        final Map<Destination, CallRecord> freshByDestination =
                byDestination(fresh);
        final Map<Destination, CallRecord> importedByDestination =
                byDestination(imported);

        final Map<Destination, CallRecord> table = new LinkedHashMap<>();
        for (final Map.Entry<Destination, CallRecord> entry
                : freshByDestination.entrySet()) {
            final CallRecord previous = importedByDestination.remove(
                    entry.getKey());
            table.put(entry.getKey(), previous == null
                    ? entry.getValue() : combine(entry.getValue(), previous));
        }

        final List<Destination> retained = new ArrayList<>(
                importedByDestination.keySet());
        table.putAll(importedByDestination);

        LOG.info("Merged {} destinations, {} retained from the existing"
                + " configuration without call sites", table.size(),
                retained.size());
        return new MergeResult(table, retained);
    }

    /** Keeps the last record of each resolved destination. */
    private static Map<Destination, CallRecord> byDestination(
            final List<CallRecord> records) {
        final Map<Destination, CallRecord> result = new LinkedHashMap<>();
        for (final CallRecord record : records) {
            if (record.destination().isResolved()) {
                result.put(record.destination(), record);
            }
        }
        return result;
    }

    private static CallRecord combine(final CallRecord fresh,
            final CallRecord imported) {
        final CallRecord.Builder merged = fresh.toBuilder()
                .declarationText(imported.declarationText());
        if (fresh.targetName() == null) {
            merged.targetName(imported.targetName())
                    .targetConstructor(imported.targetConstructor())
                    .targetFile(imported.targetFile());
        }
        return merged.build();
    }

}
