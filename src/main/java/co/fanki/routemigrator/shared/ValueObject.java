package co.fanki.routemigrator.shared;

import java.io.Serializable;

/**
 * Marker interface for value objects of the migration model.
 *
 * <p>Destinations, element handles and call records are compared by
 * their attributes, never by identity. Implementations are immutable
 * and validate themselves on construction.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface ValueObject extends Serializable {

}
