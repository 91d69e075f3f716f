package co.fanki.routemigrator.dart;

import co.fanki.routemigrator.shared.Preconditions;
import co.fanki.routemigrator.shared.ValueObject;

import java.nio.file.Path;
import java.util.Comparator;

/**
 * Identity of a declared element: a function, method, class or
 * parameter.
 *
 * <p>Two references denote the same element exactly when their handles
 * are equal. The handle is keyed by the declaring file, the declared
 * name and the offset of the name, so equally named declarations in
 * different files never collide.</p>
 *
 * @param file the declaring file
 * @param name the declared name, qualified with the class for methods
 * @param offset the offset of the declared name
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ElementHandle(Path file, String name, int offset)
        implements ValueObject, Comparable<ElementHandle> {

    private static final Comparator<ElementHandle> ORDER = Comparator
            .comparing((ElementHandle h) -> h.file().toString())
            .thenComparingInt(ElementHandle::offset)
            .thenComparing(ElementHandle::name);

    public ElementHandle {
        Preconditions.requireNonNull(file, "Declaring file is required");
        Preconditions.requireNonNull(name, "Element name is required");
        Preconditions.requireNonNegative(offset,
                "Element offset must not be negative");
    }

    @Override
    public int compareTo(final ElementHandle other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return name + "@" + file.getFileName() + ":" + offset;
    }

}
