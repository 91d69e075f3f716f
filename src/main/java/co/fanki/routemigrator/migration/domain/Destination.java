package co.fanki.routemigrator.migration.domain;

import co.fanki.routemigrator.shared.Preconditions;
import co.fanki.routemigrator.shared.ValueObject;

import java.util.ArrayList;
import java.util.List;

/**
 * A destination path such as {@code /settings/profile}.
 *
 * <p>A destination is either a well-formed absolute path or one of two
 * sentinels: {@link #UNRESOLVED} when the path could not be determined
 * statically, and {@link #NOT_APPLICABLE} for calls that have no
 * destination at all, such as pops. Sentinels never enter the route
 * table.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class Destination implements ValueObject,
        Comparable<Destination> {

    private static final long serialVersionUID = 1L;

    /** A destination that could not be evaluated as a constant. */
    public static final Destination UNRESOLVED =
            new Destination("dynamic_route");

    /** The destination of calls that do not navigate anywhere. */
    public static final Destination NOT_APPLICABLE = new Destination("N/A");

    /** The root route. */
    public static final Destination ROOT = new Destination("/");

    private final String path;

    private Destination(final String thePath) {
        this.path = thePath;
    }

    /**
     * Creates a destination from a well-formed absolute path.
     *
     * @param path the path, starting with {@code /}
     * @return the destination
     * @throws co.fanki.routemigrator.shared.DomainException if the path is
     *      not absolute or contains empty segments
     */
    public static Destination of(final String path) {
        Preconditions.requireNonNull(path, "Path is required");
        Preconditions.requireDomain(path.startsWith("/"),
                "Destination must be an absolute path: " + path);
        Preconditions.requireDomain(!path.contains("//"),
                "Destination must not contain empty segments: " + path);
        Preconditions.requireDomain(path.length() == 1 || !path.endsWith("/"),
                "Destination must not end with a separator: " + path);
        return path.equals(ROOT.path) ? ROOT : new Destination(path);
    }

    /**
     * Normalizes a route name taken from source code.
     *
     * <p>A missing leading separator is added, repeated separators are
     * collapsed and a trailing separator is dropped. An empty name is
     * unresolved.</p>
     *
     * @param routeName the route name as written in code
     * @return the destination
     */
    public static Destination parse(final String routeName) {
        if (routeName == null || routeName.isBlank()) {
            return UNRESOLVED;
        }
        String normalized = ("/" + routeName.trim()).replaceAll("/{2,}", "/");
        if (normalized.length() > 1 && normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return of(normalized);
    }

    /**
     * Derives the destination of a page widget from its class name.
     *
     * @param widgetName the widget class name, e.g. {@code SettingsScreen}
     * @return the destination, e.g. {@code /settings-screen}
     */
    public static Destination fromWidgetName(final String widgetName) {
        Preconditions.requireNonBlank(widgetName, "Widget name is required");
        return of("/" + toKebabCase(widgetName));
    }

    /**
     * Converts an upper camel case name to lower kebab case.
     *
     * <p>A separator is inserted before every upper-case letter except
     * the first character, then the result is lower-cased.</p>
     *
     * @param name the name to convert
     * @return the kebab-case name
     */
    public static String toKebabCase(final String name) {
        final StringBuilder result = new StringBuilder();
        for (int i = 0; i < name.length(); i++) {
            final char c = name.charAt(i);
            if (i > 0 && Character.isUpperCase(c)) {
                result.append('-');
            }
            result.append(Character.toLowerCase(c));
        }
        return result.toString();
    }

    public String path() {
        return path;
    }

    /**
     * Checks whether this is a real path, not a sentinel.
     *
     * @return true for resolved destinations
     */
    public boolean isResolved() {
        return !equals(UNRESOLVED) && !equals(NOT_APPLICABLE);
    }

    public boolean isRoot() {
        return equals(ROOT);
    }

    /**
     * Returns the non-empty segments of the path.
     *
     * @return the segments, empty for the root and for sentinels
     */
    public List<String> segments() {
        final List<String> segments = new ArrayList<>();
        if (!isResolved()) {
            return segments;
        }
        for (final String segment : path.split("/")) {
            if (!segment.isEmpty()) {
                segments.add(segment);
            }
        }
        return segments;
    }

    @Override
    public int compareTo(final Destination other) {
        return path.compareTo(other.path);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return path.equals(((Destination) o).path);
    }

    @Override
    public int hashCode() {
        return path.hashCode();
    }

    @Override
    public String toString() {
        return path;
    }

}
