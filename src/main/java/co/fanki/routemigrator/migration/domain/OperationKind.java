package co.fanki.routemigrator.migration.domain;

import java.util.Optional;

/**
 * What a navigation call does.
 *
 * <p>Each direct kind is tied to the {@code Navigator} method that
 * produces it. {@link #UNRESOLVED} marks a widget push whose page cannot
 * be recognized, and {@link #IMPORTED} marks a route read back from an
 * existing router configuration.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum OperationKind {

    /** {@code Navigator.pushNamed}. */
    NAVIGATE_BY_NAME("pushNamed"),

    /** {@code Navigator.push} with a page route. */
    NAVIGATE_BY_WIDGET("push"),

    /** {@code Navigator.pushReplacementNamed}. */
    REPLACE_BY_NAME("pushReplacementNamed"),

    /** {@code Navigator.pushReplacement} with a page route. */
    REPLACE_BY_WIDGET("pushReplacement"),

    /** {@code Navigator.pop}. */
    POP("pop"),

    /** {@code Navigator.canPop}. */
    CONDITIONAL_POP("canPop"),

    /** {@code Navigator.maybePop}. */
    MAYBE_POP("maybePop"),

    /** {@code Navigator.popAndPushNamed}. */
    POP_THEN_NAVIGATE_BY_NAME("popAndPushNamed"),

    /** {@code Navigator.pushNamedAndRemoveUntil}. */
    NAVIGATE_AND_CLEAR("pushNamedAndRemoveUntil"),

    /** A widget push whose page could not be recognized. */
    UNRESOLVED(null),

    /** A route declaration read from the router configuration. */
    IMPORTED(null);

    private final String navigatorMethod;

    OperationKind(final String theNavigatorMethod) {
        this.navigatorMethod = theNavigatorMethod;
    }

    /**
     * Finds the kind produced by a {@code Navigator} method.
     *
     * @param method the invoked method name
     * @return the kind, empty if the method is not part of the vocabulary
     */
    public static Optional<OperationKind> fromNavigatorMethod(
            final String method) {
        if (method == null) {
            return Optional.empty();
        }
        for (final OperationKind kind : values()) {
            if (method.equals(kind.navigatorMethod)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    /** True for kinds whose destination is a route name argument. */
    public boolean isByName() {
        return this == NAVIGATE_BY_NAME || this == REPLACE_BY_NAME
                || this == POP_THEN_NAVIGATE_BY_NAME
                || this == NAVIGATE_AND_CLEAR;
    }

    /** True for kinds whose destination is derived from a page widget. */
    public boolean isByWidget() {
        return this == NAVIGATE_BY_WIDGET || this == REPLACE_BY_WIDGET;
    }

}
