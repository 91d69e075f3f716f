package co.fanki.routemigrator.migration.domain;

import co.fanki.routemigrator.shared.Preconditions;

import java.nio.file.Path;

/**
 * One navigation fact: a call site found in the project, or a route
 * declaration read back from the router configuration.
 *
 * <p>A record is either <em>structured</em> or <em>verbatim</em>. Both
 * carry typed fields, but a verbatim record also holds the exact source
 * text of a hand-maintained route declaration, and that text always wins
 * over the fields when the configuration is emitted.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class CallRecord {

    /** The context expression assumed when none is captured. */
    public static final String DEFAULT_CONTEXT = "context";

    private final SourceLocation location;
    private final OperationKind kind;
    private final String methodName;
    private final Destination destination;
    private final String destinationExpression;
    private final boolean expressionMatchesPath;
    private final String targetName;
    private final String targetConstructor;
    private final Path targetFile;
    private final String typeArguments;
    private final ArgumentsPayload payload;
    private final String resultExpression;
    private final String contextExpression;
    private final String originalCode;
    private final String declarationText;

    private CallRecord(final Builder builder) {
        this.location = builder.location;
        this.kind = builder.kind;
        this.methodName = builder.methodName;
        this.destination = builder.destination;
        this.destinationExpression = builder.destinationExpression;
        this.expressionMatchesPath = builder.expressionMatchesPath;
        this.targetName = builder.targetName;
        this.targetConstructor = builder.targetConstructor;
        this.targetFile = builder.targetFile;
        this.typeArguments = builder.typeArguments;
        this.payload = builder.payload;
        this.resultExpression = builder.resultExpression;
        this.contextExpression = builder.contextExpression;
        this.originalCode = builder.originalCode;
        this.declarationText = builder.declarationText;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts a builder holding every field of this record.
     *
     * @return a pre-filled builder
     */
    public Builder toBuilder() {
        final Builder builder = new Builder();
        builder.location = location;
        builder.kind = kind;
        builder.methodName = methodName;
        builder.destination = destination;
        builder.destinationExpression = destinationExpression;
        builder.expressionMatchesPath = expressionMatchesPath;
        builder.targetName = targetName;
        builder.targetConstructor = targetConstructor;
        builder.targetFile = targetFile;
        builder.typeArguments = typeArguments;
        builder.payload = payload;
        builder.resultExpression = resultExpression;
        builder.contextExpression = contextExpression;
        builder.originalCode = originalCode;
        builder.declarationText = declarationText;
        return builder;
    }

    public SourceLocation location() {
        return location;
    }

    public OperationKind kind() {
        return kind;
    }

    /** The invoked method: a Navigator method or a helper name. */
    public String methodName() {
        return methodName;
    }

    public Destination destination() {
        return destination;
    }

    /** Source text of the destination argument, null if absent. */
    public String destinationExpression() {
        return destinationExpression;
    }

    /**
     * Checks whether the destination expression evaluates to exactly
     * the destination path, so that it can be reused as is.
     *
     * @return false when the path had to be normalized or is unknown
     */
    public boolean expressionMatchesPath() {
        return expressionMatchesPath;
    }

    /** The page widget class, null if unknown. */
    public String targetName() {
        return targetName;
    }

    /** The named constructor building the page, null for the unnamed one. */
    public String targetConstructor() {
        return targetConstructor;
    }

    /**
     * Returns the page construction as written in a builder, such as
     * {@code ProfilePage} or {@code ProfilePage.edit}.
     *
     * @return the constructor reference, null if the page is unknown
     */
    public String targetConstruction() {
        if (targetName == null || targetConstructor == null) {
            return targetName;
        }
        return targetName + "." + targetConstructor;
    }

    /** The file declaring the page widget, null if unknown. */
    public Path targetFile() {
        return targetFile;
    }

    /** Source text of the call's type arguments, null if none. */
    public String typeArguments() {
        return typeArguments;
    }

    public ArgumentsPayload payload() {
        return payload;
    }

    /** Source text of the value returned to the previous page. */
    public String resultExpression() {
        return resultExpression;
    }

    /** Source text of the BuildContext the call navigates from. */
    public String contextExpression() {
        return contextExpression;
    }

    /** Exact source text of the call, null for imported records. */
    public String originalCode() {
        return originalCode;
    }

    /** Exact source text of the route declaration, null if structured. */
    public String declarationText() {
        return declarationText;
    }

    /**
     * Checks whether this record carries hand-maintained declaration
     * text.
     *
     * @return true if emission must reproduce {@link #declarationText()}
     */
    public boolean isVerbatim() {
        return declarationText != null;
    }

    public boolean isImported() {
        return kind == OperationKind.IMPORTED;
    }

    @Override
    public String toString() {
        return "CallRecord[" + kind + " " + methodName + " -> " + destination
                + (location.isNone() ? "" : " at " + location.file() + ":"
                        + location.line()) + "]";
    }

    /** Builder of {@link CallRecord}s. */
    public static final class Builder {

        private SourceLocation location = SourceLocation.NONE;
        private OperationKind kind;
        private String methodName;
        private Destination destination;
        private String destinationExpression;
        private boolean expressionMatchesPath;
        private String targetName;
        private String targetConstructor;
        private Path targetFile;
        private String typeArguments;
        private ArgumentsPayload payload = ArgumentsPayload.NONE;
        private String resultExpression;
        private String contextExpression = DEFAULT_CONTEXT;
        private String originalCode;
        private String declarationText;

        private Builder() {
        }

        public Builder location(final SourceLocation theLocation) {
            this.location = theLocation;
            return this;
        }

        public Builder kind(final OperationKind theKind) {
            this.kind = theKind;
            return this;
        }

        public Builder methodName(final String theMethodName) {
            this.methodName = theMethodName;
            return this;
        }

        public Builder destination(final Destination theDestination) {
            this.destination = theDestination;
            return this;
        }

        public Builder destinationExpression(final String theExpression) {
            this.destinationExpression = theExpression;
            return this;
        }

        public Builder expressionMatchesPath(final boolean matches) {
            this.expressionMatchesPath = matches;
            return this;
        }

        public Builder targetName(final String theTargetName) {
            this.targetName = theTargetName;
            return this;
        }

        public Builder targetConstructor(final String theConstructor) {
            this.targetConstructor = theConstructor;
            return this;
        }

        public Builder targetFile(final Path theTargetFile) {
            this.targetFile = theTargetFile;
            return this;
        }

        public Builder typeArguments(final String theTypeArguments) {
            this.typeArguments = theTypeArguments;
            return this;
        }

        public Builder payload(final ArgumentsPayload thePayload) {
            this.payload = thePayload;
            return this;
        }

        public Builder resultExpression(final String theResultExpression) {
            this.resultExpression = theResultExpression;
            return this;
        }

        public Builder contextExpression(final String theContextExpression) {
            this.contextExpression = theContextExpression;
            return this;
        }

        public Builder originalCode(final String theOriginalCode) {
            this.originalCode = theOriginalCode;
            return this;
        }

        public Builder declarationText(final String theDeclarationText) {
            this.declarationText = theDeclarationText;
            return this;
        }

        /**
         * Builds the record.
         *
         * @return the record
         * @throws co.fanki.routemigrator.shared.DomainException if the
         *      kind needs a destination and none was given
         */
        public CallRecord build() {
            Preconditions.requireNonNull(location, "Location is required");
            Preconditions.requireNonNull(kind, "Operation kind is required");
            Preconditions.requireNonNull(payload, "Payload is required");
            Preconditions.requireNonBlank(contextExpression,
                    "Context expression is required");
            Preconditions.requireDomain(destination != null,
                    "A " + kind + " record needs a destination");
            Preconditions.requireDomain(
                    kind != OperationKind.IMPORTED || declarationText != null,
                    "Imported records need their declaration text");
            return new CallRecord(this);
        }
    }

}
