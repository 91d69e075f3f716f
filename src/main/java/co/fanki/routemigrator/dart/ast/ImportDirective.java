package co.fanki.routemigrator.dart.ast;

import java.util.List;

/**
 * An {@code import} or {@code export} directive.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ImportDirective extends DartNode {

    private final String uri;

    public ImportDirective(final int theOffset, final int theEnd,
            final String theUri) {
        super(theOffset, theEnd);
        this.uri = theUri;
    }

    /** The imported URI, e.g. {@code package:app/screens/home.dart}. */
    public String uri() {
        return uri;
    }

    @Override
    public List<DartNode> children() {
        return List.of();
    }

    @Override
    public void accept(final DartAstVisitor visitor) {
        visitor.visitImportDirective(this);
    }

}
