package co.fanki.routemigrator.dart.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A top-level function, method, getter, setter or constructor.
 *
 * <p>The body is a {@link Block}, an expression for {@code =>} bodies,
 * or null for abstract and external declarations.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class FunctionDeclaration extends DartNode
        implements FunctionLike {

    private final String name;
    private final int nameOffset;
    private final List<Parameter> parameters;
    private final DartNode body;

    public FunctionDeclaration(final int theOffset, final int theEnd,
            final String theName, final int theNameOffset,
            final List<Parameter> theParameters, final DartNode theBody) {
        super(theOffset, theEnd);
        this.name = theName;
        this.nameOffset = theNameOffset;
        this.parameters = adoptAll(theParameters);
        this.body = adopt(theBody);
    }

    public String name() {
        return name;
    }

    public int nameOffset() {
        return nameOffset;
    }

    @Override
    public List<Parameter> parameters() {
        return parameters;
    }

    public DartNode body() {
        return body;
    }

    @Override
    public List<DartNode> children() {
        final List<DartNode> children = new ArrayList<>(parameters);
        if (body != null) {
            children.add(body);
        }
        return children;
    }

    @Override
    public void accept(final DartAstVisitor visitor) {
        visitor.visitFunctionDeclaration(this);
    }

}
