package co.fanki.routemigrator.dart.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A call such as {@code foo(x)}, {@code Navigator.pushNamed(context, r)}
 * or {@code Navigator.of(context).pop()}.
 *
 * <p>The method name is null when an arbitrary expression is invoked,
 * e.g. {@code callbacks[0]()}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class MethodInvocation extends Expression {

    private final Expression target;
    private final String methodName;
    private final int nameOffset;
    private final String typeArguments;
    private final ArgumentList argumentList;

    public MethodInvocation(final int theOffset, final int theEnd,
            final Expression theTarget, final String theMethodName,
            final int theNameOffset, final String theTypeArguments,
            final ArgumentList theArgumentList) {
        super(theOffset, theEnd);
        this.target = adopt(theTarget);
        this.methodName = theMethodName;
        this.nameOffset = theNameOffset;
        this.typeArguments = theTypeArguments;
        this.argumentList = adopt(theArgumentList);
    }

    /** The receiver, or null for unqualified calls. */
    public Expression target() {
        return target;
    }

    public String methodName() {
        return methodName;
    }

    public int nameOffset() {
        return nameOffset;
    }

    /** Source of the type arguments, e.g. {@code <bool>}, or null. */
    public String typeArguments() {
        return typeArguments;
    }

    public ArgumentList argumentList() {
        return argumentList;
    }

    @Override
    public List<DartNode> children() {
        final List<DartNode> children = new ArrayList<>();
        if (target != null) {
            children.add(target);
        }
        children.add(argumentList);
        return children;
    }

    @Override
    public void accept(final DartAstVisitor visitor) {
        visitor.visitMethodInvocation(this);
    }

}
