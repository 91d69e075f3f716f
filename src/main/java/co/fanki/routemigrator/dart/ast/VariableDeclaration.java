package co.fanki.routemigrator.dart.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A top-level variable or a field with an initializer.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class VariableDeclaration extends DartNode {

    private final String name;
    private final int nameOffset;
    private final boolean constant;
    private final boolean isStatic;
    private final Expression initializer;

    public VariableDeclaration(final int theOffset, final int theEnd,
            final String theName, final int theNameOffset,
            final boolean isConstant, final boolean isStaticMember,
            final Expression theInitializer) {
        super(theOffset, theEnd);
        this.name = theName;
        this.nameOffset = theNameOffset;
        this.constant = isConstant;
        this.isStatic = isStaticMember;
        this.initializer = adopt(theInitializer);
    }

    public String name() {
        return name;
    }

    public int nameOffset() {
        return nameOffset;
    }

    /** True when declared {@code const}. */
    public boolean constant() {
        return constant;
    }

    public boolean isStatic() {
        return isStatic;
    }

    public Expression initializer() {
        return initializer;
    }

    @Override
    public List<DartNode> children() {
        final List<DartNode> children = new ArrayList<>();
        if (initializer != null) {
            children.add(initializer);
        }
        return children;
    }

    @Override
    public void accept(final DartAstVisitor visitor) {
        visitor.visitVariableDeclaration(this);
    }

}
