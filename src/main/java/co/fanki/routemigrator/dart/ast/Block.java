package co.fanki.routemigrator.dart.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A braced function body.
 *
 * <p>Statements are kept as the expressions they contain; control-flow
 * keywords appear as operators of a {@link CompoundExpression}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class Block extends DartNode {

    private final List<Expression> statements;

    public Block(final int theOffset, final int theEnd,
            final List<Expression> theStatements) {
        super(theOffset, theEnd);
        this.statements = adoptAll(theStatements);
    }

    public List<Expression> statements() {
        return statements;
    }

    @Override
    public List<DartNode> children() {
        return new ArrayList<>(statements);
    }

    @Override
    public void accept(final DartAstVisitor visitor) {
        visitor.visitBlock(this);
    }

}
