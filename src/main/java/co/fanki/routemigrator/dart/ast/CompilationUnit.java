package co.fanki.routemigrator.dart.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Root of a parsed Dart file.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class CompilationUnit extends DartNode {

    private final List<ImportDirective> imports;
    private final List<DartNode> declarations;

    public CompilationUnit(final int theOffset, final int theEnd,
            final List<ImportDirective> theImports,
            final List<DartNode> theDeclarations) {
        super(theOffset, theEnd);
        this.imports = adoptAll(theImports);
        this.declarations = adoptAll(theDeclarations);
    }

    public List<ImportDirective> imports() {
        return imports;
    }

    /**
     * Returns the top-level declarations: classes, functions and
     * variables.
     *
     * @return the declarations in source order
     */
    public List<DartNode> declarations() {
        return declarations;
    }

    @Override
    public List<DartNode> children() {
        final List<DartNode> children = new ArrayList<>(imports);
        children.addAll(declarations);
        return children;
    }

    @Override
    public void accept(final DartAstVisitor visitor) {
        visitor.visitCompilationUnit(this);
    }

}
