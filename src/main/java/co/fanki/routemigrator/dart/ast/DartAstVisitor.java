package co.fanki.routemigrator.dart.ast;

/**
 * Recursive visitor over a Dart syntax tree.
 *
 * <p>Every method visits the children of the node by default, so
 * subclasses override only the node types they care about and call the
 * super method to keep descending.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public abstract class DartAstVisitor {

    /**
     * Visits all direct children of a node.
     *
     * @param node the node whose children are visited
     */
    protected void visitChildren(final DartNode node) {
        for (final DartNode child : node.children()) {
            child.accept(this);
        }
    }

    public void visitCompilationUnit(final CompilationUnit node) {
        visitChildren(node);
    }

    public void visitImportDirective(final ImportDirective node) {
        visitChildren(node);
    }

    public void visitClassDeclaration(final ClassDeclaration node) {
        visitChildren(node);
    }

    public void visitFunctionDeclaration(final FunctionDeclaration node) {
        visitChildren(node);
    }

    public void visitVariableDeclaration(final VariableDeclaration node) {
        visitChildren(node);
    }

    public void visitParameter(final Parameter node) {
        visitChildren(node);
    }

    public void visitBlock(final Block node) {
        visitChildren(node);
    }

    public void visitArgumentList(final ArgumentList node) {
        visitChildren(node);
    }

    public void visitNamedExpression(final NamedExpression node) {
        visitChildren(node);
    }

    public void visitMethodInvocation(final MethodInvocation node) {
        visitChildren(node);
    }

    public void visitInstanceCreation(final InstanceCreation node) {
        visitChildren(node);
    }

    public void visitFunctionExpression(final FunctionExpression node) {
        visitChildren(node);
    }

    public void visitStringLiteral(final StringLiteral node) {
        visitChildren(node);
    }

    public void visitLiteral(final Literal node) {
        visitChildren(node);
    }

    public void visitSimpleIdentifier(final SimpleIdentifier node) {
        visitChildren(node);
    }

    public void visitPropertyAccess(final PropertyAccess node) {
        visitChildren(node);
    }

    public void visitIndexExpression(final IndexExpression node) {
        visitChildren(node);
    }

    public void visitListLiteral(final ListLiteral node) {
        visitChildren(node);
    }

    public void visitSetOrMapLiteral(final SetOrMapLiteral node) {
        visitChildren(node);
    }

    public void visitMapLiteralEntry(final MapLiteralEntry node) {
        visitChildren(node);
    }

    public void visitParenthesizedExpression(
            final ParenthesizedExpression node) {
        visitChildren(node);
    }

    public void visitCompoundExpression(final CompoundExpression node) {
        visitChildren(node);
    }

}
