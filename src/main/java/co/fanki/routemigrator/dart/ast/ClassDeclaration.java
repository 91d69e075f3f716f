package co.fanki.routemigrator.dart.ast;

import java.util.List;
import java.util.Optional;

/**
 * A class, mixin or extension declaration with its members.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ClassDeclaration extends DartNode {

    private final String name;
    private final int nameOffset;
    private final List<DartNode> members;

    public ClassDeclaration(final int theOffset, final int theEnd,
            final String theName, final int theNameOffset,
            final List<DartNode> theMembers) {
        super(theOffset, theEnd);
        this.name = theName;
        this.nameOffset = theNameOffset;
        this.members = adoptAll(theMembers);
    }

    public String name() {
        return name;
    }

    public int nameOffset() {
        return nameOffset;
    }

    public List<DartNode> members() {
        return members;
    }

    /**
     * Finds a method, getter or constructor declared in this class.
     *
     * @param methodName the member name
     * @return the first declaration with that name
     */
    public Optional<FunctionDeclaration> method(final String methodName) {
        return members.stream()
                .filter(FunctionDeclaration.class::isInstance)
                .map(FunctionDeclaration.class::cast)
                .filter(f -> f.name().equals(methodName))
                .findFirst();
    }

    /**
     * Finds a field declared in this class.
     *
     * @param fieldName the field name
     * @return the field declaration
     */
    public Optional<VariableDeclaration> field(final String fieldName) {
        return members.stream()
                .filter(VariableDeclaration.class::isInstance)
                .map(VariableDeclaration.class::cast)
                .filter(v -> v.name().equals(fieldName))
                .findFirst();
    }

    @Override
    public List<DartNode> children() {
        return members;
    }

    @Override
    public void accept(final DartAstVisitor visitor) {
        visitor.visitClassDeclaration(this);
    }

}
