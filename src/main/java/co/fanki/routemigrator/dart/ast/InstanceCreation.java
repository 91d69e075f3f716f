package co.fanki.routemigrator.dart.ast;

import java.util.List;

/**
 * A constructor call,
 * {@code [const|new] [prefix.]Type[<T>][.named](args)}.
 *
 * <p>Without a keyword an unqualified call is taken as a construction
 * when its name follows the upper-camel-case type convention, and so is
 * a call of an upper-camel-case name behind a lower-case import prefix.
 * {@code Type.named(args)} without a keyword is left as a method
 * invocation, since a static call reads the same.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class InstanceCreation extends Expression {

    private final String prefix;
    private final String typeName;
    private final String constructorName;
    private final String typeArguments;
    private final String keyword;
    private final ArgumentList argumentList;

    public InstanceCreation(final int theOffset, final int theEnd,
            final String thePrefix, final String theTypeName, final String theConstructorName,
            final String theTypeArguments, final String theKeyword,
            final ArgumentList theArgumentList) {
        super(theOffset, theEnd);
        this.prefix = thePrefix;
        this.typeName = theTypeName;
        this.constructorName = theConstructorName;
        this.typeArguments = theTypeArguments;
        this.keyword = theKeyword;
        this.argumentList = adopt(theArgumentList);
    }

    /** The import prefix, or null. */
    public String prefix() {
        return prefix;
    }

    public String typeName() {
        return typeName;
    }

    /** The named constructor, or null for the unnamed one. */
    public String constructorName() {
        return constructorName;
    }

    public String typeArguments() {
        return typeArguments;
    }

    /** {@code const}, {@code new} or null. */
    public String keyword() {
        return keyword;
    }

    public ArgumentList argumentList() {
        return argumentList;
    }

    @Override
    public List<DartNode> children() {
        return List.of(argumentList);
    }

    @Override
    public void accept(final DartAstVisitor visitor) {
        visitor.visitInstanceCreation(this);
    }

}
