package co.fanki.routemigrator.dart;

import co.fanki.routemigrator.dart.Token.TokenType;
import co.fanki.routemigrator.dart.ast.ArgumentList;
import co.fanki.routemigrator.dart.ast.Block;
import co.fanki.routemigrator.dart.ast.ClassDeclaration;
import co.fanki.routemigrator.dart.ast.CompilationUnit;
import co.fanki.routemigrator.dart.ast.CompoundExpression;
import co.fanki.routemigrator.dart.ast.DartNode;
import co.fanki.routemigrator.dart.ast.Expression;
import co.fanki.routemigrator.dart.ast.FunctionDeclaration;
import co.fanki.routemigrator.dart.ast.FunctionExpression;
import co.fanki.routemigrator.dart.ast.ImportDirective;
import co.fanki.routemigrator.dart.ast.IndexExpression;
import co.fanki.routemigrator.dart.ast.InstanceCreation;
import co.fanki.routemigrator.dart.ast.ListLiteral;
import co.fanki.routemigrator.dart.ast.Literal;
import co.fanki.routemigrator.dart.ast.MapLiteralEntry;
import co.fanki.routemigrator.dart.ast.MethodInvocation;
import co.fanki.routemigrator.dart.ast.NamedExpression;
import co.fanki.routemigrator.dart.ast.Parameter;
import co.fanki.routemigrator.dart.ast.ParenthesizedExpression;
import co.fanki.routemigrator.dart.ast.PropertyAccess;
import co.fanki.routemigrator.dart.ast.SetOrMapLiteral;
import co.fanki.routemigrator.dart.ast.SimpleIdentifier;
import co.fanki.routemigrator.dart.ast.StringLiteral;
import co.fanki.routemigrator.dart.ast.VariableDeclaration;
import co.fanki.routemigrator.shared.Preconditions;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Tolerant recursive-descent parser for Dart source.
 *
 * <p>Declarations (imports, classes, functions, variables and
 * parameters) are parsed structurally. Inside bodies and initializers
 * only the expression shapes the migration needs are modelled: calls,
 * constructions, closures, literals, member access and indexing. Any
 * other token becomes an operator of a {@link CompoundExpression}, which
 * keeps every operand reachable. The parser never fails; malformed input
 * degrades into coarser nodes.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class DartParser {

    /** Words that never start an operand. */
    private static final Set<String> RESERVED = Set.of(
            "if", "else", "for", "while", "do", "switch", "case", "default",
            "return", "throw", "await", "yield", "is", "as", "in", "try",
            "catch", "finally", "on", "break", "continue", "assert", "var",
            "final", "late", "rethrow");

    /** Keywords whose parenthesized part is never a closure. */
    private static final Set<String> CONTROL = Set.of(
            "if", "for", "while", "switch", "catch");

    /** Keywords after which a closing block may continue a statement. */
    private static final Set<String> CONTINUATIONS = Set.of(
            "else", "catch", "on", "finally", "while");

    /** Keywords directly followed by a block. */
    private static final Set<String> BLOCK_KEYWORDS = Set.of(
            "else", "try", "finally", "do");

    private static final Set<String> CLASS_MODIFIERS = Set.of(
            "abstract", "base", "sealed", "interface", "final");

    private static final Set<String> PARAMETER_MODIFIERS = Set.of(
            "required", "final", "covariant", "var", "const", "late");
    private static final Set<String> ARGUMENT_END = Set.of(",", ")");
    private static final Set<String> ELEMENT_END = Set.of(",");
    private static final Set<String> KEY_END = Set.of(",", ":");
    private static final Set<String> STATEMENT_END = Set.of(";");
    private static final Set<String> DECLARATOR_END = Set.of(",", ";");
    private static final Set<String> ARROW_END = Set.of(",", ";");

    /** How far a type argument list is looked ahead. */
    private static final int TYPE_ARGUMENT_LOOKAHEAD = 64;

    private final String source;
    private final List<Token> tokens;
    private int pos;

    private DartParser(final String theSource, final List<Token> theTokens) {
        this.source = theSource;
        this.tokens = theTokens;
    }

    /**
     * Parses a complete Dart file.
     *
     * @param source the file content
     * @return the compilation unit, never null
     */
    public static CompilationUnit parse(final String source) {
        Preconditions.requireNonNull(source, "Source is required");
        return new DartParser(source, DartLexer.tokenize(source)).unit();
    }

    // ------------------------------------------------------------------
    // Declarations
    // ------------------------------------------------------------------

    private CompilationUnit unit() {
        final List<ImportDirective> imports = new ArrayList<>();
        final List<DartNode> declarations = new ArrayList<>();
        while (!atEnd()) {
            final int before = pos;
            topLevel(imports, declarations);
            if (pos == before) {
                pos++;
            }
        }
        return new CompilationUnit(0, source.length(), imports,
                declarations);
    }

    private void topLevel(final List<ImportDirective> imports,
            final List<DartNode> declarations) {
        skipAnnotations();
        final Token first = peek();
        if (first.isWord("import") || first.isWord("export")) {
            advance();
            String uri = "";
            if (peek().type() == TokenType.STRING) {
                uri = literalText(advance());
            }
            skipPast(";");
            imports.add(new ImportDirective(first.offset(), previousEnd(),
                    uri));
            return;
        }
        if (first.isWord("library") || first.isWord("part")
                || first.isWord("typedef")) {
            skipPast(";");
            return;
        }
        int k = pos;
        while (CLASS_MODIFIERS.contains(wordAt(k))) {
            k++;
        }
        final String keyword = wordAt(k);
        if (keyword.equals("class") || keyword.equals("mixin")
                || keyword.equals("extension")) {
            pos = k;
            declarations.add(classDeclaration(first.offset()));
            return;
        }
        if (keyword.equals("enum")) {
            skipUntilBrace();
            if (peek().is("{")) {
                skipBalanced();
            }
            return;
        }
        member(declarations);
    }

    private ClassDeclaration classDeclaration(final int start) {
        advance();
        if (peek().isWord("class") || peek().isWord("type")) {
            advance();
        }
        String name = "";
        int nameOffset = peek().offset();
        if (peek().type() == TokenType.IDENTIFIER && !peek().isWord("on")) {
            final Token nameToken = advance();
            name = nameToken.text();
            nameOffset = nameToken.offset();
        }
        final List<DartNode> members = new ArrayList<>();
        skipUntilBrace();
        if (peek().is("{")) {
            advance();
            while (!atEnd() && !peek().is("}")) {
                final int before = pos;
                skipAnnotations();
                member(members);
                if (pos == before) {
                    pos++;
                }
            }
            if (peek().is("}")) {
                advance();
            }
        } else if (peek().is(";")) {
            advance();
        }
        return new ClassDeclaration(start, previousEnd(), name, nameOffset,
                members);
    }

    /**
     * Parses one member: a variable, function, method, getter, setter or
     * constructor. The header is scanned until a token decides its shape.
     */
    private void member(final List<DartNode> out) {
        skipAnnotations();
        final int start = peek().offset();
        boolean constant = false;
        boolean isStatic = false;
        Token lastWord = null;
        while (!atEnd()) {
            final Token t = peek();
            if (t.is("}")) {
                return;
            }
            if (t.is(";")) {
                advance();
                return;
            }
            if (t.is("=") && lastWord != null) {
                advance();
                declarators(out, start, lastWord, constant, isStatic);
                return;
            }
            if (t.is("(")) {
                if (lastWord == null || lastWord.isWord("Function")) {
                    skipBalanced();
                    continue;
                }
                out.add(function(start, lastWord));
                return;
            }
            if (t.is("=>") || t.is("{")) {
                out.add(getter(start, lastWord));
                return;
            }
            if (t.is("<")) {
                final int end = typeArgumentsEnd(pos);
                pos = end > 0 ? end : pos + 1;
                continue;
            }
            if (t.type() == TokenType.IDENTIFIER) {
                constant |= t.isWord("const");
                isStatic |= t.isWord("static");
                lastWord = t;
            }
            advance();
        }
    }

    private void declarators(final List<DartNode> out, final int start,
            final Token firstName, final boolean constant,
            final boolean isStatic) {
        Token name = firstName;
        Expression initializer = soup(DECLARATOR_END, false);
        out.add(new VariableDeclaration(start, previousEnd(), name.text(),
                name.offset(), constant, isStatic, initializer));
        while (peek().is(",")) {
            advance();
            if (peek().type() != TokenType.IDENTIFIER) {
                break;
            }
            name = advance();
            initializer = null;
            if (peek().is("=")) {
                advance();
                initializer = soup(DECLARATOR_END, false);
            }
            out.add(new VariableDeclaration(name.offset(), previousEnd(),
                    name.text(), name.offset(), constant, isStatic,
                    initializer));
        }
        if (peek().is(";")) {
            advance();
        }
    }

    private FunctionDeclaration function(final int start,
            final Token name) {
        final List<Parameter> parameters = parameters();
        skipBodyModifiers();
        if (peek().is(":")) {
            // constructor initializer list
            int depth = 0;
            while (!atEnd()) {
                final Token t = peek();
                if (depth == 0 && (t.is("{") || t.is("=>") || t.is(";"))) {
                    break;
                }
                if (isOpener(t)) {
                    depth++;
                } else if (isCloser(t)) {
                    if (depth == 0) {
                        break;
                    }
                    depth--;
                }
                advance();
            }
        }
        if (peek().is("=")) {
            skipPast(";");
            return new FunctionDeclaration(start, previousEnd(), name.text(),
                    name.offset(), parameters, null);
        }
        final DartNode body = functionBody();
        return new FunctionDeclaration(start, previousEnd(), name.text(),
                name.offset(), parameters, body);
    }

    private FunctionDeclaration getter(final int start, final Token name) {
        final DartNode body = functionBody();
        final String text = name == null ? "" : name.text();
        final int offset = name == null ? start : name.offset();
        return new FunctionDeclaration(start, previousEnd(), text, offset,
                List.of(), body);
    }

    private DartNode functionBody() {
        if (peek().is("{")) {
            return block();
        }
        if (peek().is("=>")) {
            advance();
            final Expression body = soup(STATEMENT_END, false);
            if (peek().is(";")) {
                advance();
            }
            return body;
        }
        if (peek().is(";")) {
            advance();
        }
        return null;
    }

    private void skipBodyModifiers() {
        while (peek().isWord("async") || peek().isWord("sync")
                || peek().is("*")) {
            advance();
        }
    }

    /**
     * Parses a formal parameter list starting at its opening parenthesis.
     * Default values and types are skipped; only names survive.
     */
    private List<Parameter> parameters() {
        final List<Parameter> result = new ArrayList<>();
        advance();
        final List<Token> current = new ArrayList<>();
        boolean named = false;
        int depth = 0;
        while (!atEnd()) {
            final Token t = peek();
            if (depth == 0) {
                if (t.is(")")) {
                    addParameter(current, named, result);
                    advance();
                    return result;
                }
                if ((t.is("{") || t.is("[")) && current.isEmpty()) {
                    named = t.is("{");
                    advance();
                    continue;
                }
                if (t.is("}") || t.is("]") || t.is(",")) {
                    addParameter(current, named, result);
                    advance();
                    continue;
                }
            }
            if (isOpener(t) || t.is("<")) {
                depth++;
            } else if (isCloser(t) || t.is(">")) {
                depth = Math.max(0, depth - 1);
            }
            current.add(t);
            advance();
        }
        addParameter(current, named, result);
        return result;
    }

    private static void addParameter(final List<Token> current,
            final boolean named, final List<Parameter> out) {
        Token type = null;
        Token name = null;
        int depth = 0;
        for (final Token t : current) {
            if (depth == 0 && (t.is("=") || t.is(":"))) {
                break;
            }
            if (isOpener(t) || t.is("<")) {
                depth++;
            } else if (isCloser(t) || t.is(">")) {
                depth = Math.max(0, depth - 1);
            } else if (depth == 0 && t.type() == TokenType.IDENTIFIER) {
                if (name != null && !PARAMETER_MODIFIERS.contains(
                        name.text())) {
                    type = name;
                }
                name = t;
            } else if (depth == 0 && t.is(".")) {
                // this.field, super.field or prefix.Type
                type = null;
                name = null;
            }
        }
        if (name != null) {
            out.add(new Parameter(name.offset(), name.end(),
                    type == null ? null : type.text(), name.text(), named));
        }
        current.clear();
    }

    // ------------------------------------------------------------------
    // Statements
    // ------------------------------------------------------------------

    private Block block() {
        final int start = peek().offset();
        final List<Expression> statements = blockStatements();
        return new Block(start, previousEnd(), statements);
    }

    private List<Expression> blockStatements() {
        advance();
        final List<Expression> statements = new ArrayList<>();
        while (!atEnd() && !peek().is("}")) {
            final int before = pos;
            final Expression statement = soup(STATEMENT_END, true);
            if (statement != null) {
                statements.add(statement);
            }
            if (peek().is(";")) {
                advance();
            }
            if (pos == before) {
                pos++;
            }
        }
        if (peek().is("}")) {
            advance();
        }
        return statements;
    }

    // ------------------------------------------------------------------
    // Expressions
    // ------------------------------------------------------------------

    /**
     * Parses a run of operands and operators until a terminator or an
     * unmatched closing bracket.
     *
     * @param terminators punctuation that ends the run at this level
     * @param statement whether braces after control keywords are blocks
     * @return the single operand, a compound of several, or null if the
     *      run is empty
     */
    private Expression soup(final Set<String> terminators,
            final boolean statement) {
        final int start = peek().offset();
        final List<Expression> operands = new ArrayList<>();
        final List<String> operators = new ArrayList<>();
        while (!atEnd()) {
            final Token t = peek();
            if (t.type() == TokenType.PUNCTUATION
                    && (terminators.contains(t.text()) || isCloser(t))) {
                break;
            }
            if (statement && t.is("{")
                    && startsBlock(operands.isEmpty() && operators.isEmpty())) {
                operands.addAll(blockStatements());
                if (!CONTINUATIONS.contains(wordAt(pos))) {
                    break;
                }
                continue;
            }
            final int before = pos;
            final Expression operand = primary();
            if (operand != null) {
                operands.add(selectors(operand));
            } else if (pos == before) {
                operators.add(t.text());
                advance();
            }
        }
        if (operands.isEmpty()) {
            return null;
        }
        if (operands.size() == 1 && operators.isEmpty()) {
            return operands.get(0);
        }
        return new CompoundExpression(start, previousEnd(), operands,
                operators);
    }

    private boolean startsBlock(final boolean statementStart) {
        if (statementStart || pos == 0) {
            return true;
        }
        final Token previous = tokens.get(pos - 1);
        return previous.is(")") || previous.is(";") || previous.is("{")
                || previous.is("}")
                || (previous.type() == TokenType.IDENTIFIER
                        && BLOCK_KEYWORDS.contains(previous.text()));
    }

    private Expression primary() {
        final Token t = peek();
        switch (t.type()) {
            case STRING:
                return stringLiteral();
            case NUMBER:
                advance();
                return new Literal(t.offset(), t.end(), t.text());
            case IDENTIFIER:
                return identifierPrimary();
            case PUNCTUATION:
                return punctuationPrimary();
            default:
                return null;
        }
    }

    private Expression identifierPrimary() {
        final Token t = peek();
        final String word = t.text();
        if (word.equals("true") || word.equals("false")
                || word.equals("null")) {
            advance();
            return new Literal(t.offset(), t.end(), word);
        }
        if (RESERVED.contains(word)) {
            return null;
        }
        if (word.equals("const") || word.equals("new")) {
            return keywordCreation();
        }
        final Token next = peekAt(pos + 1);
        if (next.is("(")) {
            advance();
            return invocationOrCreation(t, null);
        }
        if (next.is(".") && !isTypeName(word)
                && isTypeName(wordAt(pos + 2)) && isCallAt(pos + 3)) {
            return prefixedCreation();
        }
        if (next.is("<")) {
            final int end = typeArgumentsEnd(pos + 1);
            if (end > 0 && tokenAt(end).is("(")) {
                advance();
                final String typeArguments = text(pos, end);
                pos = end;
                return invocationOrCreation(t, typeArguments);
            }
        }
        advance();
        return new SimpleIdentifier(t.offset(), t.end(), word);
    }

    private Expression invocationOrCreation(final Token name,
            final String typeArguments) {
        final ArgumentList arguments = argumentList();
        if (isTypeName(name.text())) {
            return new InstanceCreation(name.offset(), previousEnd(), null,
                    name.text(), null, typeArguments, null, arguments);
        }
        return new MethodInvocation(name.offset(), previousEnd(), null,
                name.text(), name.offset(), typeArguments, arguments);
    }

    /** Parses {@code prefix.Type[<T>](args)}, a prefixed construction. */
    private InstanceCreation prefixedCreation() {
        final Token prefix = advance();
        advance();
        final Token type = advance();
        String typeArguments = null;
        if (peek().is("<")) {
            final int end = typeArgumentsEnd(pos);
            typeArguments = text(pos, end);
            pos = end;
        }
        final ArgumentList arguments = argumentList();
        return new InstanceCreation(prefix.offset(), previousEnd(),
                prefix.text(), type.text(), null, typeArguments, null,
                arguments);
    }

    private boolean isCallAt(final int k) {
        if (tokenAt(k).is("(")) {
            return true;
        }
        if (!tokenAt(k).is("<")) {
            return false;
        }
        final int end = typeArgumentsEnd(k);
        return end > 0 && tokenAt(end).is("(");
    }

    private Expression keywordCreation() {
        final Token keyword = advance();
        if (peek().type() != TokenType.IDENTIFIER) {
            final Expression literal = collectionLiteral(keyword.offset());
            return literal != null ? literal : primary();
        }
        final Token first = advance();
        String prefix = null;
        String typeName = first.text();
        String constructorName = null;
        if (peek().is(".") && peekAt(pos + 1).type() == TokenType.IDENTIFIER) {
            advance();
            final String second = advance().text();
            if (isTypeName(first.text())) {
                constructorName = second;
            } else {
                prefix = first.text();
                typeName = second;
            }
        }
        String typeArguments = null;
        if (peek().is("<")) {
            final int end = typeArgumentsEnd(pos);
            if (end > 0) {
                typeArguments = text(pos, end);
                pos = end;
            }
        }
        if (constructorName == null && peek().is(".")
                && peekAt(pos + 1).type() == TokenType.IDENTIFIER) {
            advance();
            constructorName = advance().text();
        }
        if (!peek().is("(")) {
            return new SimpleIdentifier(first.offset(), previousEnd(),
                    typeName);
        }
        final ArgumentList arguments = argumentList();
        return new InstanceCreation(keyword.offset(), previousEnd(),
                prefix, typeName, constructorName, typeArguments, keyword.text(),
                arguments);
    }

    private Expression punctuationPrimary() {
        final Token t = peek();
        if (t.is("(")) {
            return isClosureAhead() ? closure() : parenthesized();
        }
        return collectionLiteral(t.offset());
    }

    /**
     * Parses a list, set or map literal at the current token.
     *
     * @param start the offset the literal spans from, which is earlier
     *      than the current token when a {@code const} keyword precedes it
     * @return the literal, or null if none starts here
     */
    private Expression collectionLiteral(final int start) {
        final Token t = peek();
        if (t.is("[")) {
            return listLiteral(start, null);
        }
        if (t.is("{")) {
            return setOrMapLiteral(start, null);
        }
        if (t.is("<")) {
            final int end = typeArgumentsEnd(pos);
            if (end > 0 && tokenAt(end).is("[")) {
                final String typeArguments = text(pos, end);
                pos = end;
                return listLiteral(start, typeArguments);
            }
            if (end > 0 && tokenAt(end).is("{")) {
                final String typeArguments = text(pos, end);
                pos = end;
                return setOrMapLiteral(start, typeArguments);
            }
        }
        return null;
    }

    private boolean isClosureAhead() {
        if (pos > 0) {
            final Token previous = tokens.get(pos - 1);
            if (previous.type() == TokenType.IDENTIFIER
                    && CONTROL.contains(previous.text())) {
                return false;
            }
        }
        int k = matchingClose(pos);
        if (k < 0) {
            return false;
        }
        k++;
        while (tokenAt(k).isWord("async") || tokenAt(k).isWord("sync")
                || tokenAt(k).is("*")) {
            k++;
        }
        return tokenAt(k).is("=>") || tokenAt(k).is("{");
    }

    private FunctionExpression closure() {
        final int start = peek().offset();
        final List<Parameter> parameters = parameters();
        skipBodyModifiers();
        final DartNode body;
        if (peek().is("=>")) {
            advance();
            body = soup(ARROW_END, false);
        } else {
            body = block();
        }
        return new FunctionExpression(start, previousEnd(), parameters, body);
    }

    private ParenthesizedExpression parenthesized() {
        final int start = advance().offset();
        final Expression inner = soup(ARGUMENT_END, false);
        while (!atEnd() && !peek().is(")") && !peek().is("]")
                && !peek().is("}")) {
            advance();
            soup(ARGUMENT_END, false);
        }
        if (peek().is(")")) {
            advance();
        }
        return new ParenthesizedExpression(start, previousEnd(), inner);
    }

    private ListLiteral listLiteral(final int start,
            final String typeArguments) {
        advance();
        final List<Expression> elements = new ArrayList<>();
        while (!atEnd() && !peek().is("]")) {
            final int before = pos;
            final Expression element = soup(ELEMENT_END, false);
            if (element != null) {
                elements.add(element);
            }
            if (peek().is(",")) {
                advance();
            } else if (!peek().is("]") && pos == before) {
                advance();
            }
        }
        if (peek().is("]")) {
            advance();
        }
        return new ListLiteral(start, previousEnd(), typeArguments, elements);
    }

    private SetOrMapLiteral setOrMapLiteral(final int start,
            final String typeArguments) {
        advance();
        final List<Expression> elements = new ArrayList<>();
        boolean map = false;
        while (!atEnd() && !peek().is("}")) {
            final int before = pos;
            final Expression key = soup(KEY_END, false);
            if (peek().is(":")) {
                advance();
                final Expression value = soup(ELEMENT_END, false);
                if (key != null) {
                    elements.add(new MapLiteralEntry(key.offset(),
                            previousEnd(), key, value));
                    map = true;
                }
            } else if (key != null) {
                elements.add(key);
            }
            if (peek().is(",")) {
                advance();
            } else if (!peek().is("}") && pos == before) {
                advance();
            }
        }
        if (peek().is("}")) {
            advance();
        }
        if (elements.isEmpty()) {
            map = typeArguments == null || typeArguments.contains(",");
        }
        return new SetOrMapLiteral(start, previousEnd(), typeArguments,
                elements, map);
    }

    private StringLiteral stringLiteral() {
        final int start = peek().offset();
        final List<Object> parts = new ArrayList<>();
        final StringBuilder text = new StringBuilder();
        while (peek().type() == TokenType.STRING) {
            final Token token = advance();
            for (final StringLiteralDecoder.Segment segment
                    : StringLiteralDecoder.decode(source, token)) {
                if (!segment.isInterpolation()) {
                    text.append(segment.text());
                    continue;
                }
                if (text.length() > 0) {
                    parts.add(text.toString());
                    text.setLength(0);
                }
                final Expression expression = new DartParser(source,
                        DartLexer.tokenize(source, segment.start(),
                                segment.end())).soup(Set.of(), false);
                if (expression != null) {
                    parts.add(expression);
                }
            }
        }
        if (text.length() > 0 || parts.isEmpty()) {
            parts.add(text.toString());
        }
        return new StringLiteral(start, previousEnd(), parts);
    }

    /** Applies member access, calls, indexing and null assertions. */
    private Expression selectors(final Expression operand) {
        Expression current = operand;
        while (true) {
            final Token t = peek();
            if ((t.is(".") || t.is("?."))
                    && peekAt(pos + 1).type() == TokenType.IDENTIFIER) {
                advance();
                final Token name = advance();
                String typeArguments = null;
                if (peek().is("<")) {
                    final int end = typeArgumentsEnd(pos);
                    if (end > 0 && tokenAt(end).is("(")) {
                        typeArguments = text(pos, end);
                        pos = end;
                    }
                }
                if (peek().is("(")) {
                    final ArgumentList arguments = argumentList();
                    current = new MethodInvocation(current.offset(),
                            previousEnd(), current, name.text(),
                            name.offset(), typeArguments, arguments);
                } else {
                    current = new PropertyAccess(current.offset(),
                            previousEnd(), current, name.text());
                }
            } else if (t.is("!")) {
                advance();
            } else if (t.is("[")) {
                advance();
                final Expression index = soup(Set.of(), false);
                if (peek().is("]")) {
                    advance();
                }
                current = new IndexExpression(current.offset(),
                        previousEnd(), current, index);
            } else if (t.is("(")) {
                final ArgumentList arguments = argumentList();
                current = new MethodInvocation(current.offset(),
                        previousEnd(), current, null, t.offset(), null,
                        arguments);
            } else {
                return current;
            }
        }
    }

    private ArgumentList argumentList() {
        final int start = advance().offset();
        final List<Expression> arguments = new ArrayList<>();
        while (!atEnd() && !peek().is(")")) {
            final int before = pos;
            final Token t = peek();
            if (t.type() == TokenType.IDENTIFIER && peekAt(pos + 1).is(":")) {
                advance();
                advance();
                final Expression value = soup(ARGUMENT_END, false);
                if (value != null) {
                    arguments.add(new NamedExpression(t.offset(),
                            previousEnd(), t.text(), value));
                }
            } else {
                final Expression value = soup(ARGUMENT_END, false);
                if (value != null) {
                    arguments.add(value);
                }
            }
            if (peek().is(",")) {
                advance();
            } else if (pos == before) {
                advance();
            }
            if (peek().is("]") || peek().is("}")) {
                break;
            }
        }
        if (peek().is(")")) {
            advance();
        }
        return new ArgumentList(start, previousEnd(), arguments);
    }

    // ------------------------------------------------------------------
    // Token helpers
    // ------------------------------------------------------------------

    /**
     * Finds the end of a type argument list starting at {@code k}.
     *
     * @return the index after the closing {@code >}, or -1 if the tokens
     *      at {@code k} are not a type argument list
     */
    private int typeArgumentsEnd(final int k) {
        if (!tokenAt(k).is("<")) {
            return -1;
        }
        int depth = 0;
        for (int i = k; i < tokens.size() && i < k + TYPE_ARGUMENT_LOOKAHEAD;
                i++) {
            final Token t = tokens.get(i);
            if (t.is("<")) {
                depth++;
            } else if (t.is(">")) {
                depth--;
                if (depth == 0) {
                    return i + 1;
                }
            } else if (t.type() != TokenType.IDENTIFIER && !t.is(",")
                    && !t.is(".") && !t.is("?") && !t.is("(")
                    && !t.is(")")) {
                return -1;
            }
        }
        return -1;
    }

    /** Returns the index of the bracket closing the one at {@code k}. */
    private int matchingClose(final int k) {
        int depth = 0;
        for (int i = k; i < tokens.size(); i++) {
            final Token t = tokens.get(i);
            if (isOpener(t)) {
                depth++;
            } else if (isCloser(t)) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private void skipBalanced() {
        final int close = matchingClose(pos);
        pos = close < 0 ? tokens.size() - 1 : close + 1;
    }

    private void skipUntilBrace() {
        while (!atEnd() && !peek().is("{") && !peek().is(";")) {
            if (peek().is("(")) {
                skipBalanced();
            } else {
                advance();
            }
        }
    }

    private void skipPast(final String punctuation) {
        int depth = 0;
        while (!atEnd()) {
            final Token t = advance();
            if (isOpener(t)) {
                depth++;
            } else if (isCloser(t)) {
                depth = Math.max(0, depth - 1);
            } else if (depth == 0 && t.is(punctuation)) {
                return;
            }
        }
    }

    private void skipAnnotations() {
        while (peek().is("@")) {
            advance();
            if (peek().type() == TokenType.IDENTIFIER) {
                advance();
            }
            while (peek().is(".")
                    && peekAt(pos + 1).type() == TokenType.IDENTIFIER) {
                advance();
                advance();
            }
            if (peek().is("(")) {
                skipBalanced();
            }
        }
    }

    private String literalText(final Token token) {
        final StringBuilder text = new StringBuilder();
        for (final StringLiteralDecoder.Segment segment
                : StringLiteralDecoder.decode(source, token)) {
            if (!segment.isInterpolation()) {
                text.append(segment.text());
            }
        }
        return text.toString();
    }

    private String text(final int fromToken, final int toToken) {
        return source.substring(tokens.get(fromToken).offset(),
                tokens.get(toToken - 1).end());
    }

    /**
     * Checks the upper-camel-case type convention, ignoring leading
     * underscores and dollar signs.
     *
     * @param name the identifier, may be null
     * @return true if the name reads as a type
     */
    static boolean isTypeName(final String name) {
        if (name == null) {
            return false;
        }
        int i = 0;
        while (i < name.length() && (name.charAt(i) == '_'
                || name.charAt(i) == '$')) {
            i++;
        }
        return i < name.length() && Character.isUpperCase(name.charAt(i));
    }

    private static boolean isOpener(final Token t) {
        return t.is("(") || t.is("[") || t.is("{");
    }

    private static boolean isCloser(final Token t) {
        return t.is(")") || t.is("]") || t.is("}");
    }

    private String wordAt(final int k) {
        final Token t = tokenAt(k);
        return t.type() == TokenType.IDENTIFIER ? t.text() : "";
    }

    private Token tokenAt(final int k) {
        return tokens.get(Math.min(k, tokens.size() - 1));
    }

    private Token peek() {
        return tokenAt(pos);
    }

    private Token peekAt(final int k) {
        return tokenAt(k);
    }

    private Token advance() {
        final Token t = peek();
        if (pos < tokens.size() - 1) {
            pos++;
        }
        return t;
    }

    private boolean atEnd() {
        return peek().type() == TokenType.EOF;
    }

    private int previousEnd() {
        return pos == 0 ? 0 : tokens.get(pos - 1).end();
    }

}
