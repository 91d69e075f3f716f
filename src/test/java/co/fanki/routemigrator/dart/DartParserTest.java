package co.fanki.routemigrator.dart;

import co.fanki.routemigrator.dart.ast.ClassDeclaration;
import co.fanki.routemigrator.dart.ast.CompilationUnit;
import co.fanki.routemigrator.dart.ast.DartAstVisitor;
import co.fanki.routemigrator.dart.ast.Expression;
import co.fanki.routemigrator.dart.ast.FunctionDeclaration;
import co.fanki.routemigrator.dart.ast.FunctionExpression;
import co.fanki.routemigrator.dart.ast.InstanceCreation;
import co.fanki.routemigrator.dart.ast.MethodInvocation;
import co.fanki.routemigrator.dart.ast.SetOrMapLiteral;
import co.fanki.routemigrator.dart.ast.SimpleIdentifier;
import co.fanki.routemigrator.dart.ast.StringLiteral;
import co.fanki.routemigrator.dart.ast.VariableDeclaration;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for DartParser.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class DartParserTest {

    private static final String SCREEN = """
            import 'package:flutter/material.dart';
            import 'details_screen.dart';

            const String detailsRoute = '/details';

            class HomeScreen extends StatelessWidget {
              const HomeScreen({super.key, required this.title});

              final String title;

              @override
              Widget build(BuildContext context) {
                return ElevatedButton(
                  onPressed: () {
                    if (title.isNotEmpty) {
                      Navigator.pushNamed(context, detailsRoute,
                          arguments: {'id': 42});
                    } else {
                      Navigator.of(context).pop();
                    }
                  },
                  child: const Text('Open'),
                );
              }
            }
            """;

    @Test
    void whenParsing_givenImports_shouldDecodeUris() {
        final CompilationUnit unit = DartParser.parse(SCREEN);

        assertEquals(2, unit.imports().size());
        assertEquals("package:flutter/material.dart",
                unit.imports().get(0).uri());
        assertEquals("details_screen.dart", unit.imports().get(1).uri());
    }

    @Test
    void whenParsing_givenTopLevelDeclarations_shouldModelVariablesAndClasses() {
        final CompilationUnit unit = DartParser.parse(SCREEN);

        final VariableDeclaration route = assertInstanceOf(
                VariableDeclaration.class, unit.declarations().get(0));
        assertEquals("detailsRoute", route.name());
        assertTrue(route.constant());
        assertEquals("/details", assertInstanceOf(StringLiteral.class,
                route.initializer()).stringValue());

        final ClassDeclaration screen = assertInstanceOf(
                ClassDeclaration.class, unit.declarations().get(1));
        assertEquals("HomeScreen", screen.name());
        assertTrue(screen.method("build").isPresent());
    }

    @Test
    void whenParsing_givenConstructor_shouldReadNamedParameters() {
        final ClassDeclaration screen = (ClassDeclaration) DartParser.parse(
                SCREEN).declarations().get(1);

        final FunctionDeclaration constructor = screen.method("HomeScreen")
                .orElseThrow();

        assertEquals(List.of("key", "title"), constructor.parameters()
                .stream().map(p -> p.name()).toList());
        assertTrue(constructor.parameters().get(1).named());
        assertNull(constructor.body());
    }

    @Test
    void whenParsing_givenCallsInsideClosuresAndBranches_shouldFindThemAll() {
        final List<MethodInvocation> calls = invocations(
                DartParser.parse(SCREEN));

        final List<String> names = calls.stream()
                .map(MethodInvocation::methodName).toList();
        assertTrue(names.contains("pushNamed"));
        assertTrue(names.contains("of"));
        assertTrue(names.contains("pop"));
    }

    @Test
    void whenParsing_givenNamedArgument_shouldExposeMapLiteral() {
        final MethodInvocation push = invocations(DartParser.parse(SCREEN))
                .stream()
                .filter(call -> "pushNamed".equals(call.methodName()))
                .findFirst().orElseThrow();

        assertInstanceOf(SimpleIdentifier.class, push.target());
        assertEquals(2, push.argumentList().positional().size());
        final Expression arguments = push.argumentList().named("arguments")
                .orElseThrow();
        assertTrue(assertInstanceOf(SetOrMapLiteral.class, arguments)
                .isMap());
    }

    @Test
    void whenParsing_givenCallSpans_shouldCoverTheWholeCall() {
        final MethodInvocation pop = invocations(DartParser.parse(SCREEN))
                .stream()
                .filter(call -> "pop".equals(call.methodName()))
                .findFirst().orElseThrow();

        assertEquals("Navigator.of(context).pop()", SCREEN.substring(
                pop.offset(), pop.end()));
    }

    @Test
    void whenParsing_givenPageRouteWithBuilder_shouldModelClosureBody() {
        final String source = """
                void open(BuildContext context) {
                  Navigator.push(context, MaterialPageRoute<void>(
                      builder: (context) => const SettingsScreen(id: 7)));
                }
                """;

        final MethodInvocation push = invocations(DartParser.parse(source))
                .get(0);

        final InstanceCreation route = assertInstanceOf(
                InstanceCreation.class, push.argumentList().positional()
                        .get(1));
        assertEquals("MaterialPageRoute", route.typeName());
        assertEquals("<void>", route.typeArguments());
        final FunctionExpression builder = assertInstanceOf(
                FunctionExpression.class,
                route.argumentList().named("builder").orElseThrow());
        assertTrue(builder.hasExpressionBody());
        final InstanceCreation page = assertInstanceOf(
                InstanceCreation.class, builder.body());
        assertEquals("SettingsScreen", page.typeName());
        assertEquals("const", page.keyword());
    }

    @Test
    void whenParsing_givenImportPrefixedConstruction_shouldModelCreation() {
        final String source = """
                void open(BuildContext context) {
                  Navigator.push(context, MaterialPageRoute(
                      builder: (_) => screens.SettingsScreen(id: 7)));
                }
                """;

        final MethodInvocation push = invocations(DartParser.parse(source))
                .get(0);
        final InstanceCreation route = (InstanceCreation) push.argumentList()
                .positional().get(1);
        final FunctionExpression builder = (FunctionExpression) route
                .argumentList().named("builder").orElseThrow();

        assertEquals("push", push.methodName());
        final InstanceCreation page = assertInstanceOf(
                InstanceCreation.class, builder.body());
        assertEquals("screens", page.prefix());
        assertEquals("SettingsScreen", page.typeName());
        assertNull(page.keyword());
        assertEquals("screens.SettingsScreen(id: 7)",
                source.substring(page.offset(), page.end()));
    }

    @Test
    void whenParsing_givenPrefixedConstructionWithKeyword_shouldKeepPrefix() {
        final String source = "final page = new screens.ProfilePage.edit();";

        final InstanceCreation page = assertInstanceOf(InstanceCreation.class,
                ((VariableDeclaration) DartParser.parse(source)
                        .declarations().get(0)).initializer());

        assertEquals("screens", page.prefix());
        assertEquals("ProfilePage", page.typeName());
        assertEquals("edit", page.constructorName());
    }

    @Test
    void whenParsing_givenConstCollectionLiteral_shouldSpanTheKeyword() {
        final String source = """
                void f(BuildContext context) {
                  Navigator.pushNamed(context, '/a', arguments: const {'k': 1});
                }
                """;

        final Expression arguments = invocations(DartParser.parse(source))
                .get(0).argumentList().named("arguments").orElseThrow();

        assertInstanceOf(SetOrMapLiteral.class, arguments);
        assertEquals("const {'k': 1}",
                source.substring(arguments.offset(), arguments.end()));
    }

    @Test
    void whenParsing_givenTypedParameters_shouldKeepTheirTypeNames() {
        final FunctionDeclaration function = (FunctionDeclaration) DartParser
                .parse("void goTo(BuildContext ctx, {required String? route,"
                        + " final extra}) {}")
                .declarations().get(0);

        assertEquals("BuildContext", function.parameters().get(0).typeName());
        assertEquals("ctx", function.parameters().get(0).name());
        assertEquals("String", function.parameters().get(1).typeName());
        assertEquals("route", function.parameters().get(1).name());
        assertNull(function.parameters().get(2).typeName());
    }

    @Test
    void whenParsing_givenInterpolatedString_shouldKeepExpressionParts() {
        final String source = "const a = '/users/$id/${tab}';";

        final VariableDeclaration variable = (VariableDeclaration)
                DartParser.parse(source).declarations().get(0);
        final StringLiteral literal = (StringLiteral) variable.initializer();

        assertNull(literal.stringValue());
        assertEquals(4, literal.parts().size());
        assertEquals("/users/", literal.parts().get(0));
        assertInstanceOf(SimpleIdentifier.class, literal.parts().get(1));
    }

    @Test
    void whenParsing_givenAdjacentStrings_shouldConcatenateThem() {
        final String source = "const a = '/a' \"/b\";";

        final VariableDeclaration variable = (VariableDeclaration)
                DartParser.parse(source).declarations().get(0);

        assertEquals("/a/b", ((StringLiteral) variable.initializer())
                .stringValue());
    }

    @Test
    void whenParsing_givenMalformedInput_shouldNotFail() {
        final CompilationUnit unit = DartParser.parse(
                "class { void f( { ]] ) => ; Navigator.pop(");

        assertFalse(unit.declarations().isEmpty());
    }

    @Test
    void whenParsing_givenGenericMethodCall_shouldKeepTypeArguments() {
        final String source = """
                Future<void> f(BuildContext context) async {
                  final ok = await Navigator.pushNamed<bool>(context, '/a');
                }
                """;

        final MethodInvocation push = invocations(DartParser.parse(source))
                .get(0);

        assertEquals("pushNamed", push.methodName());
        assertEquals("<bool>", push.typeArguments());
    }

    private static List<MethodInvocation> invocations(
            final CompilationUnit unit) {
        final List<MethodInvocation> found = new ArrayList<>();
        unit.accept(new DartAstVisitor() {
            @Override
            public void visitMethodInvocation(final MethodInvocation node) {
                found.add(node);
                super.visitMethodInvocation(node);
            }
        });
        return found;
    }

}
