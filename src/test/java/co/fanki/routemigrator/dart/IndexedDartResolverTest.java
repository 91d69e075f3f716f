package co.fanki.routemigrator.dart;

import co.fanki.routemigrator.dart.ast.DartAstVisitor;
import co.fanki.routemigrator.dart.ast.Expression;
import co.fanki.routemigrator.dart.ast.FunctionDeclaration;
import co.fanki.routemigrator.dart.ast.MethodInvocation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for IndexedDartResolver.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class IndexedDartResolverTest {

    private static final Path LIB = Path.of("/app/lib");

    private static final String ROUTES = """
            const String settingsRoute = '/settings';

            class Routes {
              static const String profile = '/profile';
              static const advanced = '$settingsRoute/advanced';
              static String notConstant = '/mutable';
            }

            void goTo(BuildContext context, String route) {
              Navigator.pushNamed(context, route);
            }
            """;

    private static final String HOME = """
            import 'package:demo/routes.dart';

            void open(BuildContext context, String name) {
              Navigator.pushNamed(context, settingsRoute);
              Navigator.pushNamed(context, Routes.profile);
              Navigator.pushNamed(context, Routes.advanced);
              Navigator.pushNamed(context, '/a' + '/b');
              Navigator.pushNamed(context, name);
              Navigator.pushNamed(context, Routes.notConstant);
              Navigator.pushNamed(context, hidden);
              goTo(context, '/x');
            }
            """;

    private static final String OTHER = """
            const hidden = '/hidden';
            """;

    private DartUnit routes;
    private DartUnit home;
    private IndexedDartResolver resolver;

    @BeforeEach
    void setUp() {
        routes = unit("routes.dart", ROUTES);
        home = unit("home.dart", HOME);
        resolver = new IndexedDartResolver(
                List.of(routes, home, unit("other.dart", OTHER)), "demo", LIB);
    }

    @Test
    void whenEvaluating_givenImportedTopLevelConstant_shouldReturnItsValue() {
        assertEquals(Optional.of("/settings"), routeValue(0));
    }

    @Test
    void whenEvaluating_givenStaticClassConstant_shouldReturnItsValue() {
        assertEquals(Optional.of("/profile"), routeValue(1));
    }

    @Test
    void whenEvaluating_givenInterpolatedConstant_shouldFollowReferences() {
        assertEquals(Optional.of("/settings/advanced"), routeValue(2));
    }

    @Test
    void whenEvaluating_givenConcatenation_shouldJoinOperands() {
        assertEquals(Optional.of("/a/b"), routeValue(3));
    }

    @Test
    void whenEvaluating_givenParameter_shouldBeEmpty() {
        assertTrue(routeValue(4).isEmpty());
    }

    @Test
    void whenEvaluating_givenNonConstantField_shouldBeEmpty() {
        assertTrue(routeValue(5).isEmpty());
    }

    @Test
    void whenEvaluating_givenDeclarationOfUnimportedFile_shouldBeEmpty() {
        assertTrue(routeValue(6).isEmpty());
    }

    @Test
    void whenResolvingElement_givenCallToImportedFunction_shouldPointAtItsDeclaration() {
        final MethodInvocation call = calls(home).stream()
                .filter(c -> "goTo".equals(c.methodName()))
                .findFirst().orElseThrow();
        final FunctionDeclaration goTo = (FunctionDeclaration) routes.root()
                .declarations().get(2);

        final Optional<ElementHandle> element = resolver.element(home, call);

        assertEquals(Optional.of(resolver.declaration(routes, goTo)),
                element);
        assertEquals(LIB.resolve("routes.dart"), element.get().file());
        assertEquals("goTo", element.get().name());
    }

    @Test
    void whenResolvingElement_givenParameterReference_shouldPointAtTheParameter() {
        final FunctionDeclaration open = (FunctionDeclaration) home.root()
                .declarations().get(0);
        final Expression name = calls(home).get(4).argumentList()
                .positional().get(1);

        assertEquals(Optional.of(resolver.declaration(home,
                open.parameters().get(1))), resolver.element(home, name));
    }

    @Test
    void whenResolvingType_givenClassOfImportedFile_shouldPointAtTheClass() {
        final Optional<ElementHandle> type = resolver.type(home, "Routes");

        assertEquals(routes.path(), type.orElseThrow().file());
        assertEquals("Routes", type.get().name());
        assertEquals(Optional.empty(), resolver.type(home, "goTo"));
        assertEquals(Optional.empty(), resolver.type(home, "Missing"));
    }

    private Optional<String> routeValue(final int callIndex) {
        final List<MethodInvocation> pushes = calls(home).stream()
                .filter(c -> "pushNamed".equals(c.methodName()))
                .toList();
        return resolver.constantValue(home,
                pushes.get(callIndex).argumentList().positional().get(1));
    }

    private static DartUnit unit(final String name, final String source) {
        return new DartUnit(LIB.resolve(name), source,
                DartParser.parse(source));
    }

    private static List<MethodInvocation> calls(final DartUnit unit) {
        final List<MethodInvocation> found = new ArrayList<>();
        unit.root().accept(new DartAstVisitor() {
            @Override
            public void visitMethodInvocation(final MethodInvocation node) {
                found.add(node);
                super.visitMethodInvocation(node);
            }
        });
        return found;
    }

}
