package co.fanki.routemigrator.dart;

import co.fanki.routemigrator.dart.ast.Expression;
import co.fanki.routemigrator.dart.ast.VariableDeclaration;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for Construction.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ConstructionTest {

    @Test
    void whenReading_givenKeywordLessNamedConstructor_shouldSplitTypeAndName() {
        final Construction page = Construction.of(
                initializer("ProfilePage.edit(id: 1)")).orElseThrow();

        assertNull(page.prefix());
        assertEquals("ProfilePage", page.typeName());
        assertEquals("edit", page.constructorName());
        assertTrue(page.argumentList().named("id").isPresent());
    }

    @Test
    void whenReading_givenPrefixedNamedConstructor_shouldKeepThePrefix() {
        final Construction page = Construction.of(
                initializer("screens.ProfilePage.edit()")).orElseThrow();

        assertEquals("screens", page.prefix());
        assertEquals("ProfilePage", page.typeName());
        assertEquals("edit", page.constructorName());
    }

    @Test
    void whenReading_givenPrefixedUnnamedConstructor_shouldHaveNoName() {
        final Construction page = Construction.of(
                initializer("screens.SettingsScreen()")).orElseThrow();

        assertEquals("screens", page.prefix());
        assertEquals("SettingsScreen", page.typeName());
        assertNull(page.constructorName());
    }

    @Test
    void whenReading_givenCallsOnValues_shouldNotSeeConstructions() {
        assertEquals(Optional.empty(), Construction.of(
                initializer("context.read()")));
        assertEquals(Optional.empty(), Construction.of(
                initializer("buildPage()")));
        assertEquals(Optional.empty(), Construction.of(
                initializer("'/a'")));
    }

    private static Expression initializer(final String expression) {
        return ((VariableDeclaration) DartParser.parse(
                "final value = " + expression + ";").declarations().get(0))
                .initializer();
    }

}
