package co.fanki.routemigrator.migration.domain;

import co.fanki.routemigrator.shared.DomainException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for SourceEdits.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class SourceEditsTest {

    private static final String TEXT = "a(); bb(); ccc();";

    private static final List<TextEdit> EDITS = List.of(
            new TextEdit(0, 3, "first()"),
            new TextEdit(5, 4, "x"),
            new TextEdit(11, 5, "third(1, 2)"));

    @Test
    void whenApplying_givenSeveralEdits_shouldMatchSplicingEachIndependently() {
        final SourceEdits edits = new SourceEdits();
        EDITS.forEach(edits::add);

        final String result = edits.applyTo(TEXT);

        final String expected = TEXT.substring(0, 0) + "first()"
                + TEXT.substring(3, 5) + "x" + TEXT.substring(9, 11)
                + "third(1, 2)" + TEXT.substring(16);
        assertEquals(expected, result);
        assertEquals("first(); x; third(1, 2);", result);
    }

    @Test
    void whenApplying_givenEditsAddedInAnyOrder_shouldApplyFromTheEnd() {
        final SourceEdits edits = new SourceEdits();
        edits.add(EDITS.get(1)).add(EDITS.get(2)).add(EDITS.get(0));

        assertEquals(List.of(EDITS.get(2), EDITS.get(1), EDITS.get(0)),
                edits.inApplicationOrder());
        assertEquals("first(); x; third(1, 2);", edits.applyTo(TEXT));
    }

    @Test
    void whenSplicingInAscendingOrder_givenLengthChangingEdits_shouldCorruptTheText() {
        final StringBuilder buffer = new StringBuilder(TEXT);
        for (final TextEdit edit : EDITS) {
            buffer.replace(edit.offset(), edit.end(), edit.replacement());
        }

        assertNotEquals("first(); x; third(1, 2);", buffer.toString());
    }

    @Test
    void whenApplying_givenInsertionAtReplacementStart_shouldKeepBoth() {
        final SourceEdits edits = new SourceEdits()
                .add(new TextEdit(5, 0, "/* m */ "))
                .add(new TextEdit(0, 3, "z()"));

        assertEquals("z(); /* m */ bb(); ccc();", edits.applyTo(TEXT));
    }

    @Test
    void whenApplying_givenOverlappingEdits_shouldThrowDomainException() {
        final SourceEdits edits = new SourceEdits()
                .add(new TextEdit(0, 4, "x"))
                .add(new TextEdit(2, 4, "y"));

        assertThrows(DomainException.class, () -> edits.applyTo(TEXT));
    }

    @Test
    void whenApplying_givenEditPastTheEnd_shouldThrowException() {
        final SourceEdits edits = new SourceEdits()
                .add(new TextEdit(TEXT.length(), 1, "x"));

        assertThrows(IllegalArgumentException.class,
                () -> edits.applyTo(TEXT));
    }

    @Test
    void whenInsertingAfterLastImport_givenImports_shouldInsertBelowThem() {
        final String content = "import 'a.dart';\nimport 'b.dart';\n\nvoid f() {}\n";

        final String result = SourceEdits.insertAfterLastImport(content,
                "import 'c.dart';\n");

        assertEquals("import 'a.dart';\nimport 'b.dart';\nimport 'c.dart';\n"
                + "\nvoid f() {}\n", result);
    }

    @Test
    void whenInsertingAfterLastImport_givenNoImports_shouldInsertAtStart() {
        assertEquals("import 'c.dart';\nvoid f() {}",
                SourceEdits.insertAfterLastImport("void f() {}",
                        "import 'c.dart';\n"));
    }

}
