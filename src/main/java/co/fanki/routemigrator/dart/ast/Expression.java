package co.fanki.routemigrator.dart.ast;

/**
 * Base class of expression nodes.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public abstract class Expression extends DartNode {

    protected Expression(final int theOffset, final int theEnd) {
        super(theOffset, theEnd);
    }

}
