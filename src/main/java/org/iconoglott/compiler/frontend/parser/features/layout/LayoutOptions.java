package org.iconoglott.compiler.frontend.parser.features.layout;

import org.iconoglott.compiler.frontend.parser.ast.Point;
import org.iconoglott.compiler.frontend.parser.ast.Size;

/**
 * Collects the options of a <code>stack</code> or <code>row</code> from its header line and
 * its block. Unset options keep their defaults: no gap, the origin, no explicit size,
 * start justification and alignment, no padding and no wrapping.
 */
public final class LayoutOptions {

    LayoutDirection direction;
    double gap;
    Point at = Point.ORIGIN;
    Size size;
    Justify justify = Justify.START;
    Alignment align = Alignment.START;
    Padding padding = Padding.ZERO;
    boolean wrap;

    public LayoutOptions(LayoutDirection direction) {
        this.direction = direction;
    }
}
