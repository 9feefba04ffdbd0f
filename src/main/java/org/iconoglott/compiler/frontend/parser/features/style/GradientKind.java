package org.iconoglott.compiler.frontend.parser.features.style;

/**
 * The supported gradient geometries.
 */
public enum GradientKind {
    LINEAR,
    RADIAL
}
