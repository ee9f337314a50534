package org.latex2typst;

// What kind of environment the tree walker is currently inside
public enum EnvironmentContext {
    NONE,
    DOCUMENT,
    TABLE,
    TABULAR
}
