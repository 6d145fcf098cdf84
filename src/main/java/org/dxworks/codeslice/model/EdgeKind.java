package org.dxworks.codeslice.model;

public enum EdgeKind {
    CFG,
    CDG,
    DDG
}
