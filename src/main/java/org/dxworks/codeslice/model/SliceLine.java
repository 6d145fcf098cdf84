package org.dxworks.codeslice.model;

public class SliceLine {
    public int line;
    public Provenance provenance;

    public SliceLine() {
    }

    public SliceLine(int line, Provenance provenance) {
        this.line = line;
        this.provenance = provenance;
    }
}
