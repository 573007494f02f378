package com.processlayout.elk;

/** Computed outcome of an initial placement run */
public class PlacementResult {

    public final int movedCount;
    public final int reroutedCount;

    PlacementResult(int movedCount, int reroutedCount) {
        this.movedCount = movedCount;
        this.reroutedCount = reroutedCount;
    }

    @Override
    public String toString() {
        return "PlacementResult[moved=" + movedCount + ", rerouted=" + reroutedCount + "]";
    }
}
