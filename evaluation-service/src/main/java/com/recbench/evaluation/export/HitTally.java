package com.recbench.evaluation.export;

public record HitTally(int hits, int total) {

    public double accuracy() {
        return total > 0 ? (double) hits / total : 0.0;
    }

    HitTally add(boolean hit) {
        return new HitTally(hits + (hit ? 1 : 0), total + 1);
    }
}
