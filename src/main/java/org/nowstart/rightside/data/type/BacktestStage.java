package org.nowstart.rightside.data.type;

public enum BacktestStage {
    LOAD,
    INDICATORS,
    CAPITULATION,
    PIVOTS,
    ENTRY_TRIGGERS,
    SIMULATION,
    METRICS
}
