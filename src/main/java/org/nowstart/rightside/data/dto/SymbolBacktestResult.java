package org.nowstart.rightside.data.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.List;
import org.nowstart.rightside.engine.core.EntryTrigger;
import org.nowstart.rightside.engine.core.IndicatorBar;
import org.nowstart.rightside.engine.core.PerformanceMetrics;
import org.nowstart.rightside.engine.core.Trade;

public record SymbolBacktestResult(
        String symbol,
        @JsonIgnore List<IndicatorBar> bars,
        @JsonIgnore boolean[] capitulationFlags,
        @JsonIgnore boolean[] pivotLowFlags,
        List<EntryTrigger> triggers,
        List<Trade> trades,
        int dataPoints,
        int capitulationPoints,
        int pivotLows,
        int entryTriggers,
        PerformanceMetrics metrics
) {

    public static SymbolBacktestResult empty(String symbol) {
        return new SymbolBacktestResult(
                symbol,
                List.of(),
                new boolean[0],
                new boolean[0],
                List.of(),
                List.of(),
                0,
                0,
                0,
                0,
                PerformanceMetrics.empty()
        );
    }

    @JsonIgnore
    public boolean isEmpty() {
        return dataPoints == 0;
    }
}
