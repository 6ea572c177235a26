package org.nowstart.rightside.data.dto;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.nowstart.rightside.engine.core.PerformanceMetrics;

public record BacktestSuiteResult(
        Map<String, SymbolBacktestResult> results,
        List<SymbolFailure> failures,
        PerformanceMetrics combinedMetrics,
        int totalTrades
) {

    public BacktestSuiteResult {
        results = results == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(results));
        failures = failures == null ? List.of() : List.copyOf(failures);
    }
}
