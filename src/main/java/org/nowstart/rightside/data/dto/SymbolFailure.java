package org.nowstart.rightside.data.dto;

import org.nowstart.rightside.data.type.BacktestStage;

public record SymbolFailure(
        String symbol,
        BacktestStage stage,
        String message
) {
}
