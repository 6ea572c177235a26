package org.nowstart.rightside.data.exception;

import lombok.Getter;
import org.nowstart.rightside.data.type.BacktestStage;

/**
 * Unexpected fault while deriving a symbol's backtest, tagged with the failing stage.
 *
 * <p>"No bars" and "no trades" are valid outcomes and never raise this.
 */
@Getter
public class BacktestStageException extends RuntimeException {

    private final BacktestStage stage;
    private final String symbol;

    public BacktestStageException(BacktestStage stage, String symbol, String message) {
        super(format(stage, symbol, message));
        this.stage = stage;
        this.symbol = symbol;
    }

    public BacktestStageException(BacktestStage stage, String symbol, String message, Throwable cause) {
        super(format(stage, symbol, message), cause);
        this.stage = stage;
        this.symbol = symbol;
    }

    private static String format(BacktestStage stage, String symbol, String message) {
        return "[" + stage + "] symbol=" + symbol + ": " + message;
    }
}
