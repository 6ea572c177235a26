package org.nowstart.rightside.data.exception;

import java.time.Instant;
import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Client-facing failure of a backtest request, rendered as a {@code ProblemDetail} with {@code code}.
 */
@Getter
public class BacktestApiException extends RuntimeException {

    public static final String SYMBOL_DATA_NOT_FOUND = "symbol_data_not_found";
    public static final String INVALID_RANGE = "invalid_range";

    private final HttpStatus status;
    private final String code;

    public BacktestApiException(HttpStatus status, String code, String message) {
        super(message);
        this.status = status;
        this.code = code;
    }

    public static BacktestApiException symbolDataNotFound(String symbol) {
        return new BacktestApiException(HttpStatus.NOT_FOUND, SYMBOL_DATA_NOT_FOUND, "No bar data for symbol " + symbol);
    }

    public static BacktestApiException invalidRange(Instant from, Instant to) {
        return new BacktestApiException(
                HttpStatus.BAD_REQUEST,
                INVALID_RANGE,
                "from must be <= to (from=" + from + ", to=" + to + ")"
        );
    }
}
