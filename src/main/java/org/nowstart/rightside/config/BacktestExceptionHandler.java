package org.nowstart.rightside.config;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.rightside.data.exception.BacktestApiException;
import org.nowstart.rightside.data.exception.BacktestStageException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class BacktestExceptionHandler {

    @ExceptionHandler(BacktestApiException.class)
    public ProblemDetail handleBacktestApiException(BacktestApiException exception) {
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(exception.getStatus(), exception.getMessage());
        problemDetail.setProperty("code", exception.getCode());
        return problemDetail;
    }

    @ExceptionHandler(BacktestStageException.class)
    public ProblemDetail handleBacktestStageException(BacktestStageException exception) {
        log.error("Backtest stage failed. symbol={}, stage={}", exception.getSymbol(), exception.getStage(), exception);
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(
                HttpStatus.INTERNAL_SERVER_ERROR,
                exception.getMessage()
        );
        problemDetail.setProperty("code", "backtest_stage_failed");
        problemDetail.setProperty("stage", exception.getStage());
        problemDetail.setProperty("symbol", exception.getSymbol());
        return problemDetail;
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidationException(MethodArgumentNotValidException exception) {
        List<String> details = exception.getBindingResult()
                .getFieldErrors()
                .stream()
                .map(FieldError::getDefaultMessage)
                .toList();
        return validationProblem(details);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ProblemDetail handleConstraintViolationException(ConstraintViolationException exception) {
        List<String> details = exception.getConstraintViolations()
                .stream()
                .map(ConstraintViolation::getMessage)
                .toList();
        return validationProblem(details);
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleUnexpectedException(Exception exception) {
        log.error("Unexpected backtest API error", exception);
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(
                HttpStatus.INTERNAL_SERVER_ERROR,
                "Unexpected server error"
        );
        problemDetail.setProperty("code", "internal_error");
        return problemDetail;
    }

    private ProblemDetail validationProblem(List<String> details) {
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, "Request validation failed");
        problemDetail.setProperty("code", "validation_error");
        problemDetail.setProperty("details", details);
        return problemDetail;
    }
}
