package org.nowstart.rightside.data.property;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "rightside.backtest")
public record BacktestProperties(
        // run the suite once at startup and log the report
        @DefaultValue("false") boolean runnerEnabled,
        // symbols for the startup run; empty means every symbol in the bar store
        @NotNull @DefaultValue("") List<String> symbols,
        // optional inclusive range applied to the bar query
        Instant from,
        Instant to,
        // symbols processed concurrently by the suite
        @Min(1) @Max(64) @DefaultValue("4") int parallelism,
        // abort the whole suite on the first symbol failure instead of reporting it
        @DefaultValue("false") boolean failFast
) {

    public BacktestProperties {
        symbols = symbols == null
                ? List.of()
                : symbols.stream().filter(s -> s != null && !s.isBlank()).map(String::trim).toList();
        if (from != null && to != null && from.isAfter(to)) {
            throw new IllegalArgumentException("from must be <= to");
        }
    }
}
