package org.nowstart.rightside.data.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.util.List;

public record BacktestSuiteRequest(
        @Size(max = 500, message = "symbols must contain at most 500 entries")
        List<@NotBlank(message = "symbol must not be blank") String> symbols,
        Instant from,
        Instant to
) {
}
