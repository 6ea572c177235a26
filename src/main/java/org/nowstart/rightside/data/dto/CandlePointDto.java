package org.nowstart.rightside.data.dto;

public record CandlePointDto(
        long time,
        double open,
        double high,
        double low,
        double close
) {
}
