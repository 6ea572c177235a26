package org.nowstart.rightside.data.dto;

public record LinePointDto(
        long time,
        double value
) {
}
