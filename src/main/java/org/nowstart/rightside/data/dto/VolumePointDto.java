package org.nowstart.rightside.data.dto;

public record VolumePointDto(
        long time,
        double value,
        String color
) {
}
