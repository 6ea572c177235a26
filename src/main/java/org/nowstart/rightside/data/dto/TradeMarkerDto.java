package org.nowstart.rightside.data.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.nowstart.rightside.data.type.EntryType;
import org.nowstart.rightside.data.type.ExitReason;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TradeMarkerDto(
        long time,
        MarkerKind kind,
        double price,
        EntryType entryType,
        Double pnlPct,
        ExitReason exitReason,
        String position,
        String color,
        String shape,
        String text
) {

    public enum MarkerKind {
        ENTRY,
        EXIT
    }
}
