package org.nowstart.rightside.engine.core;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Instant;
import org.nowstart.rightside.data.type.EntryType;
import org.nowstart.rightside.data.type.ExitReason;
import org.nowstart.rightside.data.type.TradeStatus;

public record Trade(
        Instant entryTime,
        double entryPrice,
        double initialStop,
        EntryType entryType,
        double entryRisk,
        Instant exitTime,
        double exitPrice,
        TradeStatus status,
        double pnlPct,
        int barsHeld,
        ExitReason exitReason
) {

    public static double pnlPct(double entryPrice, double exitPrice) {
        return ((exitPrice - entryPrice) / entryPrice) * 100.0;
    }

    @JsonIgnore
    public boolean isClosed() {
        return status == TradeStatus.CLOSED;
    }
}
