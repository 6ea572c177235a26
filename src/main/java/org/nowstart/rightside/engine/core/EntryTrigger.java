package org.nowstart.rightside.engine.core;

import java.time.Instant;
import org.nowstart.rightside.data.type.EntryType;

public record EntryTrigger(
        int barIndex,
        int capitulationIndex,
        int pivotIndex,
        Instant timestamp,
        EntryType entryType,
        double stopLossPrice
) {
}
