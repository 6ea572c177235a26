package org.nowstart.rightside.data.type;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ExitReason {
    PREV_CANDLE_LOW("prev_candle_low"),
    EOD_1500("eod_1500"),
    NEXT_DAY_FORCE_CLOSE("next_day_force_close"),
    END_OF_SLICE("end_of_slice");

    private final String wireValue;

    ExitReason(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }
}
