package org.nowstart.rightside.data.type;

import com.fasterxml.jackson.annotation.JsonValue;

public enum EntryType {
    // aggressive: EMA9 reclaim on volume right off the pivot
    V_TURN("v_turn"),
    // conservative: break of the high that formed above a higher low
    HIGHER_LOW("higher_low");

    private final String wireValue;

    EntryType(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }
}
