package org.nowstart.rightside.data.type;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TradeStatus {
    OPEN("open"),
    CLOSED("closed");

    private final String wireValue;

    TradeStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }
}
