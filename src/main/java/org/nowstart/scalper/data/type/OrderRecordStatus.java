package org.nowstart.scalper.data.type;

public enum OrderRecordStatus {
    ACTIVE,
    FILLED,
    CANCELLED;

    public boolean isTerminal() {
        return this != ACTIVE;
    }
}
