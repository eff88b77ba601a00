package org.nowstart.avwap.data.type;

public enum TradeSide {
    LONG,
    SHORT
}
