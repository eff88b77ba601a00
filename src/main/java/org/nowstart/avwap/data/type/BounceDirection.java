package org.nowstart.avwap.data.type;

public enum BounceDirection {
    UP,
    DOWN
}
