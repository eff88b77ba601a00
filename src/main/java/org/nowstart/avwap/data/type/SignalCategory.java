package org.nowstart.avwap.data.type;

import java.util.Arrays;
import java.util.List;

/**
 * Output blocks of the signal log, declared in the order they are written.
 */
public enum SignalCategory {
    TIER_3(AnchorRole.CURRENT),
    TIER_2(AnchorRole.CURRENT),
    TIER_1(AnchorRole.CURRENT),
    VWAP_CROSS(AnchorRole.CURRENT),
    CROSS_UP(AnchorRole.CURRENT),
    CROSS_DOWN(AnchorRole.CURRENT),
    BOUNCE(AnchorRole.CURRENT),
    PREV_BOUNCE_LONG(AnchorRole.PREVIOUS),
    PREV_BOUNCE_SHORT(AnchorRole.PREVIOUS),
    PREV_CROSS_UP(AnchorRole.PREVIOUS),
    PREV_CROSS_DOWN(AnchorRole.PREVIOUS);

    private final AnchorRole role;

    SignalCategory(AnchorRole role) {
        this.role = role;
    }

    public static List<SignalCategory> forRole(AnchorRole role) {
        return Arrays.stream(values())
                .filter(category -> category.role == role)
                .toList();
    }

    public static SignalCategory tier(int k) {
        return switch (k) {
            case 1 -> TIER_1;
            case 2 -> TIER_2;
            case 3 -> TIER_3;
            default -> throw new IllegalArgumentException("tier must be 1..3, was " + k);
        };
    }

    public static SignalCategory cross(AnchorRole role, TradeSide side) {
        if (role == AnchorRole.CURRENT) {
            return side == TradeSide.LONG ? CROSS_UP : CROSS_DOWN;
        }
        return side == TradeSide.LONG ? PREV_CROSS_UP : PREV_CROSS_DOWN;
    }

    public static SignalCategory bounce(AnchorRole role, TradeSide side) {
        if (role == AnchorRole.CURRENT) {
            return BOUNCE;
        }
        return side == TradeSide.LONG ? PREV_BOUNCE_LONG : PREV_BOUNCE_SHORT;
    }
}
