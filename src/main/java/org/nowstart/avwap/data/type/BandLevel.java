package org.nowstart.avwap.data.type;

public enum BandLevel {
    VWAP(0),
    UPPER_1(1),
    UPPER_2(2),
    UPPER_3(3),
    LOWER_1(-1),
    LOWER_2(-2),
    LOWER_3(-3);

    private final int stdevMultiple;

    BandLevel(int stdevMultiple) {
        this.stdevMultiple = stdevMultiple;
    }

    public int stdevMultiple() {
        return stdevMultiple;
    }

    public static BandLevel upper(int k) {
        return switch (k) {
            case 1 -> UPPER_1;
            case 2 -> UPPER_2;
            case 3 -> UPPER_3;
            default -> throw new IllegalArgumentException("upper band index must be 1..3, was " + k);
        };
    }

    public static BandLevel lower(int k) {
        return switch (k) {
            case 1 -> LOWER_1;
            case 2 -> LOWER_2;
            case 3 -> LOWER_3;
            default -> throw new IllegalArgumentException("lower band index must be 1..3, was " + k);
        };
    }
}
