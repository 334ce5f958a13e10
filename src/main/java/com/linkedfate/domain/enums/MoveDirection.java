package com.linkedfate.domain.enums;

public enum MoveDirection {
    UP,
    DOWN;

    public static MoveDirection of(double changePercent) {
        return changePercent > 0 ? UP : DOWN;
    }
}
