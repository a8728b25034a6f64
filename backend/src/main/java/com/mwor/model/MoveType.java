package com.mwor.model;

public enum MoveType {
    MOVE,
    ROTATE,
    DROP,
    HOLD
}
