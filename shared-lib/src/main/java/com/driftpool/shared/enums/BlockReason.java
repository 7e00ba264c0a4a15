package com.driftpool.shared.enums;

public enum BlockReason {
    SAFETY_CONCERN,
    INAPPROPRIATE_BEHAVIOR,
    HARASSMENT,
    UNCOMFORTABLE,
    GENDER_VIOLATION,
    OTHER
}
