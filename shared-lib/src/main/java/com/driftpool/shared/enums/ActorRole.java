package com.driftpool.shared.enums;

public enum ActorRole {
    RIDER,
    DRIVER
}
