package com.mevshield.engine.cycle;

public enum CycleState {
    IDLE,
    RUNNING
}
