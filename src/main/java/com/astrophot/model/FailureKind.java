package com.astrophot.model;

public enum FailureKind {
    TRACKING_LOST,
    FRAME_DECODE_FAILED,
    ANCHOR_MISSING
}
