package com.monadarena.model;

public enum CancellationReason {
    CREATOR_CANCELLED,
    TIMEOUT_NO_ACTION
}
