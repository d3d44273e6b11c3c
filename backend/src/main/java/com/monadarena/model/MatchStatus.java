package com.monadarena.model;

public enum MatchStatus {
    CREATED,
    COMMIT_PHASE,
    REVEAL_PHASE,
    RESOLVED,
    CANCELLED;

    public boolean isTerminal() {
        return this == RESOLVED || this == CANCELLED;
    }
}
