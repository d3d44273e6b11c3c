package com.monadarena.model;

public enum TournamentStatus {
    REGISTRATION,
    ACTIVE,
    COMPLETED,
    CANCELLED
}
