package com.monadarena.service;

public enum MoveOutcome {
    CREATOR,
    OPPONENT
}
