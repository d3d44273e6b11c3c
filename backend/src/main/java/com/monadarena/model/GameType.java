package com.monadarena.model;

public enum GameType {
    POKER,
    AUCTION,
    RPG_BATTLE
}
