package com.monadarena.model;

public enum ResolutionMethod {
    REVEAL,
    RESOLVER,
    TIMEOUT
}
