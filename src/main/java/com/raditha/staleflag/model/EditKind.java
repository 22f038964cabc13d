package com.raditha.staleflag.model;

public enum EditKind {
    REPLACE,
    DELETE,
    INSERT
}
