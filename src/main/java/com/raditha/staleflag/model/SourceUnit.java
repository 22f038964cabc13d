package com.raditha.staleflag.model;

import java.nio.file.Path;

/**
 * One compilation unit's source text as handed to the engine.
 *
 * @param name   unit name used in reports, usually the relative path
 * @param path   file the text came from, null for in-memory units
 * @param source the text
 */
public record SourceUnit(String name, Path path, String source) {

    public static SourceUnit of(String name, String source) {
        return new SourceUnit(name, null, source);
    }
}
