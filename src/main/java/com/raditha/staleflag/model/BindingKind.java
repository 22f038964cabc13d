package com.raditha.staleflag.model;

/**
 * What kind of declaration introduced a binding.
 */
public enum BindingKind {
    /** A static final field (or interface field) with an initializer. */
    CONSTANT,
    /** An enum constant; its identity is its own name. */
    ENUM_CONSTANT,
    /** Any other field. */
    FIELD,
    LOCAL,
    PARAMETER;

    public boolean isShared() {
        return this == CONSTANT || this == ENUM_CONSTANT;
    }
}
