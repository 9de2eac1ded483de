package com.example.chatstore.store;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Objects;

/**
 * A single attribute mutation for {@link EntityStore#update}: either set a value or remove the attribute.
 * Attributes without an op are left as they are.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class FieldOp {

    public enum Kind { SET, REMOVE }

    private static final FieldOp REMOVE = new FieldOp(Kind.REMOVE, null);

    Kind kind;
    Object value;

    public static FieldOp set(Object value) {
        return new FieldOp(Kind.SET, Objects.requireNonNull(value, "value"));
    }

    public static FieldOp remove() {
        return REMOVE;
    }

    public boolean isRemove() {
        return kind == Kind.REMOVE;
    }
}
