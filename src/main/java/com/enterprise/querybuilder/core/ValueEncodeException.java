package com.enterprise.querybuilder.core;

/** The value's Java type has no encoding in the active dialect. */
public class ValueEncodeException extends SqlBindException {

    private final Class<?> valueType;
    private final String dialectId;

    public ValueEncodeException(Class<?> valueType, String dialectId) {
        super("Cannot bind value of type " + valueType.getName() + " for dialect " + dialectId);
        this.valueType = valueType;
        this.dialectId = dialectId;
    }

    public Class<?> valueType() { return valueType; }

    public String dialectId() { return dialectId; }
}
