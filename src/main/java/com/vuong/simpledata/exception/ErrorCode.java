package com.vuong.simpledata.exception;

public enum ErrorCode {
    // Configuration errors
    UNMANAGED_TYPE("UNMANAGED_TYPE", "Type is not a managed entity"),
    PRIMARY_KEY_COUNT("PRIMARY_KEY_COUNT", "Object Relational Mapper must have one and only one primary key"),
    COMPOSITE_ID("COMPOSITE_ID", "Entity declares a composite primary key"),
    ID_TYPE_MISMATCH("ID_TYPE_MISMATCH", "Requested ID type does not match the entity primary key"),

    // Lookup errors
    UNKNOWN_ATTRIBUTE("UNKNOWN_ATTRIBUTE", "No such attribute on the entity type");

    private final String code;
    private final String defaultMessage;

    ErrorCode(String code, String defaultMessage) {
        this.code = code;
        this.defaultMessage = defaultMessage;
    }

    public String getCode() {
        return code;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}
