package com.vuong.simpledata.exception;

import lombok.Getter;

/**
 * Thrown when a property name (typically from a {@code Sort}) does not resolve to
 * an attribute of the bound entity type.
 */
@Getter
public class AttributeResolutionException extends SimpleDataException {

    private final Class<?> entityClass;
    private final String attributeName;

    public AttributeResolutionException(Class<?> entityClass, String attributeName) {
        super(ErrorCode.UNKNOWN_ATTRIBUTE,
                "No attribute named '" + attributeName + "' on entity " + entityClass.getSimpleName());
        this.entityClass = entityClass;
        this.attributeName = attributeName;
    }
}
