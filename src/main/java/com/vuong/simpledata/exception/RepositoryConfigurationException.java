package com.vuong.simpledata.exception;

/**
 * Thrown when a repository or its entity metadata cannot be built for a type,
 * e.g. the type is not a managed entity or does not declare exactly one primary key.
 */
public class RepositoryConfigurationException extends SimpleDataException {

    public RepositoryConfigurationException(ErrorCode errorCode) {
        super(errorCode);
    }

    public RepositoryConfigurationException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public RepositoryConfigurationException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
