package com.vuong.simpledata.exception;

import com.vuong.simpledata.fixture.DummyEntity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SimpleDataException Tests")
class SimpleDataExceptionTest {

    @Test
    @DisplayName("Should use the error code default message")
    void shouldUseDefaultMessage() {
        // When
        RepositoryConfigurationException exception =
            new RepositoryConfigurationException(ErrorCode.PRIMARY_KEY_COUNT);

        // Then
        assertThat(exception.getErrorCode()).isEqualTo(ErrorCode.PRIMARY_KEY_COUNT);
        assertThat(exception.getMessage())
            .isEqualTo("Object Relational Mapper must have one and only one primary key");
    }

    @Test
    @DisplayName("Should keep custom message and cause")
    void shouldKeepMessageAndCause() {
        // Given
        IllegalArgumentException cause = new IllegalArgumentException("Not an entity");

        // When
        RepositoryConfigurationException exception =
            new RepositoryConfigurationException(ErrorCode.UNMANAGED_TYPE, "java.lang.String is not a managed entity", cause);

        // Then
        assertThat(exception)
            .isInstanceOf(SimpleDataException.class)
            .hasMessage("java.lang.String is not a managed entity")
            .hasCause(cause);
        assertThat(exception.getErrorCode().getCode()).isEqualTo("UNMANAGED_TYPE");
    }

    @Test
    @DisplayName("Should describe unresolved attribute")
    void shouldDescribeUnresolvedAttribute() {
        // When
        AttributeResolutionException exception = new AttributeResolutionException(DummyEntity.class, "missing");

        // Then
        assertThat(exception.getErrorCode()).isEqualTo(ErrorCode.UNKNOWN_ATTRIBUTE);
        assertThat(exception.getEntityClass()).isEqualTo(DummyEntity.class);
        assertThat(exception.getAttributeName()).isEqualTo("missing");
        assertThat(exception).hasMessage("No attribute named 'missing' on entity DummyEntity");
    }
}
