package com.vuong.simpledata.core.domain.repository.support;

import jakarta.persistence.EntityManager;
import jakarta.persistence.EntityTransaction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("UnitOfWork Tests")
class UnitOfWorkTest {

    @Mock
    private EntityManager entityManager;

    @Mock
    private EntityTransaction transaction;

    private UnitOfWork unitOfWork;

    @BeforeEach
    void setUp() {
        when(entityManager.getTransaction()).thenReturn(transaction);
        unitOfWork = new UnitOfWork(entityManager);
    }

    @Test
    @DisplayName("Should begin and commit a transaction when none is active")
    void shouldCommitOwnTransaction() {
        // Given
        when(transaction.isActive()).thenReturn(false);

        // When
        String result = unitOfWork.execute(() -> "done");

        // Then
        assertThat(result).isEqualTo("done");
        InOrder order = inOrder(transaction);
        order.verify(transaction).begin();
        order.verify(transaction).commit();
        verify(transaction, never()).rollback();
    }

    @Test
    @DisplayName("Should join an active transaction and only flush")
    void shouldJoinActiveTransaction() {
        // Given
        when(transaction.isActive()).thenReturn(true);

        // When
        unitOfWork.run(() -> { });

        // Then
        verify(entityManager).flush();
        verify(transaction, never()).begin();
        verify(transaction, never()).commit();
    }

    @Test
    @DisplayName("Should roll back and rethrow when the work fails")
    void shouldRollBackOnFailure() {
        // Given
        when(transaction.isActive()).thenReturn(false, true);
        IllegalStateException failure = new IllegalStateException("boom");

        // When & Then
        assertThatThrownBy(() -> unitOfWork.run(() -> {
            throw failure;
        })).isSameAs(failure);
        verify(transaction).begin();
        verify(transaction).rollback();
        verify(transaction, never()).commit();
    }

    @Test
    @DisplayName("Should roll back and rethrow when the work fails with an error")
    void shouldRollBackOnError() {
        // Given
        when(transaction.isActive()).thenReturn(false, true);
        AssertionError failure = new AssertionError("fatal");

        // When & Then
        assertThatThrownBy(() -> unitOfWork.run(() -> {
            throw failure;
        })).isSameAs(failure);
        verify(transaction).begin();
        verify(transaction).rollback();
        verify(transaction, never()).commit();
    }
}
