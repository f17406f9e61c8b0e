package com.vuong.simpledata.core.domain.repository.support;

import com.vuong.simpledata.fixture.DummyEntity;
import com.vuong.simpledata.fixture.PersistenceTestSupport;
import jakarta.persistence.EntityManager;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SimplePagingRepository Tests")
class SimplePagingRepositoryTest {

    private EntityManager entityManager;
    private SimplePagingRepository<DummyEntity, Integer> repository;

    @BeforeEach
    void setUp() {
        entityManager = PersistenceTestSupport.createEntityManager();
        repository = new SimplePagingRepository<>(DummyEntity.class, entityManager);
    }

    @AfterEach
    void tearDown() {
        PersistenceTestSupport.close(entityManager);
        PersistenceTestSupport.deleteAll();
    }

    private void dummies() {
        repository.saveAll(List.of(
            new DummyEntity(1, "a"), new DummyEntity(2, "b"), new DummyEntity(3, "c")));
        entityManager.clear();
    }

    @Test
    @DisplayName("Should return every entity on a large enough first page")
    void shouldFindFirstPage() {
        // Given
        dummies();

        // When
        Page<DummyEntity> page = repository.findPage(PageRequest.ofSize(10), Sort.by("id"));

        // Then
        assertThat(page.getContent()).extracting(DummyEntity::getId).containsExactly(1, 2, 3);
        assertThat(page.getTotalElements()).isEqualTo(3L);
        assertThat(page.getTotalPages()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should split entities into pages")
    void shouldSplitIntoPages() {
        // Given
        dummies();

        // When
        Page<DummyEntity> first = repository.findPage(PageRequest.of(0, 2), Sort.by("id"));
        Page<DummyEntity> second = repository.findPage(PageRequest.of(1, 2), Sort.by("id"));

        // Then
        assertThat(first.getContent()).extracting(DummyEntity::getId).containsExactly(1, 2);
        assertThat(first.getTotalElements()).isEqualTo(3L);
        assertThat(first.getTotalPages()).isEqualTo(2);
        assertThat(first.hasNext()).isTrue();
        assertThat(second.getContent()).extracting(DummyEntity::getId).containsExactly(3);
        assertThat(second.isLast()).isTrue();
    }

    @Test
    @DisplayName("Should return empty page past the last one")
    void shouldReturnEmptyPagePastEnd() {
        // Given
        dummies();

        // When
        Page<DummyEntity> page = repository.findPage(PageRequest.of(5, 2));

        // Then
        assertThat(page.getContent()).isEmpty();
        assertThat(page.getTotalElements()).isEqualTo(3L);
    }

    @Test
    @DisplayName("Should sort page with the explicit sort")
    void shouldSortWithExplicitSort() {
        // Given
        dummies();

        // When
        Page<DummyEntity> page = repository.findPage(PageRequest.of(0, 2), Sort.by(Sort.Direction.DESC, "id"));

        // Then
        assertThat(page.getContent()).extracting(DummyEntity::getId).containsExactly(3, 2);
    }

    @Test
    @DisplayName("Should sort page with the pageable's own sort")
    void shouldSortWithPageableSort() {
        // Given
        dummies();

        // When
        Page<DummyEntity> page = repository.findPage(PageRequest.of(0, 2, Sort.by(Sort.Direction.DESC, "id")));

        // Then
        assertThat(page.getContent()).extracting(DummyEntity::getId).containsExactly(3, 2);
        assertThat(page.getPageable().getSort().isSorted()).isTrue();
    }

    @Test
    @DisplayName("Should prefer the explicit sort over the pageable's sort")
    void shouldPreferExplicitSort() {
        // Given
        dummies();
        Pageable pageable = PageRequest.of(0, 2, Sort.by(Sort.Direction.DESC, "id"));

        // When
        Page<DummyEntity> page = repository.findPage(pageable, Sort.by(Sort.Direction.ASC, "id"));

        // Then
        assertThat(page.getContent()).extracting(DummyEntity::getId).containsExactly(1, 2);
    }

    @Test
    @DisplayName("Should return every entity for an unpaged request")
    void shouldHandleUnpaged() {
        // Given
        dummies();

        // When
        Page<DummyEntity> page = repository.findPage(Pageable.unpaged(), Sort.by(Sort.Direction.DESC, "id"));

        // Then
        assertThat(page.getContent()).extracting(DummyEntity::getId).containsExactly(3, 2, 1);
        assertThat(page.getTotalElements()).isEqualTo(3L);
    }

    @Test
    @DisplayName("Should return empty page for an empty table")
    void shouldHandleEmptyTable() {
        // When
        Page<DummyEntity> page = repository.findPage(PageRequest.ofSize(10));

        // Then
        assertThat(page.getContent()).isEmpty();
        assertThat(page.getTotalElements()).isZero();
    }

    @Test
    @DisplayName("Should reject null pageable")
    void shouldRejectNullPageable() {
        // When & Then
        assertThatThrownBy(() -> repository.findPage(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Pageable must not be null");
    }

    @Test
    @DisplayName("Should reject pageable whose offset exceeds the query range")
    void shouldRejectOversizedOffset() {
        // Given
        dummies();

        // When & Then
        assertThatThrownBy(() -> repository.findPage(PageRequest.of(Integer.MAX_VALUE, 10)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Pageable offset must not exceed 2147483647");
    }
}
