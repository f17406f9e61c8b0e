package com.vuong.simpledata.core.domain.statement;

import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import jakarta.persistence.metamodel.SingularAttribute;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * A where-clause fragment over one entity type, rendered into a criteria
 * {@link Predicate} only when a statement is executed.
 *
 * @param <T> the entity type
 */
@FunctionalInterface
public interface Condition<T> {

    Predicate toPredicate(Root<T> root, CriteriaBuilder criteriaBuilder);

    /**
     * Combines this condition with {@code other} using a logical AND.
     */
    default Condition<T> and(Condition<T> other) {
        Objects.requireNonNull(other, "Condition must not be null");
        return (root, cb) -> cb.and(toPredicate(root, cb), other.toPredicate(root, cb));
    }

    /**
     * Matches rows whose attribute equals {@code value}.
     */
    static <T> Condition<T> equal(SingularAttribute<? super T, ?> attribute, Object value) {
        return (root, cb) -> cb.equal(root.get(attribute), value);
    }

    /**
     * Matches rows whose attribute is one of {@code values}.
     */
    static <T> Condition<T> in(SingularAttribute<? super T, ?> attribute, Collection<?> values) {
        List<?> copy = List.copyOf(values);
        return (root, cb) -> root.get(attribute).in(copy);
    }
}
