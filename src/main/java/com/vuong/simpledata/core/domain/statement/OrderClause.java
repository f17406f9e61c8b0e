package com.vuong.simpledata.core.domain.statement;

import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.Expression;
import jakarta.persistence.criteria.Order;
import jakarta.persistence.criteria.Root;
import jakarta.persistence.metamodel.SingularAttribute;
import org.springframework.data.domain.Sort;

import java.util.Objects;

/**
 * One ORDER BY item of a {@link SelectStatement}.
 *
 * @param attribute  the attribute to order by
 * @param direction  ascending or descending
 * @param ignoreCase compare upper-cased values; only honoured for string attributes
 * @param <T>        the entity type
 */
public record OrderClause<T>(SingularAttribute<? super T, ?> attribute, Sort.Direction direction, boolean ignoreCase) {

    public OrderClause {
        Objects.requireNonNull(attribute, "Attribute must not be null");
        Objects.requireNonNull(direction, "Direction must not be null");
    }

    @SuppressWarnings("unchecked")
    Order toOrder(Root<T> root, CriteriaBuilder cb) {
        Expression<?> expression = root.get(attribute);
        if (ignoreCase && String.class.equals(attribute.getJavaType())) {
            expression = cb.upper(root.get((SingularAttribute<? super T, String>) attribute));
        }
        return direction.isAscending() ? cb.asc(expression) : cb.desc(expression);
    }
}
