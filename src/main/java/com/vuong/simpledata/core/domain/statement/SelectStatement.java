package com.vuong.simpledata.core.domain.statement;

import jakarta.persistence.EntityManager;
import jakarta.persistence.TypedQuery;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Order;
import jakarta.persistence.criteria.Root;
import jakarta.persistence.metamodel.SingularAttribute;
import org.springframework.data.domain.Sort;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable, not yet executed SELECT over one entity type.
 * <p>
 * Every builder method returns a new statement, so a base statement can be shared
 * between a count and a paged fetch. The criteria query is only assembled by
 * {@link #toQuery(EntityManager)} or {@link #toCountQuery(EntityManager, SingularAttribute)}.
 *
 * @param <T> the entity type
 */
public final class SelectStatement<T> {

    private final Class<T> domainClass;
    private final Condition<T> condition;
    private final List<OrderClause<T>> orders;
    private final Long offset;
    private final Integer limit;

    private SelectStatement(Class<T> domainClass, Condition<T> condition, List<OrderClause<T>> orders,
                            Long offset, Integer limit) {
        this.domainClass = domainClass;
        this.condition = condition;
        this.orders = orders;
        this.offset = offset;
        this.limit = limit;
    }

    /**
     * Starts a statement selecting every row of {@code domainClass}.
     */
    public static <T> SelectStatement<T> from(Class<T> domainClass) {
        Objects.requireNonNull(domainClass, "Domain class must not be null");
        return new SelectStatement<>(domainClass, null, List.of(), null, null);
    }

    /**
     * Restricts the statement; repeated calls are combined with AND.
     */
    public SelectStatement<T> where(Condition<T> where) {
        Objects.requireNonNull(where, "Condition must not be null");
        Condition<T> combined = condition == null ? where : condition.and(where);
        return new SelectStatement<>(domainClass, combined, orders, offset, limit);
    }

    /**
     * Appends an ORDER BY item after the ones already present.
     */
    public SelectStatement<T> orderBy(SingularAttribute<? super T, ?> attribute, Sort.Direction direction,
                                      boolean ignoreCase) {
        List<OrderClause<T>> appended = new ArrayList<>(orders);
        appended.add(new OrderClause<>(attribute, direction, ignoreCase));
        return new SelectStatement<>(domainClass, condition, List.copyOf(appended), offset, limit);
    }

    public SelectStatement<T> orderBy(SingularAttribute<? super T, ?> attribute, Sort.Direction direction) {
        return orderBy(attribute, direction, false);
    }

    public SelectStatement<T> offset(long offset) {
        if (offset < 0) {
            throw new IllegalArgumentException("Offset must not be negative");
        }
        return new SelectStatement<>(domainClass, condition, orders, offset, limit);
    }

    public SelectStatement<T> limit(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("Limit must be positive");
        }
        return new SelectStatement<>(domainClass, condition, orders, offset, limit);
    }

    public Class<T> getDomainClass() {
        return domainClass;
    }

    public List<OrderClause<T>> getOrders() {
        return orders;
    }

    public Long getOffset() {
        return offset;
    }

    public Integer getLimit() {
        return limit;
    }

    public boolean isRestricted() {
        return condition != null;
    }

    /**
     * Builds the entity query with where, ordering, offset and limit applied.
     */
    public TypedQuery<T> toQuery(EntityManager entityManager) {
        CriteriaBuilder cb = entityManager.getCriteriaBuilder();
        CriteriaQuery<T> query = cb.createQuery(domainClass);
        Root<T> root = query.from(domainClass);
        query.select(root);
        if (condition != null) {
            query.where(condition.toPredicate(root, cb));
        }
        if (!orders.isEmpty()) {
            List<Order> criteriaOrders = new ArrayList<>();
            for (OrderClause<T> order : orders) {
                criteriaOrders.add(order.toOrder(root, cb));
            }
            query.orderBy(criteriaOrders);
        }

        TypedQuery<T> typedQuery = entityManager.createQuery(query);
        if (offset != null) {
            typedQuery.setFirstResult(Math.toIntExact(offset));
        }
        if (limit != null) {
            typedQuery.setMaxResults(limit);
        }
        return typedQuery;
    }

    /**
     * Builds a query projecting {@code count(countAttribute)} over the rows this statement
     * matches. Ordering, offset and limit are dropped.
     */
    public TypedQuery<Long> toCountQuery(EntityManager entityManager, SingularAttribute<? super T, ?> countAttribute) {
        Objects.requireNonNull(countAttribute, "Count attribute must not be null");
        CriteriaBuilder cb = entityManager.getCriteriaBuilder();
        CriteriaQuery<Long> query = cb.createQuery(Long.class);
        Root<T> root = query.from(domainClass);
        query.select(cb.count(root.get(countAttribute)));
        if (condition != null) {
            query.where(condition.toPredicate(root, cb));
        }
        return entityManager.createQuery(query);
    }

    @Override
    public String toString() {
        return "SelectStatement{" + domainClass.getSimpleName()
                + ", restricted=" + isRestricted()
                + ", orders=" + orders.size()
                + ", offset=" + offset
                + ", limit=" + limit + "}";
    }
}
