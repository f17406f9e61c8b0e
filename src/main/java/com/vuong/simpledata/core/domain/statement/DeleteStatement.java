package com.vuong.simpledata.core.domain.statement;

import jakarta.persistence.EntityManager;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaDelete;
import jakarta.persistence.criteria.Root;

import java.util.Objects;

/**
 * Immutable bulk DELETE over one entity type.
 * Bulk deletes run directly against the database and bypass the persistence context.
 *
 * @param <T> the entity type
 */
public final class DeleteStatement<T> {

    private final Class<T> domainClass;
    private final Condition<T> condition;

    private DeleteStatement(Class<T> domainClass, Condition<T> condition) {
        this.domainClass = domainClass;
        this.condition = condition;
    }

    /**
     * Starts a statement deleting every row of {@code domainClass}.
     */
    public static <T> DeleteStatement<T> from(Class<T> domainClass) {
        Objects.requireNonNull(domainClass, "Domain class must not be null");
        return new DeleteStatement<>(domainClass, null);
    }

    public DeleteStatement<T> where(Condition<T> where) {
        Objects.requireNonNull(where, "Condition must not be null");
        return new DeleteStatement<>(domainClass, condition == null ? where : condition.and(where));
    }

    public Class<T> getDomainClass() {
        return domainClass;
    }

    public boolean isRestricted() {
        return condition != null;
    }

    /**
     * Executes the delete; requires an active transaction.
     *
     * @return the number of deleted rows
     */
    public int execute(EntityManager entityManager) {
        CriteriaBuilder cb = entityManager.getCriteriaBuilder();
        CriteriaDelete<T> delete = cb.createCriteriaDelete(domainClass);
        Root<T> root = delete.from(domainClass);
        if (condition != null) {
            delete.where(condition.toPredicate(root, cb));
        }
        return entityManager.createQuery(delete).executeUpdate();
    }

    @Override
    public String toString() {
        return "DeleteStatement{" + domainClass.getSimpleName() + ", restricted=" + isRestricted() + "}";
    }
}
