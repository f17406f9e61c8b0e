package com.vuong.simpledata.util;

import org.springframework.data.domain.Pageable;

import java.util.ArrayList;
import java.util.List;

/**
 * Validates the arguments handed to repository operations.
 * Each validation returns the list of error messages; {@link #requireValid(List)}
 * turns a non-empty list into an {@link IllegalArgumentException}.
 */
public class ArgumentValidator {

    /**
     * Validates that an entity is not null.
     * @param entity the entity to validate
     * @return list of validation error messages
     */
    public List<String> validateEntity(Object entity) {
        List<String> errors = new ArrayList<>();
        if (entity == null) {
            errors.add("Entity must not be null");
        }
        return errors;
    }

    /**
     * Validates that a group of entities is present and holds no null element.
     * @param entities the entities to validate
     * @return list of validation error messages
     */
    public List<String> validateEntities(Iterable<?> entities) {
        return validateElements(entities, "Entities");
    }

    /**
     * Validates that an ID is not null.
     * @param id the ID to validate
     * @return list of validation error messages
     */
    public List<String> validateId(Object id) {
        List<String> errors = new ArrayList<>();
        if (id == null) {
            errors.add("ID must not be null");
        }
        return errors;
    }

    /**
     * Validates that a group of IDs is present and holds no null element.
     * @param ids the IDs to validate
     * @return list of validation error messages
     */
    public List<String> validateIds(Iterable<?> ids) {
        return validateElements(ids, "IDs");
    }

    /**
     * Validates that pagination information is present and its offset fits the
     * first-result position of a query.
     * @param pageable the pageable object to validate
     * @return list of validation error messages
     */
    public List<String> validatePageable(Pageable pageable) {
        List<String> errors = new ArrayList<>();
        if (pageable == null) {
            errors.add("Pageable must not be null");
        } else if (pageable.isPaged() && pageable.getOffset() > Integer.MAX_VALUE) {
            errors.add("Pageable offset must not exceed " + Integer.MAX_VALUE);
        }
        return errors;
    }

    /**
     * Throws when the given validation result holds any error.
     * @param errors the messages returned by one of the validate methods
     * @throws IllegalArgumentException if {@code errors} is not empty
     */
    public void requireValid(List<String> errors) {
        if (!errors.isEmpty()) {
            throw new IllegalArgumentException(String.join("; ", errors));
        }
    }

    private List<String> validateElements(Iterable<?> elements, String label) {
        List<String> errors = new ArrayList<>();
        if (elements == null) {
            errors.add(label + " must not be null");
            return errors;
        }
        for (Object element : elements) {
            if (element == null) {
                errors.add(label + " must not contain null elements");
                break;
            }
        }
        return errors;
    }
}
