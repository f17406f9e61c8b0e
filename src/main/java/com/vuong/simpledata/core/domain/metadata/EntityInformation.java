package com.vuong.simpledata.core.domain.metadata;

import com.vuong.simpledata.exception.AttributeResolutionException;
import com.vuong.simpledata.exception.ErrorCode;
import com.vuong.simpledata.exception.RepositoryConfigurationException;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.IdClass;
import jakarta.persistence.metamodel.Attribute;
import jakarta.persistence.metamodel.EntityType;
import jakarta.persistence.metamodel.Metamodel;
import jakarta.persistence.metamodel.SingularAttribute;
import jakarta.persistence.metamodel.Type;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.util.DirectFieldAccessFallbackBeanWrapper;
import org.springframework.util.ReflectionUtils;

import java.lang.reflect.Field;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Identity metadata of one mapped entity type, derived once from the JPA metamodel.
 * <p>
 * Exposes the attribute names in declaration order, the primary-key attribute(s),
 * a validated name-to-attribute lookup and the "is this instance new" predicate.
 * Instances are immutable and can be shared between repositories.
 *
 * @param <T>  the entity type
 * @param <ID> the primary-key type
 */
public class EntityInformation<T, ID> {

    private static final Logger logger = LoggerFactory.getLogger(EntityInformation.class);

    private final Class<T> domainClass;
    private final Class<ID> idType;
    private final String entityName;
    private final List<String> attributeNames;
    private final List<String> idAttributeNames;
    private final List<SingularAttribute<? super T, ?>> idAttributes;
    private final Map<String, SingularAttribute<? super T, ?>> singularAttributes;
    private final boolean generatedPrimitiveId;

    /**
     * Reads the metadata of {@code domainClass} from the given metamodel.
     *
     * @param domainClass the entity class
     * @param metamodel   the metamodel of the persistence unit managing the class
     * @throws RepositoryConfigurationException if the class is not a managed entity or maps no attribute
     */
    @SuppressWarnings("unchecked")
    public EntityInformation(Class<T> domainClass, Metamodel metamodel) {
        Objects.requireNonNull(domainClass, "Domain class must not be null");
        Objects.requireNonNull(metamodel, "Metamodel must not be null");

        EntityType<T> entityType = resolveEntityType(domainClass, metamodel);
        Comparator<String> declarationOrder = Comparator
                .comparingInt((String name) -> DeclaredFields.indexOf(domainClass, name))
                .thenComparing(Comparator.naturalOrder());

        List<SingularAttribute<? super T, ?>> ids = new ArrayList<>(findIdAttributes(entityType));
        ids.sort((a, b) -> declarationOrder.compare(a.getName(), b.getName()));

        Set<String> names = new LinkedHashSet<>();
        for (Attribute<? super T, ?> attribute : entityType.getAttributes()) {
            names.add(attribute.getName());
        }
        for (SingularAttribute<? super T, ?> id : ids) {
            names.add(id.getName());
        }
        if (names.isEmpty()) {
            throw new RepositoryConfigurationException(ErrorCode.UNMANAGED_TYPE,
                    "Entity " + entityType.getName() + " has no mapped attributes");
        }

        Map<String, SingularAttribute<? super T, ?>> singular = new LinkedHashMap<>();
        for (SingularAttribute<? super T, ?> attribute : entityType.getSingularAttributes()) {
            singular.put(attribute.getName(), attribute);
        }
        for (SingularAttribute<? super T, ?> id : ids) {
            singular.putIfAbsent(id.getName(), id);
        }

        this.domainClass = domainClass;
        this.entityName = entityType.getName();
        this.attributeNames = names.stream().sorted(declarationOrder).toList();
        this.idAttributes = List.copyOf(ids);
        this.idAttributeNames = ids.stream().map(id -> id.getName()).toList();
        this.singularAttributes = Collections.unmodifiableMap(singular);
        this.idType = (Class<ID>) resolveIdType(domainClass, entityType, ids);
        this.generatedPrimitiveId = ids.size() == 1 && isGeneratedPrimitive(domainClass, ids.get(0));

        logger.debug("Resolved entity information for {}: attributes={}, id={}",
                entityName, attributeNames, idAttributeNames);
    }

    /**
     * Creates the entity information of {@code domainClass}.
     *
     * @param domainClass the entity class
     * @param metamodel   the metamodel of the persistence unit
     * @param <T>         the entity type
     * @param <ID>        the primary-key type
     * @return the entity information
     */
    public static <T, ID> EntityInformation<T, ID> of(Class<T> domainClass, Metamodel metamodel) {
        return new EntityInformation<>(domainClass, metamodel);
    }

    public Class<T> getDomainClass() {
        return domainClass;
    }

    /**
     * Returns the primary-key type; for a composite key this is the declared {@link IdClass}.
     */
    public Class<ID> getIdType() {
        return idType;
    }

    public String getEntityName() {
        return entityName;
    }

    /**
     * Returns all attribute names, in declaration order.
     */
    public List<String> getAttributeNames() {
        return attributeNames;
    }

    /**
     * Returns the names of the primary-key attributes, in declaration order.
     */
    public List<String> getIdAttributeNames() {
        return idAttributeNames;
    }

    public List<SingularAttribute<? super T, ?>> getIdAttributes() {
        return idAttributes;
    }

    public boolean hasCompositeId() {
        return idAttributeNames.size() > 1;
    }

    /**
     * Returns the single primary-key attribute.
     *
     * @throws RepositoryConfigurationException if the entity declares no key or a composite key
     */
    public SingularAttribute<? super T, ?> getIdAttribute() {
        if (idAttributes.isEmpty()) {
            throw new RepositoryConfigurationException(ErrorCode.PRIMARY_KEY_COUNT,
                    "Entity " + entityName + " declares no primary key");
        }
        if (hasCompositeId()) {
            throw new RepositoryConfigurationException(ErrorCode.COMPOSITE_ID,
                    "Entity " + entityName + " declares a composite primary key " + idAttributeNames);
        }
        return idAttributes.get(0);
    }

    /**
     * Reads the primary-key value of an entity instance.
     *
     * @param entity the entity, must not be null
     * @return the key value, null when unset
     */
    @SuppressWarnings("unchecked")
    public ID getId(T entity) {
        Objects.requireNonNull(entity, "Entity must not be null");
        String idName = getIdAttribute().getName();
        return (ID) new DirectFieldAccessFallbackBeanWrapper(entity).getPropertyValue(idName);
    }

    /**
     * Returns whether the entity has not been persisted yet, i.e. its primary key is unset.
     * A primitive numeric key annotated with {@link GeneratedValue} also counts as unset
     * when it is zero; an assigned primitive key is never unset.
     *
     * @param entity the entity, must not be null
     * @return true if the key value is unset
     */
    public boolean isNew(T entity) {
        Object id = getId(entity);
        if (id == null) {
            return true;
        }
        if (generatedPrimitiveId && id instanceof Number number) {
            return number.longValue() == 0L;
        }
        return false;
    }

    /**
     * Resolves a singular attribute by name.
     *
     * @param name the attribute name
     * @return the attribute descriptor
     * @throws AttributeResolutionException if the entity has no singular attribute with that name
     */
    public SingularAttribute<? super T, ?> getAttribute(String name) {
        SingularAttribute<? super T, ?> attribute = name == null ? null : singularAttributes.get(name);
        if (attribute == null) {
            throw new AttributeResolutionException(domainClass, name);
        }
        return attribute;
    }

    public boolean hasAttribute(String name) {
        return singularAttributes.containsKey(name);
    }

    @Override
    public String toString() {
        return "EntityInformation{" + entityName + ", id=" + idAttributeNames + "}";
    }

    private static <T> EntityType<T> resolveEntityType(Class<T> domainClass, Metamodel metamodel) {
        try {
            return metamodel.entity(domainClass);
        } catch (IllegalArgumentException e) {
            throw new RepositoryConfigurationException(ErrorCode.UNMANAGED_TYPE,
                    domainClass.getName() + " is not a managed entity", e);
        }
    }

    private static <T> Set<SingularAttribute<? super T, ?>> findIdAttributes(EntityType<T> entityType) {
        Set<SingularAttribute<? super T, ?>> ids = new LinkedHashSet<>();
        for (SingularAttribute<? super T, ?> attribute : entityType.getSingularAttributes()) {
            if (attribute.isId()) {
                ids.add(attribute);
            }
        }
        if (!ids.isEmpty()) {
            return ids;
        }
        if (entityType.hasSingleIdAttribute()) {
            Type<?> idType = entityType.getIdType();
            if (idType != null) {
                ids.add(entityType.getId(idType.getJavaType()));
            }
            return ids;
        }
        try {
            ids.addAll(entityType.getIdClassAttributes());
        } catch (IllegalArgumentException e) {
            logger.debug("Entity {} declares no id class: {}", entityType.getName(), e.getMessage());
        }
        return ids;
    }

    private static boolean isGeneratedPrimitive(Class<?> domainClass, SingularAttribute<?, ?> attribute) {
        Field field = ReflectionUtils.findField(domainClass, attribute.getName());
        return field != null && field.getType().isPrimitive() && field.isAnnotationPresent(GeneratedValue.class);
    }

    private static Class<?> resolveIdType(Class<?> domainClass, EntityType<?> entityType,
                                          List<? extends SingularAttribute<?, ?>> ids) {
        if (ids.size() == 1) {
            return ids.get(0).getJavaType();
        }
        IdClass idClass = domainClass.getAnnotation(IdClass.class);
        if (idClass != null) {
            return idClass.value();
        }
        Type<?> idType = entityType.getIdType();
        return idType != null ? idType.getJavaType() : Object.class;
    }
}
