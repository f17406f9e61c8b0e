package com.vuong.simpledata.config;

import com.vuong.simpledata.core.service.RepositoryFactory;
import jakarta.persistence.EntityManagerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.orm.jpa.HibernateJpaAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration class for the Simple Data module.
 * Registers a {@link RepositoryFactory} on top of the application's
 * {@link EntityManagerFactory}.
 */
@AutoConfiguration(after = HibernateJpaAutoConfiguration.class)
@ConditionalOnBean(EntityManagerFactory.class)
@ConditionalOnProperty(prefix = "simple-data", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(SimpleDataProperties.class)
public class SimpleDataAutoConfiguration {

    /**
     * Creates the factory opening repository sessions.
     * @param entityManagerFactory the application's entity manager factory
     * @param properties the bound {@code simple-data.*} properties
     * @return a new RepositoryFactory instance
     */
    @Bean
    @ConditionalOnMissingBean(RepositoryFactory.class)
    public RepositoryFactory repositoryFactory(EntityManagerFactory entityManagerFactory,
                                               SimpleDataProperties properties) {
        return new RepositoryFactory(entityManagerFactory, properties);
    }
}
