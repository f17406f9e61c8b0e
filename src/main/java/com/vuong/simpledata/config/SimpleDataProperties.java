package com.vuong.simpledata.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for Simple Data module.
 */
@ConfigurationProperties(prefix = "simple-data")
@Getter
@Setter
public class SimpleDataProperties {

    /**
     * Register the repository factory automatically when an EntityManagerFactory is present.
     */
    private boolean enabled = true;

    /**
     * Reload saved entities from storage so database-generated values are visible
     * on the returned instances.
     */
    private boolean refreshAfterSave = true;

    /**
     * Clear the persistence context after bulk deletes.
     * Bulk deletes bypass the context, so without clearing, previously loaded
     * instances of deleted rows may still be returned by findById.
     */
    private boolean clearAfterBulkDelete = true;
}
