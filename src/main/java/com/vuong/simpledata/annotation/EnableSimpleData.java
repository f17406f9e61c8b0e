package com.vuong.simpledata.annotation;


import org.springframework.context.annotation.Import;
import com.vuong.simpledata.config.SimpleDataAutoConfiguration;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Annotation to enable Simple Data repositories in a Spring application that does not
 * rely on auto-configuration.
 * This imports the {@link com.vuong.simpledata.config.SimpleDataAutoConfiguration} class, which
 * registers a {@link com.vuong.simpledata.core.service.RepositoryFactory} bean.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Import({SimpleDataAutoConfiguration.class})
public @interface EnableSimpleData {
}
