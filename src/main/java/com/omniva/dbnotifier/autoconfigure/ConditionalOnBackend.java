package com.omniva.dbnotifier.autoconfigure;

import org.springframework.context.annotation.Conditional;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Matches when {@code db-notifier.backend}, bound the same relaxed way as
 * {@link DbNotifierProperties#getBackend()}, selects the given backend.
 * A missing property selects {@link DbNotifierProperties.Backend#IN_MEMORY}.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.TYPE, ElementType.METHOD})
@Documented
@Conditional(OnBackendCondition.class)
public @interface ConditionalOnBackend {

    DbNotifierProperties.Backend value();
}
