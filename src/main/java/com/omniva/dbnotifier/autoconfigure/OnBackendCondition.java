package com.omniva.dbnotifier.autoconfigure;

import org.springframework.boot.autoconfigure.condition.ConditionOutcome;
import org.springframework.boot.autoconfigure.condition.SpringBootCondition;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.context.annotation.ConditionContext;
import org.springframework.core.type.AnnotatedTypeMetadata;

import java.util.Map;

class OnBackendCondition extends SpringBootCondition {

    static final String PROPERTY = "db-notifier.backend";

    @Override
    public ConditionOutcome getMatchOutcome(ConditionContext context, AnnotatedTypeMetadata metadata) {
        Map<String, Object> attributes = metadata.getAnnotationAttributes(ConditionalOnBackend.class.getName());
        DbNotifierProperties.Backend required = (DbNotifierProperties.Backend) attributes.get("value");

        DbNotifierProperties.Backend configured = Binder.get(context.getEnvironment())
                .bind(PROPERTY, DbNotifierProperties.Backend.class)
                .orElse(DbNotifierProperties.Backend.IN_MEMORY);

        if (configured == required) {
            return ConditionOutcome.match(PROPERTY + " is " + configured);
        }
        return ConditionOutcome.noMatch(PROPERTY + " is " + configured + ", not " + required);
    }
}
