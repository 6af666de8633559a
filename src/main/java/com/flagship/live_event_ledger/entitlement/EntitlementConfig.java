package com.flagship.live_event_ledger.entitlement;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Fallback {@link EntitlementService} used until a real subscription client
 * is registered. Denies by default; {@code ledger.entitlement.default-grant}
 * opens gated events to everyone, for development only.
 */
@Configuration
@Slf4j
public class EntitlementConfig {

    @Bean
    @ConditionalOnMissingBean(EntitlementService.class)
    public EntitlementService configuredEntitlementService(
            @Value("${ledger.entitlement.default-grant:false}") boolean defaultGrant) {
        if (defaultGrant) {
            log.warn("Entitlement checks are granting access to every gated event");
        }
        return (userId, eventId) -> defaultGrant;
    }
}
