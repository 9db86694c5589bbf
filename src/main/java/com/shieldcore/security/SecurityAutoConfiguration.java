package com.shieldcore.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shieldcore.security.filters.DefaultIdentifierResolver;
import com.shieldcore.security.filters.IdentifierResolver;
import com.shieldcore.security.filters.SecurityFilter;
import com.shieldcore.security.sanitize.DataSanitizer;
import com.shieldcore.security.threat.SecurityAlertDispatcher;
import com.shieldcore.security.threat.SecurityAlertProperties;
import com.shieldcore.security.threat.SecurityEventListener;
import com.shieldcore.utils.JsonSupport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.mail.javamail.JavaMailSender;

import java.time.Clock;

@Slf4j
@AutoConfiguration
@EnableConfigurationProperties({SecurityProperties.class, SecurityAlertProperties.class})
public class SecurityAutoConfiguration {

    @Bean(initMethod = "start", destroyMethod = "close")
    @ConditionalOnMissingBean
    public SecurityManager securityManager(
            SecurityProperties properties,
            ObjectProvider<ObjectMapper> objectMapperProvider,
            ObjectProvider<SecurityEventListener> listeners
    ) {
        SecuritySettings settings = SecuritySettings.resolve(properties);
        SecurityManager manager = new SecurityManager(settings, Clock.systemUTC(),
                objectMapperProvider.getIfAvailable(JsonSupport::objectMapper));
        listeners.orderedStream().forEach(manager::addListener);
        log.debug("security manager configured: features={}", settings.features());
        return manager;
    }

    @Bean
    @ConditionalOnMissingBean
    public IdentifierResolver identifierResolver(SecurityProperties properties) {
        return new DefaultIdentifierResolver(properties.getFilter().getTrustedProxies());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
    public SecurityFilter securityFilter(
            SecurityProperties properties,
            SecurityManager securityManager,
            IdentifierResolver identifierResolver,
            ObjectProvider<ObjectMapper> objectMapperProvider
    ) {
        ObjectMapper objectMapper = objectMapperProvider.getIfAvailable(JsonSupport::objectMapper);
        return new SecurityFilter(properties.getFilter(), securityManager, identifierResolver, objectMapper);
    }

    /**
     * Alert delivery is registered as a plain {@link SecurityEventListener} bean and picked up by
     * {@link #securityManager}.
     */
    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(JavaMailSender.class)
    static class AlertConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public SecurityAlertDispatcher securityAlertDispatcher(
                SecurityAlertProperties properties,
                ObjectProvider<ObjectMapper> objectMapperProvider,
                ObjectProvider<JavaMailSender> mailSenderProvider
        ) {
            return new SecurityAlertDispatcher(properties, objectMapperProvider, mailSenderProvider,
                    new DataSanitizer());
        }
    }
}
