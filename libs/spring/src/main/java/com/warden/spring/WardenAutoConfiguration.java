package com.warden.spring;

import com.warden.audit.AuditAdapter;
import com.warden.audit.AuditConfig;
import com.warden.audit.AuditLogger;
import com.warden.audit.ConsoleAuditAdapter;
import com.warden.audit.TableAuditConfig;
import com.warden.authz.AuthorizationEngine;
import com.warden.authz.cache.CacheProvider;
import com.warden.authz.cache.InMemoryCacheProvider;
import com.warden.authz.metrics.AuthorizationMetrics;
import com.warden.authz.rebac.RelationshipPath;
import com.warden.authz.resolver.ContextResolver;
import com.warden.authz.resolver.ResolverManagerOptions;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Wires the authorization engine from {@link WardenProperties} and the application context.
 * <p>
 * Every {@link ContextResolver}, {@link RelationshipPath}, {@link RelationshipTableRegistration}
 * and {@link FieldAccessTableRegistration} bean is registered with the engine, in bean order.
 * Each component bean backs off when the application defines its own. Auditing is on only with
 * {@code warden.audit.enabled=true}; it writes to the {@link AuditAdapter} bean if there is one,
 * otherwise to the console.
 * <p>
 * Disabled with {@code warden.enabled=false}.
 */
@AutoConfiguration
@EnableConfigurationProperties(WardenProperties.class)
@ConditionalOnProperty(prefix = "warden", name = "enabled", havingValue = "true", matchIfMissing = true)
public class WardenAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(WardenAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public CacheProvider wardenCacheProvider() {
        return new InMemoryCacheProvider();
    }

    @Bean
    @ConditionalOnMissingBean
    public AuthorizationMetrics authorizationMetrics(ObjectProvider<MeterRegistry> meterRegistry) {
        MeterRegistry registry = meterRegistry.getIfAvailable();
        return registry == null ? AuthorizationMetrics.noop() : new AuthorizationMetrics(registry);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "warden.audit", name = "enabled", havingValue = "true")
    public AuditLogger wardenAuditLogger(WardenProperties properties, ObjectProvider<AuditAdapter> adapter) {
        WardenProperties.Audit audit = properties.audit();
        AuditAdapter target = adapter.getIfAvailable(
                () -> new ConsoleAuditAdapter(System.out, audit.format(), false, true));
        return new AuditLogger(AuditConfig.builder(target)
                .bufferSize(audit.bufferSize())
                .flushInterval(audit.flushInterval())
                .async(audit.async())
                .sampleRate(audit.sampleRate())
                .defaults(TableAuditConfig.builder()
                        .logAllowed(audit.logAllowed())
                        .logDenied(audit.logDenied())
                        .logFilters(audit.logFilters())
                        .build())
                .build());
    }

    @Bean
    @ConditionalOnMissingBean
    public AuthorizationEngine authorizationEngine(
            WardenProperties properties,
            CacheProvider cacheProvider,
            AuthorizationMetrics metrics,
            ObjectProvider<AuditLogger> auditLogger,
            ObjectProvider<ContextResolver> resolvers,
            ObjectProvider<RelationshipPath> relationships,
            ObjectProvider<RelationshipTableRegistration> tables,
            ObjectProvider<FieldAccessTableRegistration> fieldAccess) {
        WardenProperties.Resolver resolver = properties.resolver();
        AuthorizationEngine engine = AuthorizationEngine.builder()
                .resolverOptions(ResolverManagerOptions.builder()
                        .cacheProvider(cacheProvider)
                        .defaultCacheTtl(resolver.defaultCacheTtl())
                        .resolverTimeout(resolver.timeout())
                        .parallel(resolver.parallel())
                        .strictMerge(resolver.strictMerge())
                        .metrics(metrics)
                        .build())
                .strategy(properties.query().strategy())
                .mainTableAlias(properties.query().mainTableAlias())
                .defaultMaskValue(properties.field().maskValue())
                .auditLogger(auditLogger.getIfAvailable())
                .build();

        resolvers.orderedStream().forEach(engine::registerResolver);
        relationships.orderedStream().forEach(engine::registerRelationship);
        tables.orderedStream().forEach(t -> engine.registerTable(t.table(), t.config()));
        fieldAccess.orderedStream().forEach(f -> engine.registerFieldAccess(f.table(), f.config()));

        log.info("Authorization engine configured: {} resolver(s), {} ReBAC table(s), {} field access table(s)",
                engine.resolverManager().resolverNames().size(),
                engine.relationshipRegistry().tables().size(),
                engine.fieldAccessRegistry().tables().size());
        return engine;
    }
}
