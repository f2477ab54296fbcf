package com.warden.spring;

import static org.assertj.core.api.Assertions.assertThat;

import com.warden.audit.ConsoleAuditAdapter;
import com.warden.authz.query.ReBAcQueryTransformer;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("WardenProperties")
class WardenPropertiesTest {

    @Test
    @DisplayName("should default every absent section")
    void shouldDefaultSections() {
        var props = new WardenProperties(null, null, null, null, null);

        assertThat(props.enabled()).isTrue();
        assertThat(props.resolver().defaultCacheTtl()).isEqualTo(Duration.ofSeconds(300));
        assertThat(props.resolver().timeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(props.resolver().parallel()).isTrue();
        assertThat(props.query().strategy()).isEqualTo(ReBAcQueryTransformer.Strategy.EXISTS);
        assertThat(props.field().maskValue()).isNull();
        assertThat(props.audit().enabled()).isFalse();
        assertThat(props.audit().logDenied()).isTrue();
    }

    @Test
    @DisplayName("should default unset audit values")
    void shouldDefaultAudit() {
        var audit = new WardenProperties.Audit(true, null, null, null, null, null, true, null, false);

        assertThat(audit.format()).isEqualTo(ConsoleAuditAdapter.Format.TEXT);
        assertThat(audit.bufferSize()).isEqualTo(100);
        assertThat(audit.flushInterval()).isEqualTo(Duration.ofSeconds(5));
        assertThat(audit.async()).isTrue();
        assertThat(audit.sampleRate()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should keep explicit values")
    void shouldKeepExplicitValues() {
        var resolver = new WardenProperties.Resolver(Duration.ofMinutes(1), Duration.ofMillis(250), false, true);

        assertThat(resolver.defaultCacheTtl()).isEqualTo(Duration.ofMinutes(1));
        assertThat(resolver.timeout()).isEqualTo(Duration.ofMillis(250));
        assertThat(resolver.parallel()).isFalse();
        assertThat(resolver.strictMerge()).isTrue();
    }
}
