package com.warden.audit;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.warden.context.Operation;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ConsoleAuditAdapter")
class ConsoleAuditAdapterTest {

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);

    private final AuditEvent event = AuditEvent.builder(Operation.UPDATE, "posts", AuditDecision.DENY)
            .timestamp(Instant.parse("2024-03-01T10:15:30Z"))
            .userId("u-1")
            .policyName("owner-only")
            .reason("not owner")
            .build();

    @Test
    @DisplayName("text format should describe the decision on one line")
    void textFormat() {
        new ConsoleAuditAdapter(out, ConsoleAuditAdapter.Format.TEXT, false, true).log(event);

        assertThat(buffer.toString(StandardCharsets.UTF_8).trim()).isEqualTo(
                "[2024-03-01T10:15:30Z] x AUTHZ DENY: update on posts (policy: owner-only) - not owner [user: u-1]");
    }

    @Test
    @DisplayName("coloured text should wrap the symbol in ANSI codes")
    void colouredText() {
        new ConsoleAuditAdapter(out, ConsoleAuditAdapter.Format.TEXT, true, false).log(event);

        assertThat(buffer.toString(StandardCharsets.UTF_8)).startsWith("\u001B[31mx\u001B[0m AUTHZ DENY");
    }

    @Test
    @DisplayName("json format should write ISO timestamps and lower-case enums")
    void jsonFormat() throws Exception {
        new ConsoleAuditAdapter(out, ConsoleAuditAdapter.Format.JSON, false, true).log(event);

        JsonNode json = AuditEventSerializer.objectMapper().readTree(buffer.toString(StandardCharsets.UTF_8));
        assertThat(json.get("timestamp").asText()).isEqualTo("2024-03-01T10:15:30Z");
        assertThat(json.get("operation").asText()).isEqualTo("update");
        assertThat(json.get("decision").asText()).isEqualTo("deny");
        assertThat(json.has("tenantId")).isFalse();
    }
}
