package com.warden.audit;

import java.io.PrintStream;
import java.util.Locale;

/**
 * Writes audit events to a {@link PrintStream}, one line per event, as text or JSON.
 */
public final class ConsoleAuditAdapter implements AuditAdapter {

    private static final String GREEN = "\u001B[32m";
    private static final String RED = "\u001B[31m";
    private static final String YELLOW = "\u001B[33m";
    private static final String RESET = "\u001B[0m";

    /** Output format. */
    public enum Format {
        TEXT,
        JSON
    }

    private final PrintStream out;
    private final Format format;
    private final boolean colors;
    private final boolean includeTimestamp;

    /** Text output with colours and timestamps on {@code System.out}. */
    public ConsoleAuditAdapter() {
        this(System.out, Format.TEXT, true, true);
    }

    public ConsoleAuditAdapter(PrintStream out, Format format, boolean colors, boolean includeTimestamp) {
        if (out == null) {
            throw new IllegalArgumentException("out must not be null");
        }
        this.out = out;
        this.format = format == null ? Format.TEXT : format;
        this.colors = colors;
        this.includeTimestamp = includeTimestamp;
    }

    @Override
    public void log(AuditEvent event) {
        out.println(format == Format.JSON ? AuditEventSerializer.toJson(event) : formatText(event));
    }

    @Override
    public void flush() {
        out.flush();
    }

    String formatText(AuditEvent event) {
        var line = new StringBuilder();
        if (includeTimestamp) {
            line.append('[').append(event.timestamp()).append("] ");
        }
        line.append(prefix(event.decision()))
                .append(" AUTHZ ")
                .append(event.decision().value().toUpperCase(Locale.ROOT))
                .append(": ")
                .append(event.operation().value())
                .append(" on ")
                .append(event.table());
        if (event.policyName() != null) {
            line.append(" (policy: ").append(event.policyName()).append(')');
        }
        if (event.reason() != null) {
            line.append(" - ").append(event.reason());
        }
        line.append(" [user: ").append(event.userId()).append(']');
        return line.toString();
    }

    private String prefix(AuditDecision decision) {
        String symbol = switch (decision) {
            case ALLOW -> "+";
            case DENY -> "x";
            case FILTER -> "~";
        };
        if (!colors) {
            return symbol;
        }
        String colour = switch (decision) {
            case ALLOW -> GREEN;
            case DENY -> RED;
            case FILTER -> YELLOW;
        };
        return colour + symbol + RESET;
    }
}
