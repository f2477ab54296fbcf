package com.warden.authz;

import com.warden.context.AuthorizationErrorCode;
import com.warden.context.AuthorizationException;
import com.warden.context.Operation;

import java.util.List;

/**
 * Thrown when an operation is denied by a policy or a write touches fields the caller may
 * not write.
 */
public class PolicyViolationException extends AuthorizationException {

    private final Operation operation;
    private final String table;
    private final String reason;
    private final String policyName;
    private final List<String> fields;

    public PolicyViolationException(Operation operation, String table, String reason, String policyName) {
        this(operation, table, reason, policyName, List.of());
    }

    public PolicyViolationException(Operation operation, String table, String reason, String policyName,
                                    List<String> fields) {
        super(buildMessage(operation, table, reason, policyName), AuthorizationErrorCode.POLICY_VIOLATION);
        this.operation = operation;
        this.table = table;
        this.reason = reason;
        this.policyName = policyName;
        this.fields = fields == null ? List.of() : List.copyOf(fields);
    }

    private static String buildMessage(Operation operation, String table, String reason, String policyName) {
        var message = new StringBuilder("Authorization denied: ")
                .append(operation.value()).append(" on ").append(table);
        if (policyName != null) {
            message.append(" (policy: ").append(policyName).append(')');
        }
        if (reason != null) {
            message.append(": ").append(reason);
        }
        return message.toString();
    }

    public Operation operation() {
        return operation;
    }

    public String table() {
        return table;
    }

    public String reason() {
        return reason;
    }

    /** Name of the deciding policy, or null. */
    public String policyName() {
        return policyName;
    }

    /** Fields that caused the violation; empty for row-level denials. */
    public List<String> fields() {
        return fields;
    }
}
