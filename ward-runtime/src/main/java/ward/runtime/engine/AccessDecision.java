package ward.runtime.engine;

import ward.runtime.AccessDeniedException;
import ward.runtime.types.DenyReason;
import ward.runtime.types.Operation;

/**
 * 访问判定结果
 */
public final class AccessDecision {

    public static final AccessDecision ALLOW = new AccessDecision(null);

    private final DenyReason reason;

    private AccessDecision(DenyReason reason) {
        this.reason = reason;
    }

    public static AccessDecision deny(DenyReason reason) {
        return new AccessDecision(reason);
    }

    public boolean isAllowed() {
        return reason == null;
    }

    /** 允许时为 null */
    public DenyReason getReason() {
        return reason;
    }

    AccessDeniedException toException(String memberName, String declaringClass, Operation operation) {
        return new AccessDeniedException(memberName, declaringClass, reason, operation);
    }

    @Override
    public String toString() {
        return isAllowed() ? "ALLOW" : "DENY(" + reason + ")";
    }
}
