package ward.runtime;

import ward.runtime.types.DenyReason;
import ward.runtime.types.Operation;

/**
 * 访问控制拒绝。
 *
 * <p>携带成员名、声明类以及触发的规则，调用方可据此给出具体错误。</p>
 */
public class AccessDeniedException extends WardException {

    private final String memberName;
    private final String declaringClass;
    private final DenyReason reason;
    private final Operation operation;

    public AccessDeniedException(String memberName, String declaringClass, DenyReason reason, Operation operation) {
        super(reason.describe(operation, declaringClass + "." + memberName));
        this.memberName = memberName;
        this.declaringClass = declaringClass;
        this.reason = reason;
        this.operation = operation;
    }

    public String getMemberName() {
        return memberName;
    }

    public String getDeclaringClass() {
        return declaringClass;
    }

    public DenyReason getReason() {
        return reason;
    }

    public Operation getOperation() {
        return operation;
    }
}
