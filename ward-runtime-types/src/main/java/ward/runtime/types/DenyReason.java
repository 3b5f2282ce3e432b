package ward.runtime.types;

/**
 * 访问被拒绝时触发的规则
 */
public enum DenyReason {
    PRIVATE,
    PROTECTED,
    CONSTANT,
    METHOD,
    UNDECLARED;

    /** 生成面向调用方的错误消息 */
    public String describe(Operation operation, String qualifiedName) {
        switch (this) {
            case PRIVATE:
                return "Cannot " + operation.verb() + " private member '" + qualifiedName + "'";
            case PROTECTED:
                return "Cannot " + operation.verb() + " protected member '" + qualifiedName + "'";
            case CONSTANT:
                return operation == Operation.DELETE
                        ? "Cannot delete constant '" + qualifiedName + "'"
                        : "Cannot override constant '" + qualifiedName + "'";
            case METHOD:
                return "Cannot " + operation.verb() + " method '" + qualifiedName + "' as data";
            case UNDECLARED:
                return "Cannot " + operation.verb() + " undeclared attribute '" + qualifiedName + "'";
            default:
                return "Access denied: '" + qualifiedName + "'";
        }
    }
}
