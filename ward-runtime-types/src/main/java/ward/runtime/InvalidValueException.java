package ward.runtime;

/**
 * 写入值未通过类型检查、类型转换或校验函数。
 *
 * <p>抛出时目标成员的存储值保持不变。</p>
 */
public class InvalidValueException extends WardException {

    private final String memberName;
    private final Object rejectedValue;

    public InvalidValueException(String declaringClass, String memberName, Object rejectedValue) {
        super(message(declaringClass, memberName, rejectedValue));
        this.memberName = memberName;
        this.rejectedValue = rejectedValue;
    }

    public InvalidValueException(String declaringClass, String memberName, Object rejectedValue, Throwable cause) {
        super(message(declaringClass, memberName, rejectedValue), cause);
        this.memberName = memberName;
        this.rejectedValue = rejectedValue;
    }

    private static String message(String declaringClass, String memberName, Object value) {
        String shown = value instanceof String ? "'" + value + "'" : String.valueOf(value);
        return "Invalid attribute value for '" + declaringClass + "." + memberName + "': " + shown;
    }

    public String getMemberName() {
        return memberName;
    }

    public Object getRejectedValue() {
        return rejectedValue;
    }
}
