package ward.runtime;

/**
 * 访问未被覆盖的抽象成员
 */
public class AbstractMemberException extends WardException {

    private final String memberName;
    private final String declaringClass;

    public AbstractMemberException(String memberName, String declaringClass) {
        super("Cannot call abstract method '" + declaringClass + "." + memberName + "'");
        this.memberName = memberName;
        this.declaringClass = declaringClass;
    }

    public String getMemberName() {
        return memberName;
    }

    public String getDeclaringClass() {
        return declaringClass;
    }
}
