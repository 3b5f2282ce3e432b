package ward.runtime;

/**
 * 整条继承链上既没有描述符也没有普通属性。与 {@link AccessDeniedException} 区分。
 */
public class MemberNotFoundException extends WardException {

    private final String memberName;

    public MemberNotFoundException(String typeName, String memberName) {
        super("'" + typeName + "' object has no attribute '" + memberName + "'");
        this.memberName = memberName;
    }

    public String getMemberName() {
        return memberName;
    }
}
