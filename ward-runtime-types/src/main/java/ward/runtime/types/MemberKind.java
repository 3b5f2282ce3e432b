package ward.runtime.types;

/**
 * 接口签名中的成员种类
 */
public enum MemberKind {
    METHOD,
    DATA
}
