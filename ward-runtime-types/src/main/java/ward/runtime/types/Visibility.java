package ward.runtime.types;

/**
 * 成员可见性，每个成员恰好一个，默认 PUBLIC
 */
public enum Visibility {
    PUBLIC,
    PROTECTED,
    PRIVATE;

    public String toSourceString() {
        return name().toLowerCase();
    }
}
