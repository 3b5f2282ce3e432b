package ward.runtime.types;

/**
 * 接口要求的最小成员签名：名称、种类，方法再加参数个数。
 *
 * <p>不比较参数类型，鸭子类型不要求参数类型一致。</p>
 */
public final class MemberSignature {

    private final String name;
    private final MemberKind kind;
    private final int arity;

    public MemberSignature(String name, MemberKind kind, int arity) {
        this.name = name;
        this.kind = kind;
        this.arity = kind == MemberKind.METHOD ? arity : 0;
    }

    public static MemberSignature method(String name, int arity) {
        return new MemberSignature(name, MemberKind.METHOD, arity);
    }

    public static MemberSignature data(String name) {
        return new MemberSignature(name, MemberKind.DATA, 0);
    }

    public static MemberSignature of(MemberDescriptor descriptor) {
        return descriptor.isMethod()
                ? method(descriptor.getName(), descriptor.getArity())
                : data(descriptor.getName());
    }

    public String getName() {
        return name;
    }

    public MemberKind getKind() {
        return kind;
    }

    public int getArity() {
        return arity;
    }

    /** 可变参数（-1）与任意参数个数兼容 */
    public boolean isArityCompatible(int candidateArity) {
        return candidateArity == -1 || candidateArity == arity;
    }

    /**
     * 描述符是否满足本签名（只看种类和参数个数，不看可见性）
     */
    public boolean isSatisfiedBy(MemberDescriptor descriptor) {
        if (!name.equals(descriptor.getName())) return false;
        if (kind == MemberKind.METHOD) {
            return descriptor.isMethod() && isArityCompatible(descriptor.getArity());
        }
        return !descriptor.isMethod();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MemberSignature)) return false;
        MemberSignature other = (MemberSignature) o;
        return name.equals(other.name) && kind == other.kind && arity == other.arity;
    }

    @Override
    public int hashCode() {
        return (name.hashCode() * 31 + kind.hashCode()) * 31 + arity;
    }

    @Override
    public String toString() {
        return kind == MemberKind.METHOD ? name + "/" + arity : name;
    }
}
