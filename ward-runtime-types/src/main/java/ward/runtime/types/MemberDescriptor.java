package ward.runtime.types;

import java.util.List;
import java.util.function.Predicate;

/**
 * 类成员描述符（编译期元数据）。
 *
 * <p>创建后不可变；所属类 id 在创建时确定。子类重定义同名成员会产生新的描述符，
 * 遮蔽而不修改父类的描述符。</p>
 */
public final class MemberDescriptor {

    private final String name;
    private final Visibility visibility;
    private final Scope scope;
    private final Mutability mutability;
    private final List<TypeTag> declaredTypes;
    private final Predicate<Object> validator;
    private final Object defaultValue;
    private final boolean hasDefault;
    private final String ownerClassId;
    private final boolean abstractFlag;
    private final boolean finalFlag;
    private final MethodBody body;
    private final int arity;

    MemberDescriptor(String name, Visibility visibility, Scope scope, Mutability mutability,
                     List<TypeTag> declaredTypes, Predicate<Object> validator,
                     Object defaultValue, boolean hasDefault, String ownerClassId,
                     boolean abstractFlag, boolean finalFlag, MethodBody body, int arity) {
        this.name = name;
        this.visibility = visibility;
        this.scope = scope;
        this.mutability = mutability;
        this.declaredTypes = declaredTypes;
        this.validator = validator;
        this.defaultValue = defaultValue;
        this.hasDefault = hasDefault;
        this.ownerClassId = ownerClassId;
        this.abstractFlag = abstractFlag;
        this.finalFlag = finalFlag;
        this.body = body;
        this.arity = arity;
    }

    public String getName() {
        return name;
    }

    public Visibility getVisibility() {
        return visibility;
    }

    public Scope getScope() {
        return scope;
    }

    public Mutability getMutability() {
        return mutability;
    }

    /** 有序、去重、不可修改 */
    public List<TypeTag> getDeclaredTypes() {
        return declaredTypes;
    }

    /** 可能为 null */
    public Predicate<Object> getValidator() {
        return validator;
    }

    public Object getDefaultValue() {
        return defaultValue;
    }

    public boolean hasDefault() {
        return hasDefault;
    }

    public String getOwnerClassId() {
        return ownerClassId;
    }

    public String getQualifiedName() {
        return ownerClassId + "." + name;
    }

    public boolean isAbstract() {
        return abstractFlag;
    }

    public boolean isFinal() {
        return finalFlag;
    }

    public boolean isStatic() {
        return scope == Scope.STATIC;
    }

    public boolean isMethod() {
        return mutability == Mutability.METHOD;
    }

    public boolean isConstant() {
        return mutability == Mutability.CONSTANT;
    }

    /** 方法体，抽象方法和数据成员为 null */
    public MethodBody getBody() {
        return body;
    }

    /** 方法参数个数，-1 表示可变参数；数据成员恒为 0 */
    public int getArity() {
        return arity;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(visibility.toSourceString()).append(' ');
        if (scope == Scope.STATIC) sb.append("static ");
        if (abstractFlag) sb.append("abstract ");
        if (finalFlag) sb.append("final ");
        sb.append(mutability.name().toLowerCase()).append(' ').append(getQualifiedName());
        if (isMethod()) sb.append('/').append(arity);
        return sb.toString();
    }
}
