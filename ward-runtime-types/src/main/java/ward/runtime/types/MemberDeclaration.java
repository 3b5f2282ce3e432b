package ward.runtime.types;

import ward.runtime.DefinitionException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * 类体中的成员声明（尚未绑定所属类）。
 *
 * <p>由 {@link Members} 的工厂方法创建，类编译时经 {@link #toDescriptor(String)}
 * 转为 {@link MemberDescriptor}。修饰符组合在转换时校验。</p>
 */
public final class MemberDeclaration {

    private final String name;
    private final Mutability kind;
    private final Set<Modifier> modifiers;
    private final List<TypeTag> types;
    private final Predicate<Object> validator;
    private final Object defaultValue;
    private final boolean hasDefault;
    private final MethodBody body;
    private final int arity;

    private MemberDeclaration(Builder builder) {
        this.name = builder.name;
        this.kind = builder.kind;
        this.modifiers = Collections.unmodifiableSet(EnumSet.copyOf(builder.modifiers));
        this.types = Collections.unmodifiableList(new ArrayList<TypeTag>(new LinkedHashSet<TypeTag>(builder.types)));
        this.validator = builder.validator;
        this.defaultValue = builder.defaultValue;
        this.hasDefault = builder.hasDefault;
        this.body = builder.body;
        this.arity = builder.arity;
    }

    public String getName() {
        return name;
    }

    public Set<Modifier> getModifiers() {
        return modifiers;
    }

    public boolean isMethod() {
        return kind == Mutability.METHOD;
    }

    /**
     * 绑定所属类，生成描述符
     *
     * @throws DefinitionException 声明格式错误
     */
    public MemberDescriptor toDescriptor(String ownerClassId) {
        Visibility visibility = Modifier.visibilityOf(name, modifiers);
        Scope scope = modifiers.contains(Modifier.STATIC) ? Scope.STATIC : Scope.INSTANCE;
        boolean isAbstract = modifiers.contains(Modifier.ABSTRACT);
        boolean isFinal = modifiers.contains(Modifier.FINAL);

        Mutability mutability = kind;
        if (modifiers.contains(Modifier.CONST)) {
            if (kind == Mutability.METHOD) {
                throw malformed("a method cannot be const");
            }
            mutability = Mutability.CONSTANT;
        }

        if (mutability == Mutability.METHOD) {
            if (isAbstract && body != null) throw malformed("an abstract method cannot have a body");
            if (!isAbstract && body == null) throw malformed("method has no body");
            if (isAbstract && isFinal) throw malformed("a method cannot be both abstract and final");
            if (isAbstract && scope == Scope.STATIC) throw malformed("a static method cannot be abstract");
            if (!types.isEmpty() || validator != null || hasDefault) {
                throw malformed("a method cannot declare types, a validator or a default value");
            }
        } else if (isAbstract) {
            throw malformed("only methods can be abstract");
        }

        return new MemberDescriptor(name, visibility, scope, mutability, types, validator,
                defaultValue, hasDefault, ownerClassId, isAbstract, isFinal, body,
                mutability == Mutability.METHOD ? arity : 0);
    }

    private DefinitionException malformed(String detail) {
        return new DefinitionException("Malformed declaration of '" + name + "': " + detail);
    }

    @Override
    public String toString() {
        return "MemberDeclaration(" + name + ", " + kind + ", " + modifiers + ")";
    }

    public static Builder builder(String name, Mutability kind) {
        return new Builder(name, kind);
    }

    public static final class Builder {
        private final String name;
        private final Mutability kind;
        private final EnumSet<Modifier> modifiers = EnumSet.noneOf(Modifier.class);
        private final List<TypeTag> types = new ArrayList<TypeTag>();
        private Predicate<Object> validator;
        private Object defaultValue;
        private boolean hasDefault;
        private MethodBody body;
        private int arity;

        private Builder(String name, Mutability kind) {
            if (name == null || name.isEmpty()) {
                throw new DefinitionException("Malformed declaration: member name must not be empty");
            }
            this.name = name;
            this.kind = kind;
        }

        public Builder modifiers(Modifier... mods) {
            modifiers.addAll(Arrays.asList(mods));
            return this;
        }

        /** 替换已有的可见性修饰符 */
        public Builder visibility(Visibility visibility) {
            modifiers.remove(Modifier.PUBLIC);
            modifiers.remove(Modifier.PROTECTED);
            modifiers.remove(Modifier.PRIVATE);
            modifiers.add(Modifier.valueOf(visibility.name()));
            return this;
        }

        public Builder staticScope() {
            modifiers.add(Modifier.STATIC);
            return this;
        }

        public Builder finalMember() {
            modifiers.add(Modifier.FINAL);
            return this;
        }

        public Builder types(TypeTag... tags) {
            types.addAll(Arrays.asList(tags));
            return this;
        }

        public Builder validator(Predicate<Object> validator) {
            this.validator = validator;
            return this;
        }

        public Builder defaultValue(Object value) {
            this.defaultValue = value;
            this.hasDefault = true;
            return this;
        }

        Builder body(MethodBody body, int arity) {
            this.body = body;
            this.arity = arity;
            return this;
        }

        public MemberDeclaration build() {
            return new MemberDeclaration(this);
        }
    }
}
