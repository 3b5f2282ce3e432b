package ward.runtime.engine;

import ward.runtime.types.MemberDeclaration;
import ward.runtime.types.Members;
import ward.runtime.types.MethodBody;
import ward.runtime.types.Modifier;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * 原始类定义：类名、父类、类级修饰符、成员声明、实现的接口和构造器。
 *
 * <p>本身不做任何检查，由 {@link ClassAugmenter} 编译为 {@link WardClass}。</p>
 */
public final class ClassDefinition {

    private final String id;
    private final WardClass parent;
    private final Set<Modifier> modifiers;
    private final List<MemberDeclaration> members;
    private final List<WardInterface> interfaces;
    private final MethodBody initializer;
    private final int initializerArity;

    private ClassDefinition(Builder builder) {
        this.id = builder.id;
        this.parent = builder.parent;
        this.modifiers = Collections.unmodifiableSet(EnumSet.copyOf(builder.modifiers));
        this.members = Collections.unmodifiableList(new ArrayList<MemberDeclaration>(builder.members));
        this.interfaces = Collections.unmodifiableList(new ArrayList<WardInterface>(builder.interfaces));
        this.initializer = builder.initializer;
        this.initializerArity = builder.initializerArity;
    }

    public static Builder builder(String id) {
        return new Builder(id, null);
    }

    public String getId() {
        return id;
    }

    public WardClass getParent() {
        return parent;
    }

    public Set<Modifier> getModifiers() {
        return modifiers;
    }

    public boolean isAbstract() {
        return modifiers.contains(Modifier.ABSTRACT);
    }

    public boolean isFinal() {
        return modifiers.contains(Modifier.FINAL);
    }

    public List<MemberDeclaration> getMembers() {
        return members;
    }

    public List<WardInterface> getInterfaces() {
        return interfaces;
    }

    public MethodBody getInitializer() {
        return initializer;
    }

    public int getInitializerArity() {
        return initializerArity;
    }

    @Override
    public String toString() {
        return "ClassDefinition(" + id + ")";
    }

    public static final class Builder {
        private final String id;
        private final Function<ClassDefinition, WardClass> definer;
        private WardClass parent;
        private final EnumSet<Modifier> modifiers = EnumSet.noneOf(Modifier.class);
        private final List<MemberDeclaration> members = new ArrayList<MemberDeclaration>();
        private final List<WardInterface> interfaces = new ArrayList<WardInterface>();
        private MethodBody initializer;
        private int initializerArity;

        Builder(String id, Function<ClassDefinition, WardClass> definer) {
            if (id == null || id.isEmpty()) {
                throw new IllegalArgumentException("class id must not be empty");
            }
            this.id = id;
            this.definer = definer;
        }

        public Builder extend(WardClass parent) {
            this.parent = parent;
            return this;
        }

        public Builder modifiers(Modifier... mods) {
            modifiers.addAll(Arrays.asList(mods));
            return this;
        }

        public Builder implement(WardInterface... ifaces) {
            interfaces.addAll(Arrays.asList(ifaces));
            return this;
        }

        public Builder member(MemberDeclaration declaration) {
            members.add(declaration);
            return this;
        }

        public Builder member(MemberDeclaration.Builder declaration) {
            return member(declaration.build());
        }

        /** 未加修饰的类体赋值：公有变量，值作为默认值 */
        public Builder attribute(String name, Object value) {
            return member(Members.variable(name).defaultValue(value));
        }

        /**
         * @param arity 参数个数，-1 表示可变参数
         */
        public Builder constructor(int arity, MethodBody body) {
            this.initializer = body;
            this.initializerArity = arity;
            return this;
        }

        public ClassDefinition build() {
            return new ClassDefinition(this);
        }

        /**
         * 构建并交给所属运行时增强
         */
        public WardClass define() {
            if (definer == null) {
                throw new IllegalStateException("Builder for '" + id + "' is not bound to a runtime; use WardRuntime.defineClass");
            }
            return definer.apply(build());
        }
    }
}
