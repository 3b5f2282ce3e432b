package ward.runtime.engine;

import ward.runtime.types.MemberDeclaration;
import ward.runtime.types.Members;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

/**
 * 原始接口定义
 */
public final class InterfaceDefinition {

    private final String id;
    private final List<WardInterface> parents;
    private final List<MemberDeclaration> members;

    private InterfaceDefinition(Builder builder) {
        this.id = builder.id;
        this.parents = Collections.unmodifiableList(new ArrayList<WardInterface>(builder.parents));
        this.members = Collections.unmodifiableList(new ArrayList<MemberDeclaration>(builder.members));
    }

    public static Builder builder(String id) {
        return new Builder(id, null);
    }

    public String getId() {
        return id;
    }

    public List<WardInterface> getParents() {
        return parents;
    }

    public List<MemberDeclaration> getMembers() {
        return members;
    }

    public static final class Builder {
        private final String id;
        private final Function<InterfaceDefinition, WardInterface> definer;
        private final List<WardInterface> parents = new ArrayList<WardInterface>();
        private final List<MemberDeclaration> members = new ArrayList<MemberDeclaration>();

        Builder(String id, Function<InterfaceDefinition, WardInterface> definer) {
            if (id == null || id.isEmpty()) {
                throw new IllegalArgumentException("interface id must not be empty");
            }
            this.id = id;
            this.definer = definer;
        }

        public Builder extend(WardInterface... superInterfaces) {
            parents.addAll(Arrays.asList(superInterfaces));
            return this;
        }

        /** 要求的方法签名 */
        public Builder method(String name, int arity) {
            return member(Members.abstractMethod(name, arity).build());
        }

        /** 要求的数据成员（变量或常量） */
        public Builder data(String name) {
            return member(Members.publicVar(name).build());
        }

        public Builder member(MemberDeclaration declaration) {
            members.add(declaration);
            return this;
        }

        public Builder member(MemberDeclaration.Builder declaration) {
            return member(declaration.build());
        }

        public InterfaceDefinition build() {
            return new InterfaceDefinition(this);
        }

        public WardInterface define() {
            if (definer == null) {
                throw new IllegalStateException("Builder for '" + id + "' is not bound to a runtime; use WardRuntime.defineInterface");
            }
            return definer.apply(build());
        }
    }
}
