package ward.runtime.types;

/**
 * 成员声明工厂
 *
 * <pre>
 * Members.privateVar("weight", TypeTags.FLOAT)
 * Members.constant("color", "green")
 * Members.method("getWeight", 0, (self, args) -&gt; self.get("weight")).visibility(Visibility.PROTECTED)
 * Members.abstractMethod("getColor", 0)
 * </pre>
 */
public final class Members {

    private Members() {
    }

    public static MemberDeclaration.Builder variable(String name, TypeTag... types) {
        return MemberDeclaration.builder(name, Mutability.VARIABLE).types(types);
    }

    public static MemberDeclaration.Builder publicVar(String name, TypeTag... types) {
        return variable(name, types).modifiers(Modifier.PUBLIC);
    }

    public static MemberDeclaration.Builder protectedVar(String name, TypeTag... types) {
        return variable(name, types).modifiers(Modifier.PROTECTED);
    }

    public static MemberDeclaration.Builder privateVar(String name, TypeTag... types) {
        return variable(name, types).modifiers(Modifier.PRIVATE);
    }

    /** 公有静态变量 */
    public static MemberDeclaration.Builder staticVar(String name, TypeTag... types) {
        return variable(name, types).modifiers(Modifier.STATIC);
    }

    /** 类体求值时即提交的常量 */
    public static MemberDeclaration.Builder constant(String name, Object value) {
        return MemberDeclaration.builder(name, Mutability.CONSTANT).defaultValue(value);
    }

    /** 未提交的常量，由首次初始化写入提交 */
    public static MemberDeclaration.Builder constant(String name) {
        return MemberDeclaration.builder(name, Mutability.CONSTANT);
    }

    /**
     * @param arity 参数个数，-1 表示可变参数
     */
    public static MemberDeclaration.Builder method(String name, int arity, MethodBody body) {
        return MemberDeclaration.builder(name, Mutability.METHOD).body(body, arity);
    }

    public static MemberDeclaration.Builder abstractMethod(String name, int arity) {
        return MemberDeclaration.builder(name, Mutability.METHOD).body(null, arity).modifiers(Modifier.ABSTRACT);
    }
}
