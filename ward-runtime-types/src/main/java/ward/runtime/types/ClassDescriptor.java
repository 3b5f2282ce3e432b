package ward.runtime.types;

import ward.runtime.DefinitionException;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 类描述符（成员表）
 *
 * <p>类定义处理完毕后创建一次，此后不可变；成员的值可变，描述符不可变。</p>
 */
public final class ClassDescriptor {

    private final String classId;
    private final ClassDescriptor parent;
    private final Map<String, MemberDescriptor> members;
    private final boolean abstractFlag;
    private final boolean finalFlag;
    private final Set<InterfaceDescriptor> interfaces;

    // 成员查找缓存（含继承链）
    private Map<String, MemberDescriptor> memberCache;

    public ClassDescriptor(String classId, ClassDescriptor parent, Map<String, MemberDescriptor> members,
                           boolean abstractFlag, boolean finalFlag, Collection<InterfaceDescriptor> interfaces) {
        this.classId = classId;
        this.parent = parent;
        this.members = Collections.unmodifiableMap(new LinkedHashMap<String, MemberDescriptor>(members));
        this.abstractFlag = abstractFlag;
        this.finalFlag = finalFlag;
        this.interfaces = Collections.unmodifiableSet(new LinkedHashSet<InterfaceDescriptor>(interfaces));
    }

    /**
     * 编译类体中的成员声明。同一个类中不允许重名。
     */
    public static Map<String, MemberDescriptor> compileMembers(String classId, List<MemberDeclaration> declarations) {
        Map<String, MemberDescriptor> compiled = new LinkedHashMap<String, MemberDescriptor>();
        for (MemberDeclaration decl : declarations) {
            if (compiled.containsKey(decl.getName())) {
                throw new DefinitionException("Duplicate member '" + decl.getName() + "' in class '" + classId + "'");
            }
            compiled.put(decl.getName(), decl.toDescriptor(classId));
        }
        return compiled;
    }

    public String getClassId() {
        return classId;
    }

    public ClassDescriptor getParent() {
        return parent;
    }

    public Map<String, MemberDescriptor> getMembers() {
        return members;
    }

    public MemberDescriptor getOwnMember(String name) {
        return members.get(name);
    }

    public boolean isAbstract() {
        return abstractFlag;
    }

    public boolean isFinal() {
        return finalFlag;
    }

    public Set<InterfaceDescriptor> getInterfaces() {
        return interfaces;
    }

    // ============ 成员查找 ============

    /**
     * 沿继承链查找成员，最派生的定义优先
     */
    public MemberDescriptor findMember(String name) {
        MemberDescriptor member = members.get(name);
        if (member != null) return member;
        if (parent == null) return null;
        if (memberCache != null) {
            member = memberCache.get(name);
            if (member != null) return member;
        }
        member = parent.findMember(name);
        if (member != null) {
            if (memberCache == null) memberCache = new HashMap<String, MemberDescriptor>();
            memberCache.put(name, member);
        }
        return member;
    }

    /**
     * 有效成员表（自身 + 继承，最派生优先）
     */
    public Map<String, MemberDescriptor> effectiveMembers() {
        Map<String, MemberDescriptor> result = parent != null
                ? parent.effectiveMembers()
                : new LinkedHashMap<String, MemberDescriptor>();
        result.putAll(members);
        return result;
    }

    // ============ 继承检查 ============

    public boolean isSubclassOf(ClassDescriptor other) {
        ClassDescriptor current = this;
        while (current != null) {
            if (current == other) {
                return true;
            }
            current = current.parent;
        }
        return false;
    }

    /** 祖先或后代（含自身） */
    public boolean isSameLineage(ClassDescriptor other) {
        return other != null && (isSubclassOf(other) || other.isSubclassOf(this));
    }

    /**
     * 继承链中是否有类显式声明实现了该接口（或其子接口）
     */
    public boolean implementsInterface(InterfaceDescriptor iface) {
        for (InterfaceDescriptor impl : interfaces) {
            if (impl.isSubInterfaceOf(iface)) {
                return true;
            }
        }
        return parent != null && parent.implementsInterface(iface);
    }

    @Override
    public String toString() {
        return "class " + classId;
    }
}
