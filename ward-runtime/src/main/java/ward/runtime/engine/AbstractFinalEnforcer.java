package ward.runtime.engine;

import ward.runtime.AbstractInstantiationException;
import ward.runtime.AbstractMemberException;
import ward.runtime.DefinitionException;
import ward.runtime.types.ClassDescriptor;
import ward.runtime.types.MemberDescriptor;
import ward.runtime.types.Modifier;

import java.util.Map;

/**
 * 抽象 / final 约束
 *
 * <p>每个类处于 {concrete, abstract} × {extendable, final} 之一。
 * 抽象成员在访问时惰性检查：未标记 abstract 的类即使有未覆盖的抽象方法也能实例化，
 * 但调用该方法总是失败。</p>
 */
public final class AbstractFinalEnforcer {

    /**
     * 类级修饰符只允许 ABSTRACT / FINAL，且二者互斥
     */
    public void checkClassModifiers(ClassDefinition definition) {
        for (Modifier m : definition.getModifiers()) {
            if (m != Modifier.ABSTRACT && m != Modifier.FINAL) {
                throw new DefinitionException("Malformed declaration of class '" + definition.getId()
                        + "': modifier '" + m.toSourceString() + "' is not allowed on a class");
            }
        }
        if (definition.isAbstract() && definition.isFinal()) {
            throw new DefinitionException("Malformed declaration of class '" + definition.getId()
                    + "': a class cannot be both abstract and final");
        }
    }

    /**
     * 在子类描述符创建之前检查父类是否为 final
     */
    public void checkSubclassable(WardClass parent, String childId) {
        if (parent != null && parent.isFinal()) {
            throw new DefinitionException("Cannot override final class '" + parent.getName()
                    + "' (while defining '" + childId + "')");
        }
    }

    /**
     * 子类不能重定义祖先中的 final 成员
     */
    public void checkFinalMembers(ClassDescriptor parent, String childId, Map<String, MemberDescriptor> ownMembers) {
        if (parent == null) return;
        for (String name : ownMembers.keySet()) {
            MemberDescriptor inherited = parent.findMember(name);
            if (inherited != null && inherited.isFinal()) {
                throw new DefinitionException("Cannot override final '" + inherited.getOwnerClassId()
                        + "' member '" + name + "' in '" + childId + "'");
            }
        }
    }

    public void checkInstantiable(WardClass cls) {
        if (cls.isAbstract()) {
            throw new AbstractInstantiationException(cls.getName(),
                    "Cannot instantiate abstract class '" + cls.getName() + "'");
        }
    }

    /** 接口永远不能实例化 */
    public AbstractInstantiationException interfaceInstantiation(WardInterface iface) {
        return new AbstractInstantiationException(iface.getName(),
                "Cannot instantiate interface '" + iface.getName() + "'");
    }

    public void checkConcrete(MemberDescriptor member) {
        if (member.isAbstract()) {
            throw new AbstractMemberException(member.getName(), member.getOwnerClassId());
        }
    }
}
