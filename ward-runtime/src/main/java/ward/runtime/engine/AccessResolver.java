package ward.runtime.engine;

import ward.runtime.AccessDeniedException;
import ward.runtime.types.ClassDescriptor;
import ward.runtime.types.DenyReason;
import ward.runtime.types.MemberDescriptor;
import ward.runtime.types.Operation;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 访问控制判定
 *
 * <p>可见性按访问代码的词法所属类判断，而不是调用对象的运行时类型：</p>
 * <ul>
 *   <li>public：总是允许</li>
 *   <li>protected：访问类与声明类处于同一继承链（祖先、后代或自身）</li>
 *   <li>private：访问类恰好是声明类，子类也不行</li>
 * </ul>
 * <p>可见性通过后再检查可变性：常量提交后不可写、任何时候不可删；方法不能作为数据写入或删除。</p>
 */
public final class AccessResolver {

    private static final Logger LOG = Logger.getLogger(AccessResolver.class.getName());

    private final Level denialLogLevel;

    public AccessResolver(WardPolicy policy) {
        this.denialLogLevel = policy.getDenialLogLevel();
    }

    /**
     * @param owner     成员的声明类
     * @param committed 常量在目标所有者上是否已提交
     */
    public AccessDecision check(MemberDescriptor member, ClassDescriptor owner, AccessContext context,
                                Operation operation, boolean committed) {
        AccessDecision visibility = checkVisibility(member, owner, context);
        if (!visibility.isAllowed()) {
            return visibility;
        }
        if (operation.isMutation()) {
            switch (member.getMutability()) {
                case CONSTANT:
                    if (operation == Operation.DELETE || committed) {
                        return AccessDecision.deny(DenyReason.CONSTANT);
                    }
                    break;
                case METHOD:
                    return AccessDecision.deny(DenyReason.METHOD);
                default:
                    break;
            }
        }
        return AccessDecision.ALLOW;
    }

    public AccessDecision checkVisibility(MemberDescriptor member, ClassDescriptor owner, AccessContext context) {
        switch (member.getVisibility()) {
            case PUBLIC:
                return AccessDecision.ALLOW;
            case PRIVATE:
                return context.getEnclosingClass() == owner
                        ? AccessDecision.ALLOW : AccessDecision.deny(DenyReason.PRIVATE);
            case PROTECTED:
                return !context.isExternal() && owner.isSameLineage(context.getEnclosingClass())
                        ? AccessDecision.ALLOW : AccessDecision.deny(DenyReason.PROTECTED);
            default:
                return AccessDecision.deny(DenyReason.PRIVATE);
        }
    }

    /**
     * 未声明的普通属性：外部一律拒绝，对象所属类及其祖先的方法内一律允许
     */
    public AccessDecision checkUndeclared(ClassDescriptor objectClass, AccessContext context) {
        return !context.isExternal() && objectClass.isSubclassOf(context.getEnclosingClass())
                ? AccessDecision.ALLOW : AccessDecision.deny(DenyReason.UNDECLARED);
    }

    public void enforce(MemberDescriptor member, ClassDescriptor owner, AccessContext context,
                        Operation operation, boolean committed) {
        AccessDecision decision = check(member, owner, context, operation, committed);
        if (!decision.isAllowed()) {
            throw denied(decision, member.getName(), owner.getClassId(), context, operation);
        }
    }

    public void enforceUndeclared(String name, ClassDescriptor objectClass, AccessContext context, Operation operation) {
        AccessDecision decision = checkUndeclared(objectClass, context);
        if (!decision.isAllowed()) {
            throw denied(decision, name, objectClass.getClassId(), context, operation);
        }
    }

    private AccessDeniedException denied(AccessDecision decision, String name, String declaringClass,
                                         AccessContext context, Operation operation) {
        if (LOG.isLoggable(denialLogLevel)) {
            LOG.log(denialLogLevel, "Denied " + operation.verb() + " of '" + declaringClass + "." + name
                    + "' from " + context + " (" + decision.getReason() + ")");
        }
        return decision.toException(name, declaringClass, operation);
    }
}
