package ward.runtime.engine;

import ward.runtime.types.InterfaceDescriptor;
import ward.runtime.types.MemberSignature;
import ward.runtime.types.TypeTag;

import java.util.List;
import java.util.Map;

/**
 * 接口运行时类型
 *
 * <p>作为类型标签使用时按结构（鸭子类型）判断，不做转换。</p>
 */
public final class WardInterface implements TypeTag {

    private final InterfaceDescriptor descriptor;
    private final List<WardInterface> superInterfaces;
    private final ConformanceChecker checker;

    WardInterface(InterfaceDescriptor descriptor, List<WardInterface> superInterfaces, ConformanceChecker checker) {
        this.descriptor = descriptor;
        this.superInterfaces = superInterfaces;
        this.checker = checker;
    }

    @Override
    public String getName() {
        return descriptor.getInterfaceId();
    }

    public InterfaceDescriptor getDescriptor() {
        return descriptor;
    }

    public List<WardInterface> getSuperInterfaces() {
        return superInterfaces;
    }

    /** 含继承的要求成员 */
    public Map<String, MemberSignature> getRequiredMembers() {
        return descriptor.getRequiredMembers();
    }

    public boolean isSubInterfaceOf(WardInterface other) {
        return other != null && descriptor.isSubInterfaceOf(other.descriptor);
    }

    @Override
    public boolean accepts(Object value) {
        return value != null && checker.conformsStructurally(value, this);
    }

    @Override
    public String toString() {
        return "interface " + getName();
    }
}
