package ward.runtime.types;

import ward.runtime.DefinitionException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 接口描述符
 *
 * <p>要求成员 = 自身声明的非隐藏成员 ∪ 所有祖先接口的要求成员。创建后不可变。</p>
 */
public final class InterfaceDescriptor {

    private final String interfaceId;
    private final List<InterfaceDescriptor> parents;
    private final Map<String, MemberSignature> ownRequired;
    private final Map<String, MemberSignature> requiredMembers;

    private InterfaceDescriptor(String interfaceId, List<InterfaceDescriptor> parents,
                                Map<String, MemberSignature> ownRequired,
                                Map<String, MemberSignature> requiredMembers) {
        this.interfaceId = interfaceId;
        this.parents = Collections.unmodifiableList(new ArrayList<InterfaceDescriptor>(parents));
        this.ownRequired = Collections.unmodifiableMap(ownRequired);
        this.requiredMembers = Collections.unmodifiableMap(requiredMembers);
    }

    /**
     * 编译接口体。
     *
     * <p>非 public 或以 {@code _} 开头的成员视为隐藏，不进入要求集合。
     * 两个父接口对同名成员的签名不一致且本接口未重新声明时报错。</p>
     */
    public static InterfaceDescriptor compile(String interfaceId, List<InterfaceDescriptor> parents,
                                              List<MemberDeclaration> declarations) {
        Map<String, MemberSignature> own = new LinkedHashMap<String, MemberSignature>();
        List<String> seen = new ArrayList<String>();
        for (MemberDeclaration decl : declarations) {
            if (seen.contains(decl.getName())) {
                throw new DefinitionException("Duplicate member '" + decl.getName()
                        + "' in interface '" + interfaceId + "'");
            }
            seen.add(decl.getName());
            MemberDescriptor descriptor = decl.toDescriptor(interfaceId);
            if (isHidden(descriptor)) continue;
            own.put(descriptor.getName(), MemberSignature.of(descriptor));
        }

        Map<String, MemberSignature> inherited = new LinkedHashMap<String, MemberSignature>();
        Map<String, String> origin = new LinkedHashMap<String, String>();
        for (InterfaceDescriptor parent : parents) {
            for (MemberSignature sig : parent.getRequiredMembers().values()) {
                MemberSignature existing = inherited.get(sig.getName());
                if (existing != null && !existing.equals(sig) && !own.containsKey(sig.getName())) {
                    throw new DefinitionException("Interface '" + interfaceId + "' inherits conflicting member '"
                            + sig.getName() + "' from '" + origin.get(sig.getName()) + "' (" + existing
                            + ") and '" + parent.getInterfaceId() + "' (" + sig + ")");
                }
                if (existing == null) {
                    inherited.put(sig.getName(), sig);
                    origin.put(sig.getName(), parent.getInterfaceId());
                }
            }
        }

        Map<String, MemberSignature> required = new LinkedHashMap<String, MemberSignature>(inherited);
        required.putAll(own);
        return new InterfaceDescriptor(interfaceId, parents, own, required);
    }

    private static boolean isHidden(MemberDescriptor descriptor) {
        return descriptor.getVisibility() != Visibility.PUBLIC || descriptor.getName().startsWith("_");
    }

    public String getInterfaceId() {
        return interfaceId;
    }

    public List<InterfaceDescriptor> getParents() {
        return parents;
    }

    public Map<String, MemberSignature> getOwnRequired() {
        return ownRequired;
    }

    /** 含所有祖先接口的要求成员 */
    public Map<String, MemberSignature> getRequiredMembers() {
        return requiredMembers;
    }

    public boolean isSubInterfaceOf(InterfaceDescriptor other) {
        if (this == other) {
            return true;
        }
        for (InterfaceDescriptor parent : parents) {
            if (parent.isSubInterfaceOf(other)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "interface " + interfaceId;
    }
}
