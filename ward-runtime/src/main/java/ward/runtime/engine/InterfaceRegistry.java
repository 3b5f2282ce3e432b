package ward.runtime.engine;

import ward.runtime.DefinitionException;
import ward.runtime.types.InterfaceDescriptor;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * 接口注册表
 */
public final class InterfaceRegistry {

    private static final Logger LOG = Logger.getLogger(InterfaceRegistry.class.getName());

    private final ConformanceChecker checker;
    private final Map<String, WardInterface> interfaces = new LinkedHashMap<String, WardInterface>();

    public InterfaceRegistry(ConformanceChecker checker) {
        this.checker = checker;
    }

    public WardInterface define(InterfaceDefinition definition) {
        String id = definition.getId();
        if (interfaces.containsKey(id)) {
            throw new DefinitionException("Interface '" + id + "' is already defined");
        }
        List<InterfaceDescriptor> parents = new ArrayList<InterfaceDescriptor>();
        for (WardInterface parent : definition.getParents()) {
            parents.add(parent.getDescriptor());
        }
        InterfaceDescriptor descriptor = InterfaceDescriptor.compile(id, parents, definition.getMembers());
        WardInterface iface = new WardInterface(descriptor, definition.getParents(), checker);
        interfaces.put(id, iface);
        LOG.fine("Defined interface '" + id + "' requiring " + descriptor.getRequiredMembers().keySet());
        return iface;
    }

    /** 不存在时返回 null */
    public WardInterface find(String id) {
        return interfaces.get(id);
    }

    public boolean contains(String id) {
        return interfaces.containsKey(id);
    }

    public Collection<WardInterface> getInterfaces() {
        return Collections.unmodifiableCollection(interfaces.values());
    }
}
