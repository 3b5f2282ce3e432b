package ward.runtime.engine;

import ward.runtime.DefinitionException;
import ward.runtime.types.ClassDescriptor;
import ward.runtime.types.InterfaceDescriptor;
import ward.runtime.types.MemberDescriptor;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * 类增强：把原始类定义编译为带属性表的 {@link WardClass}。
 *
 * <p>步骤：类修饰符检查 → 父类 final 检查 → 编译成员表 → final 成员覆盖检查 →
 * 创建描述符 → 显式接口检查 → 安装属性表 → 提交类体中的静态值与常量。</p>
 *
 * <p>同一个定义重复增强返回同一个 {@link WardClass}。</p>
 */
public final class ClassAugmenter {

    private static final Logger LOG = Logger.getLogger(ClassAugmenter.class.getName());

    private final AccessResolver resolver;
    private final TypeValidator validator;
    private final AbstractFinalEnforcer enforcer;
    private final ConformanceChecker conformance;

    private final Map<ClassDefinition, WardClass> augmented = new IdentityHashMap<ClassDefinition, WardClass>();
    private final Map<String, WardClass> classesById = new LinkedHashMap<String, WardClass>();

    public ClassAugmenter(AccessResolver resolver, TypeValidator validator,
                          AbstractFinalEnforcer enforcer, ConformanceChecker conformance) {
        this.resolver = resolver;
        this.validator = validator;
        this.enforcer = enforcer;
        this.conformance = conformance;
    }

    public WardClass augment(ClassDefinition definition) {
        WardClass existing = augmented.get(definition);
        if (existing != null) {
            return existing;
        }
        String id = definition.getId();
        if (classesById.containsKey(id)) {
            throw new DefinitionException("Class '" + id + "' is already defined");
        }

        enforcer.checkClassModifiers(definition);
        WardClass parent = definition.getParent();
        enforcer.checkSubclassable(parent, id);

        Map<String, MemberDescriptor> members = ClassDescriptor.compileMembers(id, definition.getMembers());
        ClassDescriptor parentDescriptor = parent != null ? parent.getDescriptor() : null;
        enforcer.checkFinalMembers(parentDescriptor, id, members);

        List<InterfaceDescriptor> interfaces = new ArrayList<InterfaceDescriptor>();
        for (WardInterface iface : definition.getInterfaces()) {
            interfaces.add(iface.getDescriptor());
        }
        ClassDescriptor descriptor = new ClassDescriptor(id, parentDescriptor, members,
                definition.isAbstract(), definition.isFinal(), interfaces);
        conformance.checkImplements(descriptor);

        WardClass cls = new WardClass(definition, descriptor, parent, resolver, enforcer);
        cls.install(buildPropertyTable(cls, parent, members.values()));
        commitClassBody(cls, members.values());

        augmented.put(definition, cls);
        classesById.put(id, cls);
        LOG.fine("Encapsulated class '" + id + "' with " + members.size() + " member(s)"
                + (parent != null ? ", parent '" + parent.getName() + "'" : ""));
        return cls;
    }

    public WardClass find(String id) {
        return classesById.get(id);
    }

    public Collection<WardClass> getClasses() {
        return Collections.unmodifiableCollection(classesById.values());
    }

    /** 继承父类的处理器，自身成员覆盖同名项 */
    private Map<String, Property> buildPropertyTable(WardClass cls, WardClass parent, Collection<MemberDescriptor> own) {
        Map<String, Property> table = new LinkedHashMap<String, Property>();
        if (parent != null) {
            table.putAll(parent.getProperties());
        }
        for (MemberDescriptor member : own) {
            table.put(member.getName(), createProperty(member, cls));
        }
        return table;
    }

    private Property createProperty(MemberDescriptor member, WardClass owner) {
        switch (member.getMutability()) {
            case CONSTANT:
                return new ConstantProperty(member, owner, resolver, validator);
            case METHOD:
                return new MethodProperty(member, owner, resolver, enforcer);
            default:
                return new VariableProperty(member, owner, resolver, validator);
        }
    }

    /**
     * 类体求值：带值的常量在类级提交，带默认值的静态变量写入共享存储
     */
    private void commitClassBody(WardClass cls, Collection<MemberDescriptor> own) {
        Slots store = cls.getStaticSlots();
        for (MemberDescriptor member : own) {
            if (!member.hasDefault()) continue;
            if (member.isConstant()) {
                store.commit(member, member.getDefaultValue());
            } else if (member.isStatic()) {
                store.write(member, member.getDefaultValue());
            }
        }
    }
}
