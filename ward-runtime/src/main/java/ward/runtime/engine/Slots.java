package ward.runtime.engine;

import ward.runtime.types.MemberDescriptor;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * 成员值存储（实例存储或类级共享存储），记录常量是否已提交。
 *
 * <p>以 "声明类.成员名" 为键，子类重新声明的同名成员与父类成员各自存值。</p>
 */
final class Slots {

    private final Map<String, Object> values = new HashMap<String, Object>();
    private final Set<String> committed = new HashSet<String>();

    boolean contains(MemberDescriptor member) {
        return values.containsKey(member.getQualifiedName());
    }

    Object read(MemberDescriptor member) {
        return values.get(member.getQualifiedName());
    }

    void write(MemberDescriptor member, Object value) {
        values.put(member.getQualifiedName(), value);
    }

    /** 写入并标记为已提交 */
    void commit(MemberDescriptor member, Object value) {
        String key = member.getQualifiedName();
        values.put(key, value);
        committed.add(key);
    }

    boolean isCommitted(MemberDescriptor member) {
        return committed.contains(member.getQualifiedName());
    }

    void clear(MemberDescriptor member) {
        values.remove(member.getQualifiedName());
    }
}
