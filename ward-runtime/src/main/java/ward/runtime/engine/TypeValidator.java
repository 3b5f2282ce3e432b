package ward.runtime.engine;

import ward.runtime.InvalidValueException;
import ward.runtime.types.MemberDescriptor;
import ward.runtime.types.TypeTag;

import java.util.List;
import java.util.function.Predicate;

/**
 * 类型与校验引擎
 *
 * <p>先做类型检查（精确命中或接口结构符合即原样接受；只声明一个类型时尝试一次转换；
 * 多个类型时不转换），再调用校验函数。失败抛出 {@link InvalidValueException}，调用方据此不写入。</p>
 *
 * <p>转换失败只认 {@link IllegalArgumentException}（含 {@link NumberFormatException}）和
 * {@link ClassCastException}，其他异常原样向上抛出。</p>
 */
public final class TypeValidator {

    private final boolean coercionEnabled;

    public TypeValidator(WardPolicy policy) {
        this.coercionEnabled = policy.isCoercionEnabled();
    }

    public Object validate(MemberDescriptor descriptor, Object candidate) {
        Object value = candidate;
        List<TypeTag> types = descriptor.getDeclaredTypes();
        if (!types.isEmpty() && !acceptsAny(types, candidate)) {
            if (candidate == null || types.size() != 1 || !coercionEnabled) {
                throw rejected(descriptor, candidate, null);
            }
            try {
                value = types.get(0).coerce(candidate);
            } catch (IllegalArgumentException | ClassCastException e) {
                throw rejected(descriptor, candidate, e);
            }
        }
        Predicate<Object> validator = descriptor.getValidator();
        if (validator != null && !validator.test(value)) {
            throw rejected(descriptor, candidate, null);
        }
        return value;
    }

    private static boolean acceptsAny(List<TypeTag> types, Object value) {
        for (TypeTag tag : types) {
            if (tag.accepts(value)) return true;
        }
        return false;
    }

    private static InvalidValueException rejected(MemberDescriptor descriptor, Object value, Throwable cause) {
        return cause == null
                ? new InvalidValueException(descriptor.getOwnerClassId(), descriptor.getName(), value)
                : new InvalidValueException(descriptor.getOwnerClassId(), descriptor.getName(), value, cause);
    }
}
