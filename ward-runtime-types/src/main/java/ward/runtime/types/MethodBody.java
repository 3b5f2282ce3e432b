package ward.runtime.types;

import java.util.List;

/**
 * 方法（及构造器）的可执行体。
 *
 * <p>{@code self} 绑定到方法所属类，成员访问以该类作为访问上下文。</p>
 */
@FunctionalInterface
public interface MethodBody {

    Object call(Self self, List<Object> args);
}
