package ward.runtime.types;

/**
 * 方法体内的接收者句柄。
 *
 * <p>句柄在词法上绑定到声明方法的类：通过它进行的每次读写都以该类作为访问上下文，
 * 与实际接收者的运行时类型无关。静态方法的句柄没有接收者，成员访问落到类级存储。</p>
 */
public interface Self {

    Object get(String name);

    void set(String name, Object value);

    void delete(String name);

    Object invoke(String name, Object... args);

    /**
     * 调用当前类之上最近的祖先构造器
     */
    void superInit(Object... args);

    /** 方法所属（词法）类的 id */
    String getClassId();

    /** 接收者实例，静态上下文为 null */
    Object getReceiver();
}
