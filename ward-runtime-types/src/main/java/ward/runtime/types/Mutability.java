package ward.runtime.types;

/**
 * 成员可变性
 */
public enum Mutability {
    /** 可反复赋值（需通过校验） */
    VARIABLE,
    /** 每个所有者（类或实例）只能提交一次 */
    CONSTANT,
    /** 方法，永远不能作为数据写入 */
    METHOD
}
