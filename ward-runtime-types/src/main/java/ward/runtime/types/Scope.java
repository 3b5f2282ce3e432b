package ward.runtime.types;

/**
 * 成员存储作用域：INSTANCE 每个实例一份，STATIC 由声明类及其全部实例共享
 */
public enum Scope {
    INSTANCE,
    STATIC
}
