package ward.runtime.types;

import ward.runtime.DefinitionException;

import java.util.Collection;

/**
 * 声明修饰符（成员与类共用）
 */
public enum Modifier {
    // 可见性
    PUBLIC,
    PROTECTED,
    PRIVATE,

    // 继承
    ABSTRACT,
    FINAL,

    // 其他
    CONST,
    STATIC;

    /** 返回声明中对应的关键字 */
    public String toSourceString() {
        return name().toLowerCase();
    }

    public boolean isVisibility() {
        return this == PUBLIC || this == PROTECTED || this == PRIVATE;
    }

    /**
     * 从修饰符集合中取出可见性，未声明时为 PUBLIC。
     *
     * @throws DefinitionException 同时出现多个可见性修饰符
     */
    public static Visibility visibilityOf(String declaredName, Collection<Modifier> modifiers) {
        Visibility result = null;
        for (Modifier m : modifiers) {
            if (!m.isVisibility()) continue;
            Visibility v = Visibility.valueOf(m.name());
            if (result != null && result != v) {
                throw new DefinitionException("Malformed declaration of '" + declaredName
                        + "': conflicting visibility modifiers " + result.toSourceString()
                        + " and " + v.toSourceString());
            }
            result = v;
        }
        return result != null ? result : Visibility.PUBLIC;
    }
}
