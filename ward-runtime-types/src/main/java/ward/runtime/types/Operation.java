package ward.runtime.types;

/**
 * 属性操作类型。删除在可见性判断上按写处理。
 */
public enum Operation {
    READ("read"),
    WRITE("assign"),
    DELETE("delete");

    private final String verb;

    Operation(String verb) {
        this.verb = verb;
    }

    public String verb() {
        return verb;
    }

    public boolean isMutation() {
        return this != READ;
    }
}
