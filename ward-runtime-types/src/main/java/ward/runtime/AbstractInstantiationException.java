package ward.runtime;

/**
 * 实例化抽象类或接口
 */
public class AbstractInstantiationException extends WardException {

    private final String typeName;

    public AbstractInstantiationException(String typeName, String message) {
        super(message);
        this.typeName = typeName;
    }

    public String getTypeName() {
        return typeName;
    }
}
