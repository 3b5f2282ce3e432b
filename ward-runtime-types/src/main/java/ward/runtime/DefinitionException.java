package ward.runtime;

/**
 * 类/接口定义期错误：重复成员、缺失接口成员、继承 final 类、声明格式错误等。
 */
public class DefinitionException extends WardException {

    public DefinitionException(String message) {
        super(message);
    }
}
