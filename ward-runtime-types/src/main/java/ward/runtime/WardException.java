package ward.runtime;

/**
 * Ward 基础运行时异常。
 *
 * <p>定义期、访问期的所有错误都继承此类，均为非受检异常，引擎内部不做重试。</p>
 */
public class WardException extends RuntimeException {

    public WardException(String message) {
        super(message);
    }

    public WardException(String message, Throwable cause) {
        super(message, cause);
    }
}
