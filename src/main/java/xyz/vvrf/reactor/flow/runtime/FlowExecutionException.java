package xyz.vvrf.reactor.flow.runtime;

/**
 * 节点执行期间由引擎产生的错误，例如找不到实现或调用深度超限。
 * 引擎把它包装为 {@link NodeOutcome#failure(Throwable)}，不会让它中止整个调用。
 *
 * @author ruifeng.wen
 */
public class FlowExecutionException extends RuntimeException {

    public FlowExecutionException(String message) {
        super(message);
    }

    public FlowExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
