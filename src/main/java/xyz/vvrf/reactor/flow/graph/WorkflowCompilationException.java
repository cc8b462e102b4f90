package xyz.vvrf.reactor.flow.graph;

/**
 * 工作流编译过程中的结构性错误的基类。
 *
 * @author ruifeng.wen
 */
public class WorkflowCompilationException extends RuntimeException {

    public WorkflowCompilationException(String message) {
        super(message);
    }

    public WorkflowCompilationException(String message, Throwable cause) {
        super(message, cause);
    }
}
