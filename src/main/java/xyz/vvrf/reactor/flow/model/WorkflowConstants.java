package xyz.vvrf.reactor.flow.model;

/**
 * 工作流中保留的实例名与端口名。
 *
 * @author ruifeng.wen
 */
public final class WorkflowConstants {

    /** 代表工作流输入的伪实例 */
    public static final String START = "Start";
    /** 代表工作流输出的伪实例 */
    public static final String EXIT = "Exit";

    /** 外部 CONTROL 输入：触发执行 */
    public static final String EXECUTE = "execute";
    /** 外部 CONTROL 输出：成功分支 */
    public static final String ON_SUCCESS = "onSuccess";
    /** 外部 CONTROL 输出：失败分支 */
    public static final String ON_FAILURE = "onFailure";

    /** 作用域入口 CONTROL 输出（由所有者触发） */
    public static final String SCOPE_START = "start";
    /** 作用域出口 CONTROL 输入：子图成功 */
    public static final String SCOPE_SUCCESS = "success";
    /** 作用域出口 CONTROL 输入：子图失败 */
    public static final String SCOPE_FAILURE = "failure";

    private WorkflowConstants() {}

    public static boolean isStart(String instanceId) {
        return START.equals(instanceId);
    }

    public static boolean isExit(String instanceId) {
        return EXIT.equals(instanceId);
    }

    public static boolean isReserved(String instanceId) {
        return isStart(instanceId) || isExit(instanceId);
    }
}
