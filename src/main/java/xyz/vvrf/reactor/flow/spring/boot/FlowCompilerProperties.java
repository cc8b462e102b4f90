package xyz.vvrf.reactor.flow.spring.boot;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import javax.validation.Valid;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotNull;
import java.time.Duration;

/**
 * 工作流编译器与引擎的配置属性类。
 * 绑定 'flow' 前缀下的属性。
 *
 * @author ruifeng.wen
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "flow")
@Validated
public class FlowCompilerProperties {

    @Valid
    private final Compiler compiler = new Compiler();
    @Valid
    private final Engine engine = new Engine();
    @Valid
    private final Cache cache = new Cache();
    @Valid
    private final Monitor monitor = new Monitor();

    @Getter
    @Setter
    public static class Compiler {
        /**
         * 作用域的最大嵌套深度。
         */
        @Min(1)
        private int maxScopeDepth = 16;
    }

    @Getter
    @Setter
    public static class Engine {
        /**
         * 本地节点的默认执行超时时间。
         */
        @NotNull
        private Duration defaultNodeTimeout = Duration.ofSeconds(30);

        /**
         * 工作流节点（子工作流调用）的最大嵌套深度。
         */
        @Min(1)
        private int maxCallDepth = 32;
    }

    @Getter
    @Setter
    public static class Cache {
        /**
         * 节点类型解析缓存的容量。
         */
        @Min(1)
        private long nodeTypeCapacity = 256;

        /**
         * 执行计划缓存的容量。
         */
        @Min(1)
        private long planCapacity = 128;
    }

    @Getter
    @Setter
    public static class Monitor {
        /**
         * 是否注册日志监听器。
         */
        private boolean loggingEnabled = true;
    }

    @Override
    public String toString() {
        return "FlowCompilerProperties{" +
                "compiler={maxScopeDepth=" + compiler.maxScopeDepth +
                "}, engine={defaultNodeTimeout=" + engine.defaultNodeTimeout +
                ", maxCallDepth=" + engine.maxCallDepth +
                "}, cache={nodeTypeCapacity=" + cache.nodeTypeCapacity +
                ", planCapacity=" + cache.planCapacity +
                "}, monitor={loggingEnabled=" + monitor.loggingEnabled +
                "}}";
    }
}
