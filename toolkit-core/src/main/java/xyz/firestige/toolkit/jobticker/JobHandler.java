package xyz.firestige.toolkit.jobticker;

/**
 * 周期任务处理器
 * <p>抛出受检异常视为一次失败的执行；抛出 {@link RuntimeException} 或 {@link Error}
 * 视为处理器崩溃。两种情况都会被 {@link JobTicker} 捕获并记录，不会终止调度循环。
 */
@FunctionalInterface
public interface JobHandler {

    void handle() throws Exception;
}
