package xyz.firestige.toolkit;

/**
 * 命名接口，提供用于日志与指标的名称。
 */
public interface Named {
    /**
     * 获取名称
     *
     * @return 组件名称，默认为实现类的简单类名
     */
    default String getName() {
        return this.getClass().getSimpleName();
    }
}
