package xyz.vvrf.reactor.flow.validation;

/**
 * 诊断的严重程度。ERROR 阻止生成执行计划，WARNING 不阻止。
 */
public enum Severity {
    ERROR,
    WARNING
}
