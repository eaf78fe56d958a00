package com.retryloop.model.enums;

/**
 * 一次调用的最终结局
 */
public enum RetryEventType {
    /** 决策停止且返回了结果 */
    SUCCESS,
    /** 决策停止且最后一次抛出了异常 */
    FAILURE,
    /** 达到最大调用次数 */
    MAX_TRIES,
    /** 下一次等待会越过截止时间 */
    TIMEOUT,
    /** 决策回调本身抛出异常 */
    DECISION_ERROR,
    /** 退避等待失败, 如线程被中断 */
    ABORTED
}
