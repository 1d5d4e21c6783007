package com.sdu.sparkbridge;

/**
 * 远端执行失败(用户函数抛出异常或宿主引擎报告Stage失败), 不自动重试
 *
 * workerStackTrace为出错WorkerFunction的创建调用栈, 仅用于诊断
 *
 * @author hanhan.zhang
 * */
public class JobExecutionException extends SparkException {

    private final String workerStackTrace;

    public JobExecutionException(String message) {
        this(message, null, null);
    }

    public JobExecutionException(String message, String workerStackTrace, Throwable cause) {
        super(workerStackTrace == null ? message : message + System.lineSeparator() + workerStackTrace, cause);
        this.workerStackTrace = workerStackTrace;
    }

    public String getWorkerStackTrace() {
        return workerStackTrace;
    }
}
