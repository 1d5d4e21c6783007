package com.sdu.sparkbridge.worker;

import com.google.common.base.MoreObjects;
import com.sdu.sparkbridge.rdd.WorkerFunction;
import com.sdu.sparkbridge.serializer.SerializedMode;

import java.io.Serializable;

/**
 * 发送给远端Worker的执行命令
 *
 * @author hanhan.zhang
 * */
public class Command implements Serializable {

    private final SerializedMode inputMode;
    private final SerializedMode outputMode;
    private final WorkerFunction workerFunction;

    public Command(SerializedMode inputMode, SerializedMode outputMode, WorkerFunction workerFunction) {
        this.inputMode = inputMode;
        this.outputMode = outputMode;
        this.workerFunction = workerFunction;
    }

    public SerializedMode getInputMode() {
        return inputMode;
    }

    public SerializedMode getOutputMode() {
        return outputMode;
    }

    public WorkerFunction getWorkerFunction() {
        return workerFunction;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("inputMode", inputMode)
                .add("outputMode", outputMode)
                .toString();
    }
}
