package com.sdu.sparkbridge.worker;

import com.sdu.sparkbridge.JobExecutionException;
import com.sdu.sparkbridge.SparkException;
import com.sdu.sparkbridge.rdd.WorkerFunction;
import com.sdu.sparkbridge.serializer.ElementCodec;
import com.sdu.sparkbridge.serializer.JavaSerializer;
import com.sdu.sparkbridge.serializer.SerializerInstance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;

/**
 * 远端分区执行: 解码Command, 按输入模式解码元素, 执行WorkerFunction, 按输出模式编码结果
 *
 * Note:
 *
 *  解码, 计算, 编码均在遍历结果时进行; 用户函数异常转换为{@link JobExecutionException}并携带WorkerFunction创建调用栈
 *
 * @author hanhan.zhang
 * */
public class Worker {

    private static final Logger LOGGER = LoggerFactory.getLogger(Worker.class);

    public static Iterator<byte[]> run(byte[] commandBytes, int splitIndex, Iterator<byte[]> input) {
        SerializerInstance serializer = new JavaSerializer().newInstance();
        Command command = serializer.fromBytes(commandBytes);
        LOGGER.debug("Running {} on partition {}", command, splitIndex);

        WorkerFunction workerFunction = command.getWorkerFunction();
        ElementCodec codec = new ElementCodec(serializer);

        Iterator<byte[]> output;
        try {
            Iterator<Object> elements = codec.decode(command.getInputMode(), input);
            output = codec.encode(command.getOutputMode(), workerFunction.apply(splitIndex, elements));
        } catch (JobExecutionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw failure(splitIndex, workerFunction, e);
        }
        return new FailureTrackingIterator(output, splitIndex, workerFunction);
    }

    private static JobExecutionException failure(int splitIndex, WorkerFunction workerFunction, RuntimeException cause) {
        LOGGER.error("Worker function failed on partition {}", splitIndex, cause);
        String message = cause instanceof SparkException ? cause.getMessage() : cause.toString();
        return new JobExecutionException(String.format("Worker function failed on partition %d: %s", splitIndex, message),
                workerFunction.getStackTrace(), cause);
    }

    private static class FailureTrackingIterator implements Iterator<byte[]> {

        private final Iterator<byte[]> delegate;
        private final int splitIndex;
        private final WorkerFunction workerFunction;

        FailureTrackingIterator(Iterator<byte[]> delegate, int splitIndex, WorkerFunction workerFunction) {
            this.delegate = delegate;
            this.splitIndex = splitIndex;
            this.workerFunction = workerFunction;
        }

        @Override
        public boolean hasNext() {
            try {
                return delegate.hasNext();
            } catch (JobExecutionException e) {
                throw e;
            } catch (RuntimeException e) {
                throw failure(splitIndex, workerFunction, e);
            }
        }

        @Override
        public byte[] next() {
            try {
                return delegate.next();
            } catch (JobExecutionException e) {
                throw e;
            } catch (RuntimeException e) {
                throw failure(splitIndex, workerFunction, e);
            }
        }
    }
}
