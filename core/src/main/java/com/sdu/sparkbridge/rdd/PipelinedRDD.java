package com.sdu.sparkbridge.rdd;

import com.sdu.sparkbridge.Partitioner;
import com.sdu.sparkbridge.SparkContext;
import com.sdu.sparkbridge.proxy.RDDProxy;
import com.sdu.sparkbridge.serializer.SerializedMode;
import com.sdu.sparkbridge.worker.Command;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Preconditions.checkState;

/**
 * 尚未提交的流水线节点: 持有上游Stage代理与累积的WorkerFunction
 *
 * 1: 可流水线时, 后续窄依赖转换与本节点合并(WorkerFunction.chain), 复用上游Stage代理
 *
 * 2: 首次访问{@link #getRddProxy()}时向宿主引擎创建Stage, 此后本节点作为普通RDD参与后续计算
 *
 * Note:
 *
 *  cache/checkpoint后节点不再可流水线, 下游转换以本节点Stage为起点
 *
 * @author hanhan.zhang
 * */
public class PipelinedRDD<T> extends RDD<T> {

    private static final Logger LOGGER = LoggerFactory.getLogger(PipelinedRDD.class);

    private final WorkerFunction workerFunction;

    private final boolean preservesPartitioning;

    private final RDDProxy prevRddProxy;

    private final SerializedMode prevSerializedMode;

    PipelinedRDD(SparkContext sparkContext, RDDProxy prevRddProxy, SerializedMode prevSerializedMode,
                 WorkerFunction workerFunction, boolean preservesPartitioning, Partitioner partitioner) {
        super(null, sparkContext, SerializedMode.Byte);
        this.prevRddProxy = prevRddProxy;
        this.prevSerializedMode = prevSerializedMode;
        this.workerFunction = workerFunction;
        this.preservesPartitioning = preservesPartitioning;
        this.partitioner = partitioner;
    }

    @Override
    public boolean isPipelinable() {
        return !(cached || checkpointed);
    }

    public WorkerFunction getWorkerFunction() {
        return workerFunction;
    }

    public RDDProxy getPrevRddProxy() {
        return prevRddProxy;
    }

    public SerializedMode getPrevSerializedMode() {
        return prevSerializedMode;
    }

    /**
     * 输出元素为byte[]原样写出
     * */
    public PipelinedRDD<T> bypassSerializer() {
        return setOutputMode(SerializedMode.None);
    }

    PipelinedRDD<T> setOutputMode(SerializedMode outputMode) {
        checkState(rddProxy == null, "Output mode must be set before the stage is created");
        this.serializedMode = outputMode;
        return this;
    }

    @Override
    public RDDProxy getRddProxy() {
        if (rddProxy == null) {
            Command command = new Command(prevSerializedMode, serializedMode, workerFunction);
            byte[] commandBytes = sparkContext.serializerInstance().toBytes(command);
            rddProxy = sparkContext.getSparkContextProxy().createPipelinedRDD(prevRddProxy, commandBytes, preservesPartitioning);
            LOGGER.debug("Create pipelined stage, input mode: {}, output mode: {}, command size: {} bytes",
                    prevSerializedMode, serializedMode, commandBytes.length);
        }
        return rddProxy;
    }

    @Override
    <U> PipelinedRDD<U> mapPartitionsWithIndex(WorkerFunction newWorkerFunction, boolean preservesPartitioning) {
        if (!isPipelinable()) {
            return super.mapPartitionsWithIndex(newWorkerFunction, preservesPartitioning);
        }
        LOGGER.debug("Fuse transformation into pipelined stage");
        return new PipelinedRDD<>(sparkContext, prevRddProxy, prevSerializedMode,
                WorkerFunction.chain(workerFunction, newWorkerFunction),
                this.preservesPartitioning && preservesPartitioning,
                preservesPartitioning ? partitioner : null);
    }
}
