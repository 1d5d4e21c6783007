package com.sdu.sparkbridge.storage;

/**
 * RDD/DStream持久化级别, 由宿主引擎解释
 *
 * @author hanhan.zhang
 * */
public enum StorageLevelType {

    NONE(false, false, false, false, 1),
    DISK_ONLY(true, false, false, false, 1),
    DISK_ONLY_2(true, false, false, false, 2),
    MEMORY_ONLY(false, true, false, true, 1),
    MEMORY_ONLY_2(false, true, false, true, 2),
    MEMORY_ONLY_SER(false, true, false, false, 1),
    MEMORY_ONLY_SER_2(false, true, false, false, 2),
    MEMORY_AND_DISK(true, true, false, true, 1),
    MEMORY_AND_DISK_2(true, true, false, true, 2),
    MEMORY_AND_DISK_SER(true, true, false, false, 1),
    MEMORY_AND_DISK_SER_2(true, true, false, false, 2),
    OFF_HEAP(true, true, true, false, 1);

    /** 是否允许写入磁盘 */
    private final boolean useDisk;
    /** 是否使用堆内存 */
    private final boolean useMemory;
    /** 是否使用堆外内存 */
    private final boolean useOffHeap;
    /** 是否以反序列化形式存储 */
    private final boolean deserialized;
    private final int replication;

    StorageLevelType(boolean useDisk, boolean useMemory, boolean useOffHeap, boolean deserialized, int replication) {
        this.useDisk = useDisk;
        this.useMemory = useMemory;
        this.useOffHeap = useOffHeap;
        this.deserialized = deserialized;
        this.replication = replication;
    }

    public boolean isUseDisk() {
        return useDisk;
    }

    public boolean isUseMemory() {
        return useMemory;
    }

    public boolean isUseOffHeap() {
        return useOffHeap;
    }

    public boolean isDeserialized() {
        return deserialized;
    }

    public int getReplication() {
        return replication;
    }

    public boolean isValid() {
        return (useMemory || useDisk) && replication > 0;
    }
}
