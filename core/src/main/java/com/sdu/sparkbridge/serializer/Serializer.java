package com.sdu.sparkbridge.serializer;

/**
 * @author hanhan.zhang
 * */
public interface Serializer {

    SerializerInstance newInstance();

}
