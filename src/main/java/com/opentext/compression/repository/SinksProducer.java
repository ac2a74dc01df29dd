package com.opentext.compression.repository;

import com.opentext.compression.model.CodecId;

import java.io.IOException;
import java.util.Map;

/**
 * Streams one payload per codec into the given staging sinks and returns whatever the caller
 * wants to carry out of the write (typically the compression result).
 */
@FunctionalInterface
public interface SinksProducer<T> {
    T produce(Map<CodecId, StagingSink> sinks) throws IOException;
}
