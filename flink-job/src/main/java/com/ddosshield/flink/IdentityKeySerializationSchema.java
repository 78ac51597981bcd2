package com.ddosshield.flink;

import com.ddosshield.core.model.ShieldEvent;
import org.apache.flink.api.common.serialization.SerializationSchema;

import java.nio.charset.StandardCharsets;

/**
 * Kafka record key for outbound actions and alerts: the UTF-8 canonical
 * source identity, so one source's records land in one partition in order.
 *
 * @param <T> action or alert
 */
public class IdentityKeySerializationSchema<T extends ShieldEvent> implements SerializationSchema<T> {

    private static final long serialVersionUID = 1L;

    @Override
    public byte[] serialize(T element) {
        return element.getSourceIdentity().key().getBytes(StandardCharsets.UTF_8);
    }
}
