package com.ddosshield.flink;

import com.ddosshield.core.model.FlowEvent;
import com.ddosshield.core.model.IdentityGranularity;
import org.apache.flink.api.java.functions.KeySelector;

import java.util.Objects;

/**
 * Keys flow events by the canonical form of their source identity at the
 * configured granularity, e.g. {@code 203.0.113.7/UDP}.
 */
public class IdentityKeySelector implements KeySelector<FlowEvent, String> {

    private static final long serialVersionUID = 1L;

    private final IdentityGranularity granularity;

    public IdentityKeySelector(IdentityGranularity granularity) {
        this.granularity = Objects.requireNonNull(granularity, "granularity must not be null");
    }

    @Override
    public String getKey(FlowEvent event) {
        return event.identity(granularity).key();
    }
}
