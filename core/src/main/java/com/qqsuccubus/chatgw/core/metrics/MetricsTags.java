package com.qqsuccubus.chatgw.core.metrics;

public final class MetricsTags {
    private MetricsTags() {
    }

    public static final String NODE_ID = "nodeId";
    public static final String STATUS = "status";
    public static final String TOPIC = "topic";
    public static final String RESULT = "result";
}
