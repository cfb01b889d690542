package com.qqsuccubus.chatgw.gateway.protocol;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Content to send. The protocol client maps {@code type} and {@code fields} to wire content.
 */
@Value
@Builder
public class OutboundContent {
    String to;
    String type;
    @Singular
    Map<String, Object> fields;

    public static OutboundContent text(String to, String text) {
        return OutboundContent.builder().to(to).type("text").field("text", text).build();
    }
}
