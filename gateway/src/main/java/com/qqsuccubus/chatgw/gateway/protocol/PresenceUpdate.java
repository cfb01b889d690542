package com.qqsuccubus.chatgw.gateway.protocol;

import lombok.Value;

@Value
public class PresenceUpdate {
    String chatId;
    /**
     * available, unavailable, composing, recording, paused
     */
    String presence;
}
