package com.qqsuccubus.chatgw.gateway.protocol;

import lombok.Value;

@Value
public class ConnectedUser {
    /**
     * Platform address, e.g. {@code 5511999990000:12@s.whatsapp.net}.
     */
    String id;
    String name;

    /**
     * Phone number part of the address: everything before {@code ':'} or {@code '@'}.
     */
    public String phoneNumber() {
        if (id == null) {
            return null;
        }
        int end = id.length();
        int colon = id.indexOf(':');
        int at = id.indexOf('@');
        if (colon >= 0) {
            end = colon;
        } else if (at >= 0) {
            end = at;
        }
        return id.substring(0, end);
    }
}
