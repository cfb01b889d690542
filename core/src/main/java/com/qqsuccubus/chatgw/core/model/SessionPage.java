package com.qqsuccubus.chatgw.core.model;

import lombok.Value;

import java.util.List;

@Value
public class SessionPage {
    List<SessionRecord> sessions;
    long total;
    int page;
    int limit;
}
