package com.qqsuccubus.chatgw.core.model;

import lombok.Value;

/**
 * QR pairing code handed to callers: the rendered code and the seconds it stays valid.
 */
@Value
public class QrCode {
    String qrcode;
    long expiresIn;
}
