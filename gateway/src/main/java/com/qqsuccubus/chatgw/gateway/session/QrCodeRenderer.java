package com.qqsuccubus.chatgw.gateway.session;

import com.google.zxing.BarcodeFormat;
import com.google.zxing.EncodeHintType;
import com.google.zxing.WriterException;
import com.google.zxing.client.j2se.MatrixToImageWriter;
import com.google.zxing.common.BitMatrix;
import com.google.zxing.qrcode.QRCodeWriter;
import com.google.zxing.qrcode.decoder.ErrorCorrectionLevel;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.EnumMap;
import java.util.Map;

/**
 * Renders pairing payloads as PNG data URLs with ZXing.
 */
public class QrCodeRenderer implements IQrCodeRenderer {
    static final String DATA_URL_PREFIX = "data:image/png;base64,";

    private static final int SIZE_PX = 256;
    private static final int MARGIN = 4;

    @Override
    public String render(String payload) {
        if (payload == null || payload.isEmpty()) {
            throw new QrRenderException("Empty QR payload");
        }

        Map<EncodeHintType, Object> hints = new EnumMap<>(EncodeHintType.class);
        hints.put(EncodeHintType.ERROR_CORRECTION, ErrorCorrectionLevel.H);
        hints.put(EncodeHintType.MARGIN, MARGIN);
        hints.put(EncodeHintType.CHARACTER_SET, StandardCharsets.UTF_8.name());

        try {
            BitMatrix matrix = new QRCodeWriter().encode(payload, BarcodeFormat.QR_CODE, SIZE_PX, SIZE_PX, hints);
            ByteArrayOutputStream png = new ByteArrayOutputStream();
            MatrixToImageWriter.writeToStream(matrix, "PNG", png);
            return DATA_URL_PREFIX + Base64.getEncoder().encodeToString(png.toByteArray());
        } catch (WriterException | IOException | IllegalArgumentException e) {
            throw new QrRenderException("Failed to render QR code: " + e.getMessage(), e);
        }
    }
}
