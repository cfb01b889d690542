package com.qqsuccubus.chatgw.gateway.session;

import com.google.zxing.BinaryBitmap;
import com.google.zxing.MultiFormatReader;
import com.google.zxing.Result;
import com.google.zxing.client.j2se.BufferedImageLuminanceSource;
import com.google.zxing.common.HybridBinarizer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.util.Base64;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QrCodeRendererTest {

    private final QrCodeRenderer renderer = new QrCodeRenderer();

    @Test
    @DisplayName("Should render a PNG data URL that decodes back to the payload")
    void testRenderDecodes() throws Exception {
        // Given
        String payload = "2@Xk3vQz,8fJd0pLm,Yw9sT1,uR7eN4==";

        // When
        String dataUrl = renderer.render(payload);

        // Then
        assertTrue(dataUrl.startsWith(QrCodeRenderer.DATA_URL_PREFIX));
        byte[] png = Base64.getDecoder().decode(dataUrl.substring(QrCodeRenderer.DATA_URL_PREFIX.length()));
        BufferedImage image = ImageIO.read(new ByteArrayInputStream(png));
        assertNotNull(image);
        assertEquals(256, image.getWidth());
        assertEquals(256, image.getHeight());

        Result decoded = new MultiFormatReader().decode(
                new BinaryBitmap(new HybridBinarizer(new BufferedImageLuminanceSource(image))));
        assertEquals(payload, decoded.getText());
    }

    @Test
    @DisplayName("Should reject an empty payload")
    void testRenderEmptyPayload() {
        assertThrows(QrRenderException.class, () -> renderer.render(""));
        assertThrows(QrRenderException.class, () -> renderer.render(null));
    }
}
