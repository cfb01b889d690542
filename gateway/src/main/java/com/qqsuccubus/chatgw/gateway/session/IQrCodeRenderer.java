package com.qqsuccubus.chatgw.gateway.session;

/**
 * Renders a raw pairing payload into a displayable image (Dependency Inversion Principle).
 */
public interface IQrCodeRenderer {

    /**
     * @param payload Raw pairing payload from the protocol client
     * @return Rendered image as a data URL
     * @throws QrRenderException if the payload cannot be rendered
     */
    String render(String payload);
}
