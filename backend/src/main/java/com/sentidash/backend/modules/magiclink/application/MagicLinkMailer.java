package com.sentidash.backend.modules.magiclink.application;

import java.time.OffsetDateTime;

/**
 * 매직 링크 전달 협력자. 실패나 타임아웃은 {@link MagicLinkDeliveryException} 으로 알린다.
 */
public interface MagicLinkMailer {

    void send(String email, String link, OffsetDateTime expiresAt);
}
