package com.sentidash.backend.modules.magiclink.infrastructure.mail;

import java.time.OffsetDateTime;

import com.sentidash.backend.global.common.LogMasking;
import com.sentidash.backend.modules.magiclink.application.MagicLinkMailer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 메일 API 가 설정되지 않은 로컬 환경용. 링크 원문은 log-links 를 켰을 때만 출력한다.
 */
public class LoggingMagicLinkMailer implements MagicLinkMailer {

    private static final Logger log = LoggerFactory.getLogger(LoggingMagicLinkMailer.class);

    private final boolean logLinks;

    public LoggingMagicLinkMailer(boolean logLinks) {
        this.logLinks = logLinks;
    }

    @Override
    public void send(String email, String link, OffsetDateTime expiresAt) {
        if (logLinks) {
            log.info("Magic link for {} (expires {}): {}", LogMasking.maskEmail(email), expiresAt, link);
        } else {
            log.info("Magic link prepared for {} (expires {})", LogMasking.maskEmail(email), expiresAt);
        }
    }
}
