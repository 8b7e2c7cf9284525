package com.sentidash.backend.modules.magiclink.infrastructure.mail;

import com.sentidash.backend.modules.magiclink.application.MagicLinkMailer;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

@Configuration
public class MagicLinkMailerConfig {

    @Bean
    @ConditionalOnProperty(prefix = "auth.mailer", name = "endpoint")
    public MagicLinkMailer httpMagicLinkMailer(
            RestTemplate externalRestTemplate,
            @Value("${auth.mailer.endpoint}") String endpoint,
            @Value("${auth.mailer.api-key:}") String apiKey
    ) {
        return new HttpMagicLinkMailer(externalRestTemplate, endpoint, apiKey);
    }

    @Bean
    @ConditionalOnMissingBean(MagicLinkMailer.class)
    public MagicLinkMailer loggingMagicLinkMailer(@Value("${auth.mailer.log-links:false}") boolean logLinks) {
        return new LoggingMagicLinkMailer(logLinks);
    }
}
