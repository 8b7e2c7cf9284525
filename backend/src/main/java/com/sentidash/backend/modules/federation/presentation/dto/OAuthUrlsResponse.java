package com.sentidash.backend.modules.federation.presentation.dto;

import java.util.Map;

public record OAuthUrlsResponse(Map<String, String> providers) {
}
