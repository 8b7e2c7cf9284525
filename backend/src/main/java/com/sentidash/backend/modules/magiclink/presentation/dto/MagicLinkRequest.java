package com.sentidash.backend.modules.magiclink.presentation.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record MagicLinkRequest(
        @NotBlank(message = "email is required")
        @Email(message = "email is invalid")
        @Size(max = 320, message = "email is too long")
        String email
) {
}
