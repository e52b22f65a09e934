package com.schoolerp.backend.modules.onboarding.presentation.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

public record ResolveUserRequest(
        @NotNull @Pattern(regexp = "(?i)approve|reject", message = "must be approve or reject") String action
) {
}
