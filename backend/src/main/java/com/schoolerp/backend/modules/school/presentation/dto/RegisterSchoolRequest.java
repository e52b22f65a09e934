package com.schoolerp.backend.modules.school.presentation.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record RegisterSchoolRequest(
        @NotBlank @Size(max = 255) String schoolName,
        @NotNull @Valid AdminAccountRequest admin
) {
}
