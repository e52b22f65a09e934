package com.schoolerp.backend.modules.school.presentation;

import java.util.UUID;

import com.schoolerp.backend.global.security.JwtAuthenticationPrincipal;
import com.schoolerp.backend.modules.school.application.SchoolRegistrationService;
import com.schoolerp.backend.modules.school.application.SchoolRegistrationService.RegisteredSchool;
import com.schoolerp.backend.modules.school.domain.JoinCode;
import com.schoolerp.backend.modules.school.presentation.dto.JoinCodeResponse;
import com.schoolerp.backend.modules.school.presentation.dto.RegisterSchoolRequest;
import com.schoolerp.backend.modules.school.presentation.dto.SchoolRegistrationResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/schools")
public class SchoolController {

    private final SchoolRegistrationService schoolRegistrationService;

    public SchoolController(SchoolRegistrationService schoolRegistrationService) {
        this.schoolRegistrationService = schoolRegistrationService;
    }

    @Operation(summary = "Register a school", description = "Creates the school, its first admin and its first join code.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "School registered"),
            @ApiResponse(responseCode = "409", description = "School name or admin email already in use")
    })
    @PostMapping
    public ResponseEntity<SchoolRegistrationResponse> register(@Valid @RequestBody RegisterSchoolRequest request) {
        RegisteredSchool registered = schoolRegistrationService.register(
                request.schoolName(),
                request.admin().name(),
                request.admin().email(),
                request.admin().password()
        );
        SchoolRegistrationResponse response = new SchoolRegistrationResponse(
                registered.schoolId(),
                registered.name(),
                registered.abbreviation(),
                registered.adminUserId(),
                registered.joinCode(),
                registered.codeExpiresAt()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @Operation(summary = "Regenerate the join code", description = "Replaces the school's join code; the previous one stops working at once.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "New code issued"),
            @ApiResponse(responseCode = "403", description = "Caller is not an admin of this school"),
            @ApiResponse(responseCode = "404", description = "School not found"),
            @ApiResponse(responseCode = "503", description = "No free code found, retry after the Retry-After delay")
    })
    @PostMapping("/{schoolId}/regenerate-code")
    public ResponseEntity<JoinCodeResponse> regenerateCode(
            @PathVariable("schoolId") UUID schoolId,
            @AuthenticationPrincipal JwtAuthenticationPrincipal admin
    ) {
        JoinCode joinCode = schoolRegistrationService.regenerateCode(schoolId, admin);
        return ResponseEntity.ok(new JoinCodeResponse(joinCode.code(), joinCode.issuedAt(), joinCode.expiresAt()));
    }
}
