package com.schoolerp.backend.modules.onboarding.presentation;

import java.util.List;
import java.util.UUID;

import com.schoolerp.backend.global.security.JwtAuthenticationPrincipal;
import com.schoolerp.backend.modules.onboarding.application.OnboardingWorkflow;
import com.schoolerp.backend.modules.onboarding.domain.OnboardingDecision;
import com.schoolerp.backend.modules.onboarding.presentation.dto.JoinSchoolRequest;
import com.schoolerp.backend.modules.onboarding.presentation.dto.JoinSchoolResponse;
import com.schoolerp.backend.modules.onboarding.presentation.dto.OnboardingUserResponse;
import com.schoolerp.backend.modules.onboarding.presentation.dto.ResolveUserRequest;
import com.schoolerp.backend.modules.user.domain.SchoolUser;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/onboarding")
public class OnboardingController {

    private final OnboardingWorkflow onboardingWorkflow;

    public OnboardingController(OnboardingWorkflow onboardingWorkflow) {
        this.onboardingWorkflow = onboardingWorkflow;
    }

    @Operation(summary = "Join a school with a join code", description = "Creates a staff account awaiting admin approval.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Pending account created"),
            @ApiResponse(responseCode = "400", description = "Invalid or expired join code"),
            @ApiResponse(responseCode = "409", description = "Email already registered")
    })
    @PostMapping("/join")
    public ResponseEntity<JoinSchoolResponse> join(@Valid @RequestBody JoinSchoolRequest request) {
        SchoolUser pending = onboardingWorkflow.submitJoinRequest(
                request.joinCode(),
                request.name(),
                request.email(),
                request.password()
        );
        JoinSchoolResponse response = new JoinSchoolResponse(
                JoinSchoolResponse.PENDING_MESSAGE,
                pending.getId(),
                pending.getStatus().name()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @Operation(summary = "List staff awaiting approval", description = "Pending staff of the school, oldest join first.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Pending staff, possibly none"),
            @ApiResponse(responseCode = "401", description = "Missing or invalid bearer token"),
            @ApiResponse(responseCode = "403", description = "Caller is not an admin of this school")
    })
    @GetMapping("/schools/{schoolId}/pending")
    public ResponseEntity<List<OnboardingUserResponse>> listPending(
            @PathVariable("schoolId") UUID schoolId,
            @AuthenticationPrincipal JwtAuthenticationPrincipal admin
    ) {
        List<OnboardingUserResponse> pending = onboardingWorkflow
                .listPending(schoolId, admin)
                .stream()
                .map(OnboardingUserResponse::from)
                .toList();
        return ResponseEntity.ok(pending);
    }

    @Operation(summary = "Approve or reject a pending user")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Decision applied"),
            @ApiResponse(responseCode = "403", description = "User belongs to another school"),
            @ApiResponse(responseCode = "404", description = "User not found"),
            @ApiResponse(responseCode = "409", description = "User already approved or rejected")
    })
    @PutMapping("/users/{userId}/decision")
    public ResponseEntity<OnboardingUserResponse> resolve(
            @PathVariable("userId") UUID userId,
            @Valid @RequestBody ResolveUserRequest request,
            @AuthenticationPrincipal JwtAuthenticationPrincipal admin
    ) {
        SchoolUser resolved = onboardingWorkflow.resolve(
                userId,
                admin,
                OnboardingDecision.fromValue(request.action())
        );
        return ResponseEntity.ok(OnboardingUserResponse.from(resolved));
    }
}
