package com.hercare.backend.modules.doctor.presentation.dto;

import java.util.UUID;

import com.hercare.backend.modules.doctor.domain.DoctorProfile;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record DoctorProfileResponse(
        UUID id,
        UUID userId,
        String name,
        String specialization,
        String hospital,
        Integer experienceYears,
        boolean available,
        String inviteCode
) {
    public static DoctorProfileResponse of(DoctorProfile profile, String name, boolean includeInviteCode) {
        return new DoctorProfileResponse(
                profile.getId(),
                profile.getUserId(),
                name,
                profile.getSpecialization(),
                profile.getHospital(),
                profile.getExperienceYears(),
                profile.isAvailable(),
                includeInviteCode ? profile.getInviteCode() : null
        );
    }
}
