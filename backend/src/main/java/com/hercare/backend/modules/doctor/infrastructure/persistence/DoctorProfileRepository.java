package com.hercare.backend.modules.doctor.infrastructure.persistence;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.hercare.backend.modules.doctor.domain.DoctorProfile;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface DoctorProfileRepository extends JpaRepository<DoctorProfile, UUID> {

    Optional<DoctorProfile> findByUserId(UUID userId);

    Optional<DoctorProfile> findByInviteCode(String inviteCode);

    boolean existsByUserId(UUID userId);

    boolean existsByInviteCode(String inviteCode);

    @Query("""
            select dp
              from DoctorProfile dp
             where dp.userId in :userIds
            """)
    List<DoctorProfile> findByUserIds(@Param("userIds") Collection<UUID> userIds);
}
