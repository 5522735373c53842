package com.hercare.backend.modules.history.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.hercare.backend.modules.history.domain.MedicalHistory;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface MedicalHistoryRepository extends JpaRepository<MedicalHistory, UUID> {

    Optional<MedicalHistory> findByPatientId(UUID patientId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update MedicalHistory h
               set h.patientId = :realPatientId,
                   h.updatedAt = :now
             where h.patientId = :shadowPatientId
            """)
    int reassignPatient(@Param("shadowPatientId") UUID shadowPatientId,
                        @Param("realPatientId") UUID realPatientId,
                        @Param("now") OffsetDateTime now);
}
