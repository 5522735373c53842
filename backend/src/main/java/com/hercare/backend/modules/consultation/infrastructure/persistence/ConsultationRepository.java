package com.hercare.backend.modules.consultation.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.hercare.backend.modules.consultation.domain.Consultation;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ConsultationRepository extends JpaRepository<Consultation, UUID> {

    @Query("""
            select c
              from Consultation c
             where c.patientId = :patientId
             order by c.visitDate desc, c.createdAt desc
            """)
    List<Consultation> findByPatientId(@Param("patientId") UUID patientId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update Consultation c
               set c.patientId = :realPatientId,
                   c.updatedAt = :now
             where c.patientId = :shadowPatientId
            """)
    int reassignPatient(@Param("shadowPatientId") UUID shadowPatientId,
                        @Param("realPatientId") UUID realPatientId,
                        @Param("now") OffsetDateTime now);
}
