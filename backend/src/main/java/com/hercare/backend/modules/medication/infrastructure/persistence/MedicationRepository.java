package com.hercare.backend.modules.medication.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.hercare.backend.modules.medication.domain.Medication;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface MedicationRepository extends JpaRepository<Medication, UUID> {

    @Query("""
            select m
              from Medication m
             where m.patientId = :patientId
               and (:includeInactive = true or m.active = true)
             order by m.createdAt desc
            """)
    List<Medication> findByPatientId(@Param("patientId") UUID patientId,
                                     @Param("includeInactive") boolean includeInactive);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update Medication m
               set m.patientId = :realPatientId,
                   m.updatedAt = :now
             where m.patientId = :shadowPatientId
            """)
    int reassignPatient(@Param("shadowPatientId") UUID shadowPatientId,
                        @Param("realPatientId") UUID realPatientId,
                        @Param("now") OffsetDateTime now);
}
