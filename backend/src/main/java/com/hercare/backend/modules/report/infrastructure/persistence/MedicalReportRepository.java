package com.hercare.backend.modules.report.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.hercare.backend.modules.report.domain.MedicalReport;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface MedicalReportRepository extends JpaRepository<MedicalReport, UUID> {

    @Query("""
            select r
              from MedicalReport r
             where r.patientId = :patientId
             order by r.createdAt desc
            """)
    List<MedicalReport> findByPatientId(@Param("patientId") UUID patientId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update MedicalReport r
               set r.patientId = :realPatientId,
                   r.updatedAt = :now
             where r.patientId = :shadowPatientId
            """)
    int reassignPatient(@Param("shadowPatientId") UUID shadowPatientId,
                        @Param("realPatientId") UUID realPatientId,
                        @Param("now") OffsetDateTime now);
}
