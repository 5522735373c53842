package com.hercare.backend.modules.healthlog.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.hercare.backend.modules.healthlog.domain.HealthLog;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface HealthLogRepository extends JpaRepository<HealthLog, UUID> {

    @Query("""
            select h
              from HealthLog h
             where h.patientId = :patientId
             order by h.logDate desc, h.createdAt desc
            """)
    List<HealthLog> findByPatientId(@Param("patientId") UUID patientId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update HealthLog h
               set h.patientId = :realPatientId,
                   h.updatedAt = :now
             where h.patientId = :shadowPatientId
            """)
    int reassignPatient(@Param("shadowPatientId") UUID shadowPatientId,
                        @Param("realPatientId") UUID realPatientId,
                        @Param("now") OffsetDateTime now);
}
