package com.hercare.backend.modules.dietplan.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.hercare.backend.modules.dietplan.domain.DietPlan;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface DietPlanRepository extends JpaRepository<DietPlan, UUID> {

    @Query("""
            select d
              from DietPlan d
             where d.patientId = :patientId
             order by d.createdAt asc
            """)
    List<DietPlan> findByPatientId(@Param("patientId") UUID patientId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update DietPlan d
               set d.patientId = :realPatientId,
                   d.updatedAt = :now
             where d.patientId = :shadowPatientId
            """)
    int reassignPatient(@Param("shadowPatientId") UUID shadowPatientId,
                        @Param("realPatientId") UUID realPatientId,
                        @Param("now") OffsetDateTime now);
}
