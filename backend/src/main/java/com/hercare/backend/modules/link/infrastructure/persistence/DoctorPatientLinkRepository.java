package com.hercare.backend.modules.link.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.hercare.backend.modules.link.domain.DoctorPatientLink;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface DoctorPatientLinkRepository extends JpaRepository<DoctorPatientLink, UUID> {

    Optional<DoctorPatientLink> findByDoctorIdAndPatientId(UUID doctorId, UUID patientId);

    boolean existsByDoctorIdAndPatientId(UUID doctorId, UUID patientId);

    boolean existsByShareCode(String shareCode);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select l from DoctorPatientLink l where l.shareCode = :shareCode")
    Optional<DoctorPatientLink> findByShareCodeForUpdate(@Param("shareCode") String shareCode);

    @Query("""
            select l
              from DoctorPatientLink l
             where l.patientId = :patientId
             order by l.createdAt asc
            """)
    List<DoctorPatientLink> findByPatientId(@Param("patientId") UUID patientId);

    @Query("""
            select l
              from DoctorPatientLink l
             where l.doctorId = :doctorId
             order by l.createdAt asc
            """)
    List<DoctorPatientLink> findByDoctorId(@Param("doctorId") UUID doctorId);
}
