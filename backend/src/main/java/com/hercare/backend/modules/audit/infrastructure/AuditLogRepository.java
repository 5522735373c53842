package com.hercare.backend.modules.audit.infrastructure;

import java.util.List;
import java.util.UUID;

import com.hercare.backend.modules.audit.domain.AuditLog;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AuditLogRepository extends JpaRepository<AuditLog, UUID> {

    @Query("""
            select a
              from AuditLog a
             where a.actionType = :actionType
             order by a.createdAt desc
            """)
    List<AuditLog> findByActionType(@Param("actionType") String actionType);
}
