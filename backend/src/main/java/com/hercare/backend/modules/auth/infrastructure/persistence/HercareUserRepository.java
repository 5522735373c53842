package com.hercare.backend.modules.auth.infrastructure.persistence;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.hercare.backend.modules.auth.domain.HercareUser;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface HercareUserRepository extends JpaRepository<HercareUser, UUID> {

    @Query("select u from HercareUser u where lower(u.email) = lower(:email)")
    Optional<HercareUser> findByEmailIgnoreCase(@Param("email") String email);

    @Query("""
            select case when count(u) > 0 then true else false end
              from HercareUser u
             where lower(u.email) = lower(:email)
            """)
    boolean existsByEmailIgnoreCase(@Param("email") String email);

    @Query("""
            select u
              from HercareUser u
             where u.id in :ids
            """)
    List<HercareUser> findByIds(@Param("ids") Collection<UUID> ids);
}
