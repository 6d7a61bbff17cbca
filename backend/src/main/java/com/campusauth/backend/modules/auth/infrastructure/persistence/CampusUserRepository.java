package com.campusauth.backend.modules.auth.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.campusauth.backend.modules.auth.domain.CampusUser;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface CampusUserRepository extends JpaRepository<CampusUser, UUID> {

    Optional<CampusUser> findByLogin(String login);

    boolean existsByLogin(String login);

    boolean existsByLoginAndIdNot(String login, UUID id);

    @Query(value = """
            select * from app_user
             order by created_at, id
             limit :limit offset :offset
            """, nativeQuery = true)
    List<CampusUser> findSlice(@Param("offset") int offset, @Param("limit") int limit);
}
