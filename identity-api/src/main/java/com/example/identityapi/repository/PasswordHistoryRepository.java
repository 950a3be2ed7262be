package com.example.identityapi.repository;

import com.example.identityapi.entity.PasswordHistory;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for PasswordHistory entity.
 */
@Repository
public interface PasswordHistoryRepository extends JpaRepository<PasswordHistory, Long> {

    /**
     * History rows of a user, newest first. Equal timestamps are ordered by id.
     */
    List<PasswordHistory> findByUserIdOrderByCreatedDateDescIdDesc(String userId);

    @Query("SELECT p.passwordHash FROM PasswordHistory p WHERE p.userId = :userId")
    List<String> findPasswordHashesByUserId(@Param("userId") String userId);

    long countByUserId(String userId);

    /**
     * Remove every history row of a user.
     * Used when the user account is deleted.
     *
     * @return number of deleted rows
     */
    @Modifying
    @Query("DELETE FROM PasswordHistory p WHERE p.userId = :userId")
    int deleteAllByUserId(@Param("userId") String userId);
}
