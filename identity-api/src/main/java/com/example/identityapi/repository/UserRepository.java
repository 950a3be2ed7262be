package com.example.identityapi.repository;

import com.example.identityapi.dto.UserCreationStat;
import com.example.identityapi.entity.AccountStatus;
import com.example.identityapi.entity.User;
import jakarta.persistence.QueryHint;
import org.hibernate.jpa.HibernateHints;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for User entity.
 */
@Repository
public interface UserRepository extends JpaRepository<User, String> {

    /**
     * Find user by user name (for login).
     */
    Optional<User> findByUserName(String userName);

    boolean existsByUserName(String userName);

    boolean existsByEmail(String email);

    /**
     * Uniqueness checks on update, excluding the user being updated.
     * The pending changes of that user must not be flushed by the check itself.
     */
    @QueryHints(@QueryHint(name = HibernateHints.HINT_FLUSH_MODE, value = "COMMIT"))
    boolean existsByUserNameAndIdNot(String userName, String id);

    @QueryHints(@QueryHint(name = HibernateHints.HINT_FLUSH_MODE, value = "COMMIT"))
    boolean existsByEmailAndIdNot(String email, String id);

    /**
     * Paginated user listing with optional account status filter.
     */
    @Query("SELECT u FROM User u WHERE (:status IS NULL OR u.accountStatus = :status)")
    Page<User> findAllWithStatus(@Param("status") AccountStatus status, Pageable pageable);

    long countByAccountStatus(AccountStatus accountStatus);

    /**
     * Number of accounts created per calendar day, oldest day first.
     */
    @Query("SELECT new com.example.identityapi.dto.UserCreationStat(CAST(u.createdAt AS LocalDate), COUNT(u)) "
            + "FROM User u GROUP BY CAST(u.createdAt AS LocalDate) ORDER BY CAST(u.createdAt AS LocalDate)")
    List<UserCreationStat> countCreatedPerDay();
}
