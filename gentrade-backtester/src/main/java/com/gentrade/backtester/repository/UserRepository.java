package com.gentrade.backtester.repository;

import com.gentrade.backtester.domain.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for platform users.
 */
@Repository
public interface UserRepository extends JpaRepository<User, Long> {

    /**
     * Resolve a user from the identity provider's principal id.
     *
     * @param clerkId the external principal id
     * @return Optional containing the user if registered
     */
    Optional<User> findByClerkId(String clerkId);
}
