package com.pocketledger.repository;

import com.pocketledger.domain.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository interface for User entity.
 *
 * Email is the natural business key: it is the login name, the JWT subject
 * and the uniqueness check at registration. Lookup is case-sensitive;
 * UserService normalizes addresses to lower case before calling in.
 */
@Repository
public interface UserRepository extends JpaRepository<User, Long> {

    Optional<User> findByEmail(String email);

    boolean existsByEmail(String email);
}
