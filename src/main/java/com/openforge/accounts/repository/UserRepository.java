package com.openforge.accounts.repository;

import com.openforge.accounts.domain.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface UserRepository extends JpaRepository<User, Long> {

    /** Expects an already normalised email. */
    Optional<User> findByEmail(String email);
}
