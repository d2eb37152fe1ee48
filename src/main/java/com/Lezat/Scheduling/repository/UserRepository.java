package com.Lezat.Scheduling.repository;

import com.Lezat.Scheduling.model.User;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface UserRepository extends JpaRepository<User, Integer> {
    Optional<User> findByClientReferenceId(String clientReferenceId);

    boolean existsByClientReferenceId(String clientReferenceId);
}
