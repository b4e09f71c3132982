package com.userservice.user.repository;

import com.userservice.user.domain.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;
import java.util.UUID;

public interface UserRepository extends JpaRepository<User, UUID> {

    Optional<User> findByEmail(String email);

    /**
     * Deletes the user with the given id in a single statement.
     *
     * @param id user id
     * @return number of rows removed, 0 when no such user exists
     */
    @Modifying
    @Query("delete from User u where u.id = :id")
    int deleteUserById(@Param("id") UUID id);
}
