package com.userservice.user.service;

import com.userservice.exception.ConflictException;
import com.userservice.exception.DatabaseException;
import com.userservice.exception.NotFoundException;
import com.userservice.user.domain.User;
import com.userservice.user.dto.UserCreateRequest;
import com.userservice.user.dto.UserUpdateRequest;
import com.userservice.user.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * User domain service handling user-related business logic.
 *
 * Email uniqueness is checked before every insert or email change, but the
 * check and the write are not atomic. The {@code uk_users_email} constraint is
 * the authoritative guard: a violation raised while flushing is reported as the
 * same conflict the pre-check would have produced.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class UserService {

    public static final String RESOURCE_NAME = "user";
    public static final String EMAIL_CONFLICT_MESSAGE = "email already exists";

    static final String EMAIL_CONSTRAINT = "uk_users_email";

    private final UserRepository userRepository;

    /**
     * Finds user by ID, throws exception if not found.
     */
    public User findById(UUID id) {
        return userRepository.findById(id)
                .orElseThrow(() -> new NotFoundException(RESOURCE_NAME));
    }

    /**
     * Finds user by email, returns Optional.
     */
    public Optional<User> findByEmail(String email) {
        return userRepository.findByEmail(email);
    }

    @Transactional
    public User createUser(UserCreateRequest request) {
        if (findByEmail(request.getEmail()).isPresent()) {
            throw new ConflictException(EMAIL_CONFLICT_MESSAGE);
        }

        User newUser = User.builder()
                .email(request.getEmail())
                .name(request.getName())
                .build();
        User saved = saveAndFlush(newUser);
        log.info("Created user {}", saved.getId());
        return saved;
    }

    /**
     * Applies the fields present in {@code request}; absent fields keep their
     * stored value. {@code updatedAt} is refreshed even when nothing changed.
     */
    @Transactional
    public User updateUser(UUID id, UserUpdateRequest request) {
        User user = findById(id);

        request.getEmail().ifPresent(email -> {
            requireEmailAvailable(email, id);
            user.changeEmail(email);
        });
        request.getName().ifPresent(user::changeName);
        user.touch();

        User saved = saveAndFlush(user);
        log.info("Updated user {}", id);
        return saved;
    }

    @Transactional
    public void deleteUser(UUID id) {
        if (userRepository.deleteUserById(id) == 0) {
            throw new NotFoundException(RESOURCE_NAME);
        }
        log.info("Deleted user {}", id);
    }

    private void requireEmailAvailable(String email, UUID userId) {
        findByEmail(email)
                .filter(existing -> !existing.getId().equals(userId))
                .ifPresent(existing -> {
                    throw new ConflictException(EMAIL_CONFLICT_MESSAGE);
                });
    }

    private User saveAndFlush(User user) {
        try {
            return userRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException ex) {
            if (isEmailConstraintViolation(ex)) {
                log.warn("Email uniqueness rejected by storage for user {}", user.getId());
                throw new ConflictException(EMAIL_CONFLICT_MESSAGE);
            }
            throw new DatabaseException(ex);
        }
    }

    static boolean isEmailConstraintViolation(DataIntegrityViolationException ex) {
        String detail = ex.getMessage() + " " + ex.getMostSpecificCause().getMessage();
        return detail.toLowerCase(Locale.ROOT).contains(EMAIL_CONSTRAINT);
    }
}
