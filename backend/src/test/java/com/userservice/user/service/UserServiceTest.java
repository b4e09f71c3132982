package com.userservice.user.service;

import com.userservice.exception.ApiException;
import com.userservice.exception.ConflictException;
import com.userservice.exception.DatabaseException;
import com.userservice.exception.ErrorKind;
import com.userservice.exception.NotFoundException;
import com.userservice.user.domain.User;
import com.userservice.user.dto.UserCreateRequest;
import com.userservice.user.dto.UserUpdateRequest;
import com.userservice.user.repository.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.lang.reflect.Field;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("UserService 단위 테스트")
class UserServiceTest {

    @Mock
    private UserRepository userRepository;

    @InjectMocks
    private UserService userService;

    private UUID userId;
    private User testUser;
    private Instant originalUpdatedAt;

    @BeforeEach
    void setUp() throws Exception {
        userId = UUID.randomUUID();
        originalUpdatedAt = Instant.parse("2024-01-01T00:00:00Z");
        testUser = User.builder()
                .email("test@example.com")
                .name("Test User")
                .build();
        setField(testUser, "id", userId);
        setField(testUser, "createdAt", originalUpdatedAt);
        setField(testUser, "updatedAt", originalUpdatedAt);
    }

    private void setField(Object target, String fieldName, Object value) throws Exception {
        Field field = target.getClass().getDeclaredField(fieldName);
        field.setAccessible(true);
        field.set(target, value);
    }

    @Test
    @DisplayName("ID로 User를 찾을 수 있다")
    void findById_Success() {
        // given
        when(userRepository.findById(userId)).thenReturn(Optional.of(testUser));

        // when
        User result = userService.findById(userId);

        // then
        assertThat(result).isSameAs(testUser);
        verify(userRepository, times(1)).findById(userId);
    }

    @Test
    @DisplayName("ID로 User를 찾지 못하면 NotFound 예외가 발생한다")
    void findById_NotFound() {
        // given
        UUID unknownId = UUID.randomUUID();
        when(userRepository.findById(unknownId)).thenReturn(Optional.empty());

        // when & then
        assertThatThrownBy(() -> userService.findById(unknownId))
                .isInstanceOf(NotFoundException.class)
                .hasMessage("user");
    }

    @Test
    @DisplayName("email로 User를 찾지 못하면 empty를 반환한다")
    void findByEmail_Absent() {
        // given
        when(userRepository.findByEmail("none@example.com")).thenReturn(Optional.empty());

        // when
        Optional<User> result = userService.findByEmail("none@example.com");

        // then
        assertThat(result).isEmpty();
    }

    @Test
    @DisplayName("새 User를 생성할 수 있다")
    void createUser_Success() throws Exception {
        // given
        UserCreateRequest request = UserCreateRequest.builder()
                .email("new@example.com")
                .name("New User")
                .build();
        when(userRepository.findByEmail("new@example.com")).thenReturn(Optional.empty());
        when(userRepository.saveAndFlush(any(User.class))).thenAnswer(invocation -> {
            User saved = invocation.getArgument(0);
            setField(saved, "id", UUID.randomUUID());
            return saved;
        });

        // when
        User result = userService.createUser(request);

        // then
        assertThat(result.getId()).isNotNull();
        assertThat(result.getEmail()).isEqualTo("new@example.com");
        assertThat(result.getName()).isEqualTo("New User");
        verify(userRepository, times(1)).saveAndFlush(any(User.class));
    }

    @Test
    @DisplayName("이미 존재하는 email로 생성하면 Conflict 예외가 발생하고 저장하지 않는다")
    void createUser_DuplicateEmail() {
        // given
        UserCreateRequest request = UserCreateRequest.builder()
                .email("test@example.com")
                .name("Another")
                .build();
        when(userRepository.findByEmail("test@example.com")).thenReturn(Optional.of(testUser));

        // when & then
        assertThatThrownBy(() -> userService.createUser(request))
                .isInstanceOf(ConflictException.class)
                .hasMessage("email already exists");
        verify(userRepository, never()).saveAndFlush(any());
    }

    @Test
    @DisplayName("사전 검사를 통과해도 저장소의 email 유니크 제약 위반은 Conflict로 변환된다")
    void createUser_StorageConstraintViolation() {
        // given
        UserCreateRequest request = UserCreateRequest.builder()
                .email("race@example.com")
                .name("Racer")
                .build();
        when(userRepository.findByEmail("race@example.com")).thenReturn(Optional.empty());
        when(userRepository.saveAndFlush(any(User.class))).thenThrow(new DataIntegrityViolationException(
                "could not execute statement",
                new SQLException("duplicate key value violates unique constraint \"uk_users_email\"")));

        // when & then
        assertThatThrownBy(() -> userService.createUser(request))
                .isInstanceOf(ConflictException.class)
                .hasMessage("email already exists");
    }

    @Test
    @DisplayName("email 제약이 아닌 무결성 위반은 Database 예외로 변환된다")
    void createUser_OtherIntegrityViolation() {
        // given
        UserCreateRequest request = UserCreateRequest.builder()
                .email("x@example.com")
                .name("X")
                .build();
        DataIntegrityViolationException failure = new DataIntegrityViolationException(
                "could not execute statement",
                new SQLException("null value in column \"name\" violates not-null constraint"));
        when(userRepository.findByEmail("x@example.com")).thenReturn(Optional.empty());
        when(userRepository.saveAndFlush(any(User.class))).thenThrow(failure);

        // when & then
        assertThatThrownBy(() -> userService.createUser(request))
                .isInstanceOf(DatabaseException.class)
                .hasCause(failure)
                .satisfies(ex -> assertThat(((ApiException) ex).getPublicMessage()).isEqualTo("internal error"));
    }

    @Test
    @DisplayName("name만 수정하면 email은 유지되고 updatedAt은 증가한다")
    void updateUser_NameOnly() {
        // given
        when(userRepository.findById(userId)).thenReturn(Optional.of(testUser));
        when(userRepository.saveAndFlush(testUser)).thenReturn(testUser);

        // when
        User result = userService.updateUser(userId, UserUpdateRequest.ofName("Renamed"));

        // then
        assertThat(result.getName()).isEqualTo("Renamed");
        assertThat(result.getEmail()).isEqualTo("test@example.com");
        assertThat(result.getUpdatedAt()).isAfter(originalUpdatedAt);
        assertThat(result.getCreatedAt()).isEqualTo(originalUpdatedAt);
        verify(userRepository, never()).findByEmail(any());
    }

    @Test
    @DisplayName("다른 User가 사용 중인 email로 수정하면 Conflict 예외가 발생한다")
    void updateUser_EmailTakenByAnotherUser() throws Exception {
        // given
        User other = User.builder().email("taken@example.com").name("Other").build();
        setField(other, "id", UUID.randomUUID());
        when(userRepository.findById(userId)).thenReturn(Optional.of(testUser));
        when(userRepository.findByEmail("taken@example.com")).thenReturn(Optional.of(other));

        // when & then
        assertThatThrownBy(() -> userService.updateUser(userId, UserUpdateRequest.ofEmail("taken@example.com")))
                .isInstanceOf(ConflictException.class)
                .hasMessage("email already exists");
        assertThat(testUser.getEmail()).isEqualTo("test@example.com");
        verify(userRepository, never()).saveAndFlush(any());
    }

    @Test
    @DisplayName("수정 시 사전 검사를 통과해도 저장소의 email 유니크 제약 위반은 Conflict로 변환된다")
    void updateUser_StorageConstraintViolation() {
        // given
        when(userRepository.findById(userId)).thenReturn(Optional.of(testUser));
        when(userRepository.findByEmail("race@example.com")).thenReturn(Optional.empty());
        when(userRepository.saveAndFlush(testUser)).thenThrow(new DataIntegrityViolationException(
                "could not execute statement",
                new SQLException("Unique index or primary key violation: \"PUBLIC.UK_USERS_EMAIL_INDEX_4\"")));

        // when & then
        assertThatThrownBy(() -> userService.updateUser(userId, UserUpdateRequest.ofEmail("race@example.com")))
                .isInstanceOf(ConflictException.class)
                .hasMessage("email already exists");
    }

    @Test
    @DisplayName("자신의 현재 email로 수정하는 것은 Conflict가 아니다")
    void updateUser_SameEmailSameUser() {
        // given
        when(userRepository.findById(userId)).thenReturn(Optional.of(testUser));
        when(userRepository.findByEmail("test@example.com")).thenReturn(Optional.of(testUser));
        when(userRepository.saveAndFlush(testUser)).thenReturn(testUser);

        // when
        User result = userService.updateUser(userId, UserUpdateRequest.ofEmail("test@example.com"));

        // then
        assertThat(result.getEmail()).isEqualTo("test@example.com");
        assertThat(result.getUpdatedAt()).isAfter(originalUpdatedAt);
    }

    @Test
    @DisplayName("존재하지 않는 User를 수정하면 NotFound 예외가 발생한다")
    void updateUser_NotFound() {
        // given
        UUID unknownId = UUID.randomUUID();
        when(userRepository.findById(unknownId)).thenReturn(Optional.empty());

        // when & then
        assertThatThrownBy(() -> userService.updateUser(unknownId, UserUpdateRequest.ofName("Nobody")))
                .isInstanceOf(NotFoundException.class)
                .satisfies(ex -> assertThat(((ApiException) ex).getKind()).isEqualTo(ErrorKind.NOT_FOUND));
        verify(userRepository, never()).saveAndFlush(any());
    }

    @Test
    @DisplayName("User를 삭제할 수 있다")
    void deleteUser_Success() {
        // given
        when(userRepository.deleteUserById(userId)).thenReturn(1);

        // when
        userService.deleteUser(userId);

        // then
        verify(userRepository, times(1)).deleteUserById(userId);
    }

    @Test
    @DisplayName("삭제된 행이 없으면 NotFound 예외가 발생한다")
    void deleteUser_NotFound() {
        // given
        when(userRepository.deleteUserById(userId)).thenReturn(0);

        // when & then
        assertThatThrownBy(() -> userService.deleteUser(userId))
                .isInstanceOf(NotFoundException.class)
                .hasMessage("user");
    }
}
