package com.userservice.user.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.Optional;

/**
 * Partial update. An omitted field (or JSON null) stays {@link Optional#empty()}
 * and leaves the stored value untouched; a present field is validated and applied.
 *
 * Element constraints must accept null: an empty Optional is validated as a
 * null element, so {@code @NotBlank} would reject every omitted field.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class UserUpdateRequest {

    static final String NON_BLANK = "(?s).*\\S.*";

    private Optional<@Pattern(regexp = NON_BLANK, message = "email must not be blank")
            @Email(message = "email must be a valid address") String> email = Optional.empty();

    private Optional<@Pattern(regexp = NON_BLANK, message = "name must not be blank")
            @Size(max = 100, message = "name must be at most 100 characters") String> name = Optional.empty();

    public static UserUpdateRequest ofName(String name) {
        return new UserUpdateRequest(Optional.empty(), Optional.of(name));
    }

    public static UserUpdateRequest ofEmail(String email) {
        return new UserUpdateRequest(Optional.of(email), Optional.empty());
    }
}
