package com.userservice.user.mapper;

import com.userservice.user.domain.User;
import com.userservice.user.dto.UserResponse;
import org.mapstruct.Mapper;

@Mapper(componentModel = "spring")
public interface UserMapper {

    UserResponse toResponse(User user);
}
