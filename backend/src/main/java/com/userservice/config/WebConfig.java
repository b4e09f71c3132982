package com.userservice.config;

import com.userservice.user.controller.UserController;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.method.HandlerTypePredicate;
import org.springframework.web.servlet.config.annotation.PathMatchConfigurer;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Nests the versioned API controllers under a common prefix ({@code /api/v1}
 * by default). Controllers outside the API packages, such as the health check,
 * stay at the root.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final String apiBasePath;

    public WebConfig(@Value("${app.api.base-path:/api/v1}") String apiBasePath) {
        this.apiBasePath = apiBasePath;
    }

    @Override
    public void configurePathMatch(PathMatchConfigurer configurer) {
        configurer.addPathPrefix(apiBasePath, HandlerTypePredicate.forBasePackageClass(UserController.class));
    }
}
