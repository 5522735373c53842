package com.hercare.backend.global.config;

import com.hercare.backend.global.security.RoleRequirementInterceptor;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final RoleRequirementInterceptor roleRequirementInterceptor;

    public WebConfig(RoleRequirementInterceptor roleRequirementInterceptor) {
        this.roleRequirementInterceptor = roleRequirementInterceptor;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(roleRequirementInterceptor);
    }
}
