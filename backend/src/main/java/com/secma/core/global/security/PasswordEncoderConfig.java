package com.secma.core.global.security;

import java.util.Map;

import com.secma.core.global.config.SecmaProperties;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.DelegatingPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

@Configuration
public class PasswordEncoderConfig {

    public static final String BCRYPT_ID = "bcrypt";

    @Bean
    public PasswordEncoder passwordEncoder(SecmaProperties properties) {
        int strength = properties.password().bcryptStrength();
        Map<String, PasswordEncoder> encoders = Map.of(BCRYPT_ID, new BCryptPasswordEncoder(strength));
        return new DelegatingPasswordEncoder(BCRYPT_ID, encoders);
    }
}
