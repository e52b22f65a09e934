package com.schoolerp.backend.modules.school.application;

import java.security.SecureRandom;

import org.springframework.stereotype.Component;

@Component
public class SecureRandomJoinCodeGenerator implements JoinCodeGenerator {

    private final SecureRandom random = new SecureRandom();

    @Override
    public String randomDigits(int length) {
        if (length <= 0) {
            throw new IllegalArgumentException("length must be positive");
        }
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append((char) ('0' + random.nextInt(10)));
        }
        return sb.toString();
    }
}
