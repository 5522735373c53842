package com.hercare.backend.global.common.code;

import java.security.SecureRandom;

import org.springframework.stereotype.Component;

/**
 * 초대 코드/공유 코드 생성기 (대문자 + 숫자).
 */
@Component
public class AccessCodeGenerator {

    static final String ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";

    private final SecureRandom random = new SecureRandom();

    public String generate(int length) {
        if (length <= 0) {
            throw new IllegalArgumentException("length must be positive");
        }
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }
}
