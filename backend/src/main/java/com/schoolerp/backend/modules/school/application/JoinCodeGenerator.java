package com.schoolerp.backend.modules.school.application;

public interface JoinCodeGenerator {

    /**
     * Returns exactly {@code length} ASCII digits; leading zeros are allowed.
     */
    String randomDigits(int length);
}
