package com.mergington.highschool.security;

import com.mergington.highschool.repository.TeacherRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Accepts any username that has a record in the teachers collection.
 */
@Component
@RequiredArgsConstructor
public class TeacherDirectoryCredentialVerifier implements CredentialVerifier {

    private final TeacherRepository teacherRepository;

    @Override
    public boolean verify(String identity) {
        if (identity == null || identity.isBlank()) {
            return false;
        }
        return teacherRepository.existsById(identity);
    }
}
