package com.keyaccess.infrastructure.persistence;

import com.keyaccess.domain.model.Credential;
import com.keyaccess.domain.model.Faculty;
import com.keyaccess.domain.port.CredentialDirectory;
import com.keyaccess.infrastructure.persistence.entity.CredentialEntity;
import com.keyaccess.infrastructure.persistence.entity.FacultyEntity;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Implementación del puerto CredentialDirectory usando JPA.
 */
@Component
@RequiredArgsConstructor
public class CredentialDirectoryImpl implements CredentialDirectory {

    private final JpaCredentialRepository credentialRepository;

    @Override
    @Transactional(readOnly = true)
    public Optional<Credential> findByBadgeCode(String badgeCode) {
        if (badgeCode == null) {
            return Optional.empty();
        }
        return credentialRepository.findByBadgeCodeWithRelations(badgeCode.trim())
                .map(this::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public List<String> findActiveBadgeCodes(Long facultyId, Long roomId) {
        return credentialRepository.findActiveBadgeCodes(facultyId, roomId);
    }

    /**
     * Convierte una entidad JPA a una tarjeta de dominio.
     */
    private Credential toDomain(CredentialEntity entity) {
        return Credential.builder()
                .id(entity.getId())
                .badgeCode(entity.getBadgeCode())
                .faculty(toDomain(entity.getFaculty()))
                .room(RoomDirectoryImpl.toDomain(entity.getRoom()))
                .active(Boolean.TRUE.equals(entity.getActive()))
                .build();
    }

    private Faculty toDomain(FacultyEntity entity) {
        return Faculty.builder()
                .id(entity.getId())
                .schoolId(entity.getSchoolId())
                .fullName(entity.getFullName())
                .department(entity.getDepartment())
                .active(Boolean.TRUE.equals(entity.getActive()))
                .build();
    }
}
