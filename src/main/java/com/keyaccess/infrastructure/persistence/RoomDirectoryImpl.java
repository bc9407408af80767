package com.keyaccess.infrastructure.persistence;

import com.keyaccess.domain.model.Room;
import com.keyaccess.domain.port.RoomDirectory;
import com.keyaccess.infrastructure.persistence.entity.RoomEntity;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Implementación del puerto RoomDirectory usando JPA.
 */
@Component
@RequiredArgsConstructor
public class RoomDirectoryImpl implements RoomDirectory {

    private final JpaRoomRepository roomRepository;

    @Override
    @Transactional(readOnly = true)
    public Optional<Room> findByCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return roomRepository.findByCode(code.trim()).map(RoomDirectoryImpl::toDomain);
    }

    static Room toDomain(RoomEntity entity) {
        return Room.builder()
                .id(entity.getId())
                .code(entity.getCode())
                .description(entity.getDescription())
                .active(Boolean.TRUE.equals(entity.getActive()))
                .build();
    }
}
