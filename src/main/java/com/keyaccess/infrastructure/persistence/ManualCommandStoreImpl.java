package com.keyaccess.infrastructure.persistence;

import com.keyaccess.domain.model.DoorAction;
import com.keyaccess.domain.model.ManualCommand;
import com.keyaccess.domain.port.ManualCommandStore;
import com.keyaccess.infrastructure.persistence.entity.ManualCommandEntity;
import com.keyaccess.infrastructure.persistence.entity.RoomEntity;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Implementación del puerto ManualCommandStore usando JPA.
 */
@Component
@RequiredArgsConstructor
public class ManualCommandStoreImpl implements ManualCommandStore {

    private final JpaManualCommandRepository commandRepository;
    private final JpaRoomRepository roomRepository;

    @Override
    @Transactional
    public ManualCommand append(ManualCommand command) {
        RoomEntity room = roomRepository.getReferenceById(command.getRoomId());
        ManualCommandEntity saved = commandRepository.save(ManualCommandEntity.builder()
                .room(room)
                .staffName(command.getStaffName())
                .action(command.getAction().getWireValue())
                .notes(command.getNotes())
                .createdAt(command.getCreatedAt())
                .build());

        command.setId(saved.getId());
        return command;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ManualCommand> findLatestSince(String roomCode, LocalDateTime since) {
        return commandRepository
                .findFirstByRoom_CodeAndCreatedAtGreaterThanEqualOrderByCreatedAtDescIdDesc(roomCode, since)
                .map(this::toDomain);
    }

    private ManualCommand toDomain(ManualCommandEntity entity) {
        return ManualCommand.builder()
                .id(entity.getId())
                .roomId(entity.getRoom().getId())
                .roomCode(entity.getRoom().getCode())
                .staffName(entity.getStaffName())
                .action(DoorAction.fromWireValue(entity.getAction()).orElse(null))
                .notes(entity.getNotes())
                .createdAt(entity.getCreatedAt())
                .build();
    }
}
