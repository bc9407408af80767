package com.keyaccess.infrastructure.persistence;

import com.keyaccess.infrastructure.persistence.entity.RoomEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repositorio JPA para operaciones con rooms.
 */
@Repository
public interface JpaRoomRepository extends JpaRepository<RoomEntity, Long> {

    Optional<RoomEntity> findByCode(String code);
}
