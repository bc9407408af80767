package com.keyaccess.presentation.controller;

import com.keyaccess.application.dto.OfflineAccessRequest;
import com.keyaccess.application.dto.ScheduleDownloadDto;
import com.keyaccess.application.service.ScheduleSyncService;
import com.keyaccess.domain.model.AcademicTerm;
import com.keyaccess.domain.model.LedgerEntry;
import com.keyaccess.domain.port.TermProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Endpoints de sincronización de horarios para los controladores ESP32.
 */
@RestController
@RequestMapping("/api/esp32")
@RequiredArgsConstructor
@Slf4j
public class ScheduleSyncController {

    private final ScheduleSyncService scheduleSyncService;
    private final TermProvider termProvider;
    private final Clock clock;

    /**
     * GET/POST /api/esp32/schedules?room=...
     */
    @RequestMapping(value = "/schedules", method = { RequestMethod.GET, RequestMethod.POST })
    public ResponseEntity<ScheduleDownloadDto> downloadSchedules(
            @RequestParam(value = "room", required = false) String room) {
        return ResponseEntity.ok(scheduleSyncService.downloadSchedule(room));
    }

    /**
     * GET /api/esp32/check-updates?room=...&last_sync=...
     */
    @GetMapping("/check-updates")
    public ResponseEntity<Map<String, Object>> checkUpdates(
            @RequestParam(value = "room", required = false) String room,
            @RequestParam(value = "last_sync", required = false) String lastSync) {
        boolean needsUpdate = scheduleSyncService.needsUpdate(room, lastSync);
        AcademicTerm term = termProvider.currentTerm();

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "success");
        response.put("needs_update", needsUpdate);
        response.put("current_semester", term.semester());
        response.put("current_ay", term.academicYear());
        response.put("server_time", LocalDateTime.now(clock).toString());
        response.put("message", needsUpdate ? "Actualización requerida" : "Horarios al día");
        return ResponseEntity.ok(response);
    }

    /**
     * POST /api/esp32/log-offline
     */
    @PostMapping("/log-offline")
    public ResponseEntity<Map<String, Object>> logOffline(@RequestBody(required = false) OfflineAccessRequest request) {
        LedgerEntry entry = scheduleSyncService.logOfflineAccess(request);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "success");
        response.put("message", "Acceso sin conexión registrado");
        response.put("transaction_id", entry.record().getId());
        response.put("action", entry.action().getWireValue());
        return ResponseEntity.ok(response);
    }
}
