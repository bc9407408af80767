package com.keyaccess.presentation.controller;

import com.keyaccess.application.dto.DeviceStatusDto;
import com.keyaccess.application.dto.TermChangeRequest;
import com.keyaccess.application.service.DeviceHeartbeatService;
import com.keyaccess.application.service.SessionLedgerService;
import com.keyaccess.application.service.TermRegistryService;
import com.keyaccess.domain.exception.InvalidRequestException;
import com.keyaccess.domain.model.TermState;
import com.keyaccess.presentation.websocket.AccessWebSocketHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Controlador REST para consultar el estado del sistema y administrar el
 * periodo académico vigente.
 */
@RestController
@RequestMapping("/api/system")
@RequiredArgsConstructor
public class SystemStatusController {

    private final TermRegistryService termRegistryService;
    private final DeviceHeartbeatService heartbeatService;
    private final SessionLedgerService sessionLedgerService;
    private final AccessWebSocketHandler webSocketHandler;
    private final Clock clock;

    /**
     * GET /api/system/status
     * Devuelve el estado completo del sistema en un solo JSON.
     */
    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> getSystemStatus() {
        Map<String, Object> status = new LinkedHashMap<>();

        status.put("term", termBody(termRegistryService.currentState()));

        List<DeviceStatusDto> devices = heartbeatService.deviceStatuses();
        Map<String, Object> deviceSummary = new LinkedHashMap<>();
        deviceSummary.put("online", devices.stream().filter(DeviceStatusDto::isOnline).count());
        deviceSummary.put("total", devices.size());
        status.put("devices", deviceSummary);

        status.put("keysOut", sessionLedgerService.countKeysOut());
        status.put("connectedWebSocketClients", webSocketHandler.getConnectedClients());
        status.put("serverTime", LocalDateTime.now(clock).format(DateTimeFormatter.ISO_LOCAL_DATE_TIME));

        return ResponseEntity.ok(status);
    }

    /**
     * GET /api/system/term
     */
    @GetMapping("/term")
    public ResponseEntity<Map<String, Object>> getTerm() {
        return ResponseEntity.ok(termBody(termRegistryService.currentState()));
    }

    /**
     * PUT /api/system/term
     * Cambia el periodo vigente (academic_year AAAA-AAAA, semester 1st, 2nd,
     * summer o summer2).
     */
    @PutMapping("/term")
    public ResponseEntity<Map<String, Object>> changeTerm(@RequestBody(required = false) TermChangeRequest request) {
        if (request == null) {
            throw InvalidRequestException.missingParameter("academic_year");
        }
        TermState updated = termRegistryService.changeTerm(request.getAcademicYear(), request.getSemester());
        return ResponseEntity.ok(termBody(updated));
    }

    private Map<String, Object> termBody(TermState state) {
        Map<String, Object> term = new LinkedHashMap<>();
        term.put("academic_year", state.term().academicYear());
        term.put("semester", state.term().semester());
        term.put("updated_at", state.updatedAt() != null ? state.updatedAt().toString() : null);
        return term;
    }
}
