package com.keyaccess.presentation.controller;

import com.keyaccess.application.dto.DeviceStatusDto;
import com.keyaccess.application.service.DeviceHeartbeatService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Vista del personal sobre el estado de los controladores.
 */
@RestController
@RequestMapping("/api/esp32")
@RequiredArgsConstructor
public class DeviceStatusController {

    private final DeviceHeartbeatService heartbeatService;
    private final Clock clock;

    /**
     * GET /api/esp32/status
     */
    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> getDeviceStatus() {
        List<DeviceStatusDto> devices = heartbeatService.deviceStatuses();

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "success");
        response.put("devices", devices);
        response.put("online_count", devices.stream().filter(DeviceStatusDto::isOnline).count());
        response.put("total_count", devices.size());
        response.put("server_time", LocalDateTime.now(clock).toString());
        return ResponseEntity.ok(response);
    }
}
