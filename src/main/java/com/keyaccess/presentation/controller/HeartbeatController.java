package com.keyaccess.presentation.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.keyaccess.application.service.DeviceHeartbeatService;
import com.keyaccess.domain.exception.LookupException;
import com.keyaccess.domain.model.Device;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Endpoint de latidos de los controladores. Acepta device_id y
 * firmware_version como parámetros de consulta, formulario o cuerpo JSON.
 */
@RestController
@RequestMapping("/api/esp32")
@RequiredArgsConstructor
@Slf4j
public class HeartbeatController {

    private final DeviceHeartbeatService heartbeatService;
    private final ObjectMapper objectMapper;

    /**
     * GET/POST /api/esp32/heartbeat
     */
    @RequestMapping(value = "/heartbeat", method = { RequestMethod.GET, RequestMethod.POST })
    public ResponseEntity<Map<String, Object>> heartbeat(
            HttpServletRequest request,
            @RequestBody(required = false) String body) {
        Map<String, Object> response = new LinkedHashMap<>();

        String deviceId = request.getParameter("device_id");
        String firmwareVersion = request.getParameter("firmware_version");
        if (isBlank(deviceId) && !isBlank(body)) {
            JsonNode json = readJson(body);
            if (json != null) {
                deviceId = text(json, "device_id");
                firmwareVersion = text(json, "firmware_version");
            }
        }

        if (isBlank(deviceId)) {
            log.warn("Latido rechazado: falta device_id ({} {})", request.getMethod(), request.getContentType());
            response.put("status", "error");
            response.put("message", "Falta el parámetro 'device_id'");
            response.put("hint", "Envíe device_id como parámetro GET, formulario POST o en un cuerpo JSON");
            return ResponseEntity.badRequest().body(response);
        }

        String ipAddress = clientAddress(request);
        try {
            Device device = heartbeatService.heartbeat(deviceId, firmwareVersion, ipAddress);
            response.put("status", "success");
            response.put("message", "Latido recibido");
            response.put("device_name", device.getDeviceName());
            response.put("room", device.getRoomCode());
            response.put("timestamp", device.getLastHeartbeat().toString());
            return ResponseEntity.ok(response);

        } catch (LookupException e) {
            response.put("status", "error");
            response.put("code", e.getCode());
            response.put("message", e.getMessage());
            response.put("device_id_received", e.getValue());
            response.put("hint", "Registre este dispositivo en la administración de controladores ESP32");
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(response);
        }
    }

    /**
     * Primera dirección de X-Forwarded-For, o la dirección remota.
     */
    private String clientAddress(HttpServletRequest request) {
        String forwarded = request.getHeader("X-Forwarded-For");
        if (!isBlank(forwarded)) {
            return forwarded.split(",")[0].trim();
        }
        return request.getRemoteAddr();
    }

    private JsonNode readJson(String body) {
        try {
            return objectMapper.readTree(body);
        } catch (IOException e) {
            log.warn("Cuerpo JSON de latido inválido: {}", e.getMessage());
            return null;
        }
    }

    private static String text(JsonNode json, String field) {
        JsonNode node = json.get(field);
        return node != null && !node.isNull() ? node.asText() : null;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
