package com.keyaccess.presentation.controller;

import com.keyaccess.application.dto.ManualCommandDto;
import com.keyaccess.application.dto.ManualCommandRequest;
import com.keyaccess.application.service.CommandRelayService;
import com.keyaccess.domain.exception.InvalidRequestException;
import com.keyaccess.domain.model.ManualCommand;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Comandos manuales de puerta: emisión por el personal y consulta periódica
 * de los controladores.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class ManualCommandController {

    private final CommandRelayService commandRelayService;

    /**
     * GET/POST /api/manual-trigger?room=...
     */
    @RequestMapping(value = "/manual-trigger", method = { RequestMethod.GET, RequestMethod.POST })
    public ResponseEntity<Map<String, Object>> poll(@RequestParam(value = "room", required = false) String room) {
        Map<String, Object> response = new LinkedHashMap<>();
        try {
            Optional<ManualCommand> command = commandRelayService.pollCommands(room);
            if (command.isPresent()) {
                ManualCommand c = command.get();
                response.put("has_trigger", true);
                response.put("action", c.getAction().getWireValue());
                response.put("room", c.getRoomCode());
                response.put("message", "Comando manual " + c.getAction().getWireValue());
                response.put("timestamp", c.getCreatedAt().toString());
                response.put("staff", c.getStaffName());
            } else {
                response.put("has_trigger", false);
                response.put("action", "");
                response.put("message", "Sin comandos pendientes");
            }
            return ResponseEntity.ok(response);

        } catch (InvalidRequestException e) {
            response.put("has_trigger", false);
            response.put("action", "");
            response.put("message", e.getMessage());
            return ResponseEntity.badRequest().body(response);
        } catch (Exception e) {
            log.error("Error consultando comandos de {}: {}", room, e.getMessage(), e);
            response.put("has_trigger", false);
            response.put("action", "");
            response.put("message", "Error interno del servidor");
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
        }
    }

    /**
     * POST /api/manual-commands
     */
    @PostMapping("/manual-commands")
    public ResponseEntity<ManualCommandDto> issue(@RequestBody(required = false) ManualCommandRequest request) {
        if (request == null) {
            throw InvalidRequestException.missingParameter("room");
        }
        ManualCommandDto command = commandRelayService.issueCommand(
                request.getRoom(), request.getStaff(), request.getAction(), request.getNotes());
        return ResponseEntity.status(HttpStatus.CREATED).body(command);
    }
}
