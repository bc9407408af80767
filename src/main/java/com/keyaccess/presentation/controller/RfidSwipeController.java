package com.keyaccess.presentation.controller;

import com.keyaccess.application.dto.SwipeResponseDto;
import com.keyaccess.application.service.AccessDecisionService;
import com.keyaccess.domain.exception.InvalidRequestException;
import com.keyaccess.domain.exception.LookupException;
import com.keyaccess.domain.model.AccessDecision;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Endpoint de pases de tarjeta de los controladores ESP32. La respuesta
 * conserva la misma forma en todos los estados; el controlador decide por
 * access_granted.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class RfidSwipeController {

    private final AccessDecisionService accessDecisionService;

    /**
     * GET/POST /api/rfid-swipe?code=...&room=...
     */
    @RequestMapping(value = "/rfid-swipe", method = { RequestMethod.GET, RequestMethod.POST })
    public ResponseEntity<SwipeResponseDto> swipe(
            @RequestParam(value = "code", required = false) String code,
            @RequestParam(value = "room", required = false) String room) {
        try {
            AccessDecision decision = accessDecisionService.decide(code, room);
            return ResponseEntity.ok(SwipeResponseDto.fromDecision(decision));

        } catch (InvalidRequestException e) {
            return ResponseEntity.badRequest().body(SwipeResponseDto.error("INVALID_REQUEST", e.getMessage()));
        } catch (LookupException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(SwipeResponseDto.error(e.getCode(), e.getMessage()));
        } catch (Exception e) {
            log.error("Error procesando pase {} en {}: {}", code, room, e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(SwipeResponseDto.error("SERVER_ERROR", "Error interno del servidor"));
        }
    }
}
