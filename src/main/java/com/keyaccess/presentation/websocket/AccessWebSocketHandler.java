package com.keyaccess.presentation.websocket;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.keyaccess.application.dto.AccessEventDto;
import com.keyaccess.application.dto.DeviceStatusDto;
import com.keyaccess.application.dto.ManualCommandDto;
import com.keyaccess.domain.model.AcademicTerm;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * Handler de WebSocket que envía al panel del personal los eventos del
 * sistema de llaves en tiempo real.
 */
@Component
@Slf4j
public class AccessWebSocketHandler extends TextWebSocketHandler {

    private final CopyOnWriteArraySet<WebSocketSession> sessions = new CopyOnWriteArraySet<>();
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        sessions.add(session);
        log.info("Nueva conexión WebSocket: {} (Total: {})", session.getId(), sessions.size());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        sessions.remove(session);
        log.info("Conexión WebSocket cerrada: {} (Restantes: {})", session.getId(), sessions.size());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        log.debug("Mensaje recibido de {}: {}", session.getId(), message.getPayload());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.error("Error en WebSocket {}: {}", session.getId(), exception.getMessage());
        sessions.remove(session);
    }

    /**
     * Notifica una decisión de acceso (concedida o denegada).
     *
     * @param event datos del pase
     */
    public void broadcastDecision(AccessEventDto event) {
        broadcast("ACCESS_DECISION", event);
    }

    /**
     * Notifica un pase con tarjeta o laboratorio desconocido.
     *
     * @param code     código del fallo (CREDENTIAL_UNKNOWN, ROOM_UNKNOWN)
     * @param badge    código de tarjeta recibido
     * @param roomCode laboratorio recibido
     * @param message  descripción
     */
    public void broadcastLookupFailure(String code, String badge, String roomCode, String message) {
        broadcast("LOOKUP_FAILURE", new LookupFailureData(code, badge, roomCode, message));
    }

    /**
     * Notifica el cambio de periodo académico.
     */
    public void broadcastTermChanged(AcademicTerm term, String changedAt) {
        broadcast("TERM_CHANGED", new TermChangedData(term.academicYear(), term.semester(), changedAt));
    }

    /**
     * Notifica un comando manual emitido por el personal.
     */
    public void broadcastManualCommand(ManualCommandDto command) {
        broadcast("MANUAL_COMMAND", command);
    }

    /**
     * Notifica que un controlador pasó a estar en línea o fuera de línea.
     */
    public void broadcastDeviceStatus(DeviceStatusDto status) {
        broadcast("DEVICE_STATUS", status);
    }

    /**
     * Notifica un latido de un controlador no registrado.
     *
     * @param deviceId  identificador de hardware recibido
     * @param ipAddress dirección de origen
     */
    public void broadcastUnregisteredDevice(String deviceId, String ipAddress) {
        broadcast("UNREGISTERED_DEVICE", new UnregisteredDeviceData(deviceId, ipAddress));
    }

    /**
     * Método genérico para broadcast de mensajes.
     */
    private void broadcast(String type, Object data) {
        if (sessions.isEmpty()) {
            log.debug("No hay clientes WebSocket conectados");
            return;
        }

        try {
            String json = objectMapper.writeValueAsString(new WebSocketMessage(type, data));
            TextMessage message = new TextMessage(json);

            for (WebSocketSession session : sessions) {
                if (session.isOpen()) {
                    try {
                        session.sendMessage(message);
                    } catch (IOException e) {
                        log.error("Error enviando a sesión {}: {}", session.getId(), e.getMessage());
                        sessions.remove(session);
                    }
                }
            }

            log.debug("Broadcast {} enviado a {} clientes", type, sessions.size());

        } catch (Exception e) {
            log.error("Error creando mensaje JSON: {}", e.getMessage());
        }
    }

    /**
     * Obtiene el número de clientes conectados.
     */
    public int getConnectedClients() {
        return sessions.size();
    }

    record WebSocketMessage(String type, Object data) {
    }

    record LookupFailureData(String code, String badgeCode, String roomCode, String message) {
    }

    record TermChangedData(String academicYear, String semester, String changedAt) {
    }

    record UnregisteredDeviceData(String deviceId, String ipAddress) {
    }
}
