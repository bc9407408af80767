package com.keyaccess.application.service;

import com.keyaccess.domain.model.AccessDecision;

/**
 * Interfaz del motor de decisión de acceso a los gabinetes de llaves.
 */
public interface AccessDecisionService {

    /**
     * Evalúa un pase de tarjeta en el instante actual y lo registra en el
     * libro de transacciones.
     *
     * @param badgeCode código de la tarjeta leída
     * @param roomCode  código del laboratorio del lector
     * @return decisión con acción, mensaje y motivo de denegación
     * @throws com.keyaccess.domain.exception.InvalidRequestException si falta un parámetro
     * @throws com.keyaccess.domain.exception.LookupException si la tarjeta o el laboratorio no existen
     */
    AccessDecision decide(String badgeCode, String roomCode);
}
