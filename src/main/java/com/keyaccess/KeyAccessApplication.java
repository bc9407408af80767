package com.keyaccess;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Keybox Access Server - Aplicación Principal
 *
 * Control de gabinetes de llaves de laboratorio con:
 * - Decisión de acceso por tarjeta RFID según el horario del periodo vigente
 * - Libro de préstamos y devoluciones en MySQL
 * - Sincronización de horarios para decisiones sin conexión de los ESP32
 * - Latidos de controladores y comandos manuales de puerta
 */
@SpringBootApplication
@EnableScheduling
public class KeyAccessApplication {

    public static void main(String[] args) {
        SpringApplication.run(KeyAccessApplication.class, args);
        System.out.println("\n" +
            "╔═══════════════════════════════════════════════════════════╗\n" +
            "║         Keybox Access Server - Started Successfully       ║\n" +
            "║                                                           ║\n" +
            "║  📡 ESP32 API: http://localhost:8080/api                  ║\n" +
            "║  🔔 Live events: ws://localhost:8080/ws/keybox            ║\n" +
            "╚═══════════════════════════════════════════════════════════╝\n"
        );
    }
}
