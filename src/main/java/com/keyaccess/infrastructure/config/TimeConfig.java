package com.keyaccess.infrastructure.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Fuente única de tiempo de la aplicación. La zona horaria de los horarios
 * se configura con keybox.time-zone; vacía usa la del sistema.
 */
@Configuration
@Slf4j
public class TimeConfig {

    @Bean
    public Clock clock(@Value("${keybox.time-zone:}") String timeZone) {
        ZoneId zone = timeZone == null || timeZone.isBlank()
                ? ZoneId.systemDefault()
                : ZoneId.of(timeZone.trim());
        log.info("Zona horaria del sistema de llaves: {}", zone);
        return Clock.system(zone);
    }
}
