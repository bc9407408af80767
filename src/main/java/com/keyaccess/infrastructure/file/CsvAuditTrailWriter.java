package com.keyaccess.infrastructure.file;

import com.keyaccess.domain.exception.CsvProcessingException;
import com.keyaccess.domain.model.KeyAction;
import com.keyaccess.domain.model.TransactionRecord;
import com.keyaccess.domain.model.TransactionSnapshot;
import com.keyaccess.domain.port.AuditTrailWriter;
import com.opencsv.CSVWriter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Espejo CSV del libro de transacciones: un archivo por día
 * (keybox_audit_yyyy-MM-dd.csv) con una línea por cada registro insertado o
 * cerrado.
 *
 * <p>No mantiene el archivo abierto (abrir-escribir-cerrar en cada línea) para
 * que pueda moverse o borrarse mientras el servidor corre.
 */
@Component
@Slf4j
public class CsvAuditTrailWriter implements AuditTrailWriter {

    static final String[] CSV_HEADER = {
            "transaction_id", "timestamp", "rfid_code", "faculty_name", "room_code",
            "academic_year", "semester", "access_granted", "action", "denial_code", "denial_reason"
    };

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final DateTimeFormatter FILE_DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd");

    private final boolean enabled;
    private final String auditPath;
    private final Clock clock;
    private final Object writeLock = new Object();

    public CsvAuditTrailWriter(
            @Value("${audit.csv-enabled:true}") boolean enabled,
            @Value("${audit.csv-path:./audit_logs}") String auditPath,
            Clock clock) {
        this.enabled = enabled;
        this.auditPath = auditPath;
        this.clock = clock;
    }

    @Override
    public void append(TransactionRecord record, KeyAction action) {
        if (!enabled) {
            return;
        }

        synchronized (writeLock) {
            Path filePath = currentFile();
            try {
                if (filePath.getParent() != null && !Files.exists(filePath.getParent())) {
                    Files.createDirectories(filePath.getParent());
                    log.info("Directorio de auditoría creado: {}", filePath.getParent().toAbsolutePath());
                }

                boolean newFile = !Files.exists(filePath);
                try (CSVWriter writer = new CSVWriter(new OutputStreamWriter(
                        new FileOutputStream(filePath.toFile(), true), StandardCharsets.UTF_8))) {
                    if (newFile) {
                        writer.writeNext(CSV_HEADER);
                        log.info("Nuevo archivo de auditoría: {}", filePath);
                    }
                    writer.writeNext(formatRecord(record, action));
                }
                log.debug("Registro {} reflejado en {}", record.getId(), filePath.getFileName());

            } catch (IOException e) {
                throw CsvProcessingException.cannotWrite(filePath.toString(), e);
            }
        }
    }

    /**
     * Archivo del día actual según el reloj del sistema.
     */
    Path currentFile() {
        String fileName = "keybox_audit_" + LocalDate.now(clock).format(FILE_DATE_FORMAT) + ".csv";
        return Paths.get(auditPath).resolve(fileName);
    }

    private String[] formatRecord(TransactionRecord record, KeyAction action) {
        TransactionSnapshot snapshot = record.getSnapshot();
        LocalDateTime timestamp = action == KeyAction.RETURN && record.getCloseTime() != null
                ? record.getCloseTime()
                : record.getOpenTime();

        return new String[] {
                record.getId() != null ? String.valueOf(record.getId()) : "",
                timestamp != null ? timestamp.format(TIMESTAMP_FORMAT) : "",
                snapshot != null ? nullToEmpty(snapshot.badgeCode()) : "",
                snapshot != null ? nullToEmpty(snapshot.facultyName()) : "",
                snapshot != null ? nullToEmpty(snapshot.roomCode()) : "",
                record.getTerm() != null ? record.getTerm().academicYear() : "",
                record.getTerm() != null ? record.getTerm().semester() : "",
                String.valueOf(record.isAccessGranted()),
                action.getWireValue(),
                record.getDenialCode() != null ? record.getDenialCode().name() : "",
                nullToEmpty(record.getDenialReason())
        };
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
