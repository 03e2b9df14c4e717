package com.platform.drcontrol.api;

import com.platform.drcontrol.api.dto.BackupRequest;
import com.platform.drcontrol.api.dto.BackupResponse;
import com.platform.drcontrol.backup.BackupManager;
import com.platform.drcontrol.backup.BackupType;
import com.platform.drcontrol.model.TableIdentifier;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for on-demand table backups.
 */
@RestController
@RequestMapping("/api/backups")
@RequiredArgsConstructor
public class BackupController {
    
    private final BackupManager backupManager;
    
    @PostMapping
    public ResponseEntity<BackupResponse> backup(@Valid @RequestBody BackupRequest request) {
        BackupType type = BackupType.fromWireName(request.backupType());
        return ResponseEntity.ok(BackupResponse.from(
            backupManager.runBackup(TableIdentifier.of(request.tableName()), type)));
    }
}
