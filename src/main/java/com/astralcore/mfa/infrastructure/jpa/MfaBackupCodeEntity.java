package com.astralcore.mfa.infrastructure.jpa;

import jakarta.persistence.*;
import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(name = "mfa_backup_codes", indexes = @Index(name = "idx_mfa_backup_codes_setting", columnList = "setting_id"))
public class MfaBackupCodeEntity {

    @Id
    private UUID id = UUID.randomUUID();

    @Column(name = "setting_id", nullable = false)
    private UUID settingId;

    @Column(name = "encrypted_code", nullable = false, length = 512)
    private String encryptedCode;

    @Column(nullable = false)
    private int position;

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();

    // Constructors
    public MfaBackupCodeEntity() {}

    public MfaBackupCodeEntity(UUID settingId, String encryptedCode, int position, OffsetDateTime createdAt) {
        this.settingId = settingId;
        this.encryptedCode = encryptedCode;
        this.position = position;
        this.createdAt = createdAt;
    }

    // Getters and Setters
    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public UUID getSettingId() { return settingId; }
    public void setSettingId(UUID settingId) { this.settingId = settingId; }

    public String getEncryptedCode() { return encryptedCode; }
    public void setEncryptedCode(String encryptedCode) { this.encryptedCode = encryptedCode; }

    public int getPosition() { return position; }
    public void setPosition(int position) { this.position = position; }

    public OffsetDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(OffsetDateTime createdAt) { this.createdAt = createdAt; }
}
